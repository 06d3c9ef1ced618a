package com.williamcallahan.mathcore.service.mathml;

/**
 * Contiguous UTF-8 byte range of the source a node was built from.
 *
 * @param start first byte
 * @param end end byte, exclusive
 */
public record SourceSpan(int start, int end) {

    public SourceSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid source span: " + start + ".." + end);
        }
    }

    public static SourceSpan at(int offset) {
        return new SourceSpan(offset, offset);
    }

    /**
     * Returns the smallest span covering both spans.
     *
     * @param other span to include
     * @return covering span
     */
    public SourceSpan union(SourceSpan other) {
        return new SourceSpan(Math.min(start, other.start), Math.max(end, other.end));
    }
}
