package com.williamcallahan.mathcore.service.latex;

import java.util.Objects;

/**
 * Located conversion failure.
 *
 * @param kind failure category
 * @param offset UTF-8 byte offset into the converted source
 * @param message human-readable message without a trailing period
 */
public record LatexError(LatexErrorKind kind, int offset, String message) {

    public LatexError {
        Objects.requireNonNull(kind, "Error kind cannot be null");
        Objects.requireNonNull(message, "Error message cannot be null");
        if (offset < 0) {
            throw new IllegalArgumentException("Error offset cannot be negative");
        }
    }

    /**
     * Formats the error as {@code "{offset}: {message}."}.
     *
     * @return textual rendering used in logs and fallback titles
     */
    public String describe() {
        return offset + ": " + message + ".";
    }
}
