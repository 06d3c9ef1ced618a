package com.williamcallahan.mathcore.service.latex;

/**
 * UTF-8 byte offset arithmetic over Java strings.
 */
public final class Utf8 {

    private Utf8() {
    }

    /**
     * Returns the number of UTF-8 bytes that encode a codepoint.
     *
     * @param codepoint Unicode codepoint
     * @return 1 to 4
     */
    public static int byteLength(int codepoint) {
        if (codepoint < 0x80) {
            return 1;
        }
        if (codepoint < 0x800) {
            return 2;
        }
        if (codepoint < 0x10000) {
            return 3;
        }
        return 4;
    }

    /**
     * Converts a UTF-8 byte offset into a char index of the same string. Offsets inside a
     * multi-byte sequence resolve to the start of that codepoint; offsets past the end clamp to the
     * string length.
     *
     * @param text source string
     * @param byteOffset UTF-8 byte offset
     * @return char index
     */
    public static int charIndex(String text, int byteOffset) {
        int bytes = 0;
        int index = 0;
        while (index < text.length()) {
            int cp = text.codePointAt(index);
            int width = byteLength(cp);
            if (bytes + width > byteOffset) {
                return index;
            }
            bytes += width;
            index += Character.charCount(cp);
        }
        return text.length();
    }

    /**
     * Returns the suffix of a string starting at a UTF-8 byte offset.
     *
     * @param text source string
     * @param byteOffset UTF-8 byte offset
     * @return remaining text
     */
    public static String suffixFrom(String text, int byteOffset) {
        return text.substring(charIndex(text, byteOffset));
    }
}
