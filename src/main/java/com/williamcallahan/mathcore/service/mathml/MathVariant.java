package com.williamcallahan.mathcore.service.mathml;

import java.util.Map;

/**
 * Math alphabets selected by {@code \mathbf}, {@code \mathbb} and friends.
 *
 * <p>Letters and digits map into the Mathematical Alphanumeric Symbols block, with the older
 * Letterlike Symbols codepoints used where the block has holes. {@link #NORMAL} keeps the
 * character and marks the identifier upright instead.</p>
 */
public enum MathVariant {
    NORMAL(0, 0, 0, Map.of()),
    BOLD(0x1D400, 0x1D41A, 0x1D7CE, Map.of()),
    ITALIC(0x1D434, 0x1D44E, 0, Map.of('h', 0x210E)),
    DOUBLE_STRUCK(0x1D538, 0x1D552, 0x1D7D8, Map.of(
        'C', 0x2102, 'H', 0x210D, 'N', 0x2115, 'P', 0x2119, 'Q', 0x211A, 'R', 0x211D, 'Z', 0x2124)),
    SCRIPT(0x1D49C, 0x1D4B6, 0, Map.ofEntries(
        Map.entry('B', 0x212C), Map.entry('E', 0x2130), Map.entry('F', 0x2131), Map.entry('H', 0x210B),
        Map.entry('I', 0x2110), Map.entry('L', 0x2112), Map.entry('M', 0x2133), Map.entry('R', 0x211B),
        Map.entry('e', 0x212F), Map.entry('g', 0x210A), Map.entry('o', 0x2134))),
    FRAKTUR(0x1D504, 0x1D51E, 0, Map.of('C', 0x212D, 'H', 0x210C, 'I', 0x2111, 'R', 0x211C, 'Z', 0x2128)),
    SANS_SERIF(0x1D5A0, 0x1D5BA, 0x1D7E2, Map.of()),
    MONOSPACE(0x1D670, 0x1D68A, 0x1D7F6, Map.of());

    private final int upperBase;
    private final int lowerBase;
    private final int digitBase;
    private final Map<Character, Integer> exceptions;

    MathVariant(int upperBase, int lowerBase, int digitBase, Map<Character, Integer> exceptions) {
        this.upperBase = upperBase;
        this.lowerBase = lowerBase;
        this.digitBase = digitBase;
        this.exceptions = exceptions;
    }

    /**
     * Maps one codepoint into this alphabet. Characters without a styled form are returned as-is.
     *
     * @param codepoint source codepoint
     * @return styled text
     */
    public String apply(int codepoint) {
        if (this == NORMAL) {
            return new String(Character.toChars(codepoint));
        }
        if (codepoint < 0x80) {
            Integer exception = exceptions.get((char) codepoint);
            if (exception != null) {
                return new String(Character.toChars(exception));
            }
        }
        int mapped = codepoint;
        if (codepoint >= 'A' && codepoint <= 'Z') {
            mapped = upperBase + (codepoint - 'A');
        } else if (codepoint >= 'a' && codepoint <= 'z') {
            mapped = lowerBase + (codepoint - 'a');
        } else if (codepoint >= '0' && codepoint <= '9' && digitBase != 0) {
            mapped = digitBase + (codepoint - '0');
        }
        return new String(Character.toChars(mapped));
    }

    /**
     * Maps every codepoint of a string into this alphabet.
     *
     * @param text source text
     * @return styled text
     */
    public String apply(String text) {
        StringBuilder styled = new StringBuilder();
        text.codePoints().forEach(cp -> styled.append(apply(cp)));
        return styled.toString();
    }
}
