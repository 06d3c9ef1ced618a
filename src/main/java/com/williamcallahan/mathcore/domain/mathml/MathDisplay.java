package com.williamcallahan.mathcore.domain.mathml;

import java.util.Locale;

/**
 * Display mode of a formula.
 */
public enum MathDisplay {
    /**
     * Inline math, like {@code $...$} in LaTeX.
     */
    INLINE,

    /**
     * Block (display-style) math, like {@code $$...$$} in LaTeX. Only block formulas carry the
     * {@code display="block"} attribute.
     */
    BLOCK;

    /**
     * Parses a display mode name, case-insensitively.
     *
     * @param value "inline" or "block"; null selects inline
     * @return the parsed display mode
     */
    public static MathDisplay fromName(String value) {
        if (value == null || value.isBlank()) {
            return INLINE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "inline" -> INLINE;
            case "block", "display" -> BLOCK;
            default -> throw new IllegalArgumentException(
                "Invalid display value: '" + value + "'. Must be 'inline' or 'block'.");
        };
    }
}
