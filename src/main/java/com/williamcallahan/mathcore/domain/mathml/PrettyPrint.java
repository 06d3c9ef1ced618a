package com.williamcallahan.mathcore.domain.mathml;

import java.util.Locale;

/**
 * Controls whether newlines and indentation are inserted into the MathML output.
 */
public enum PrettyPrint {
    /**
     * Single line, no inserted whitespace.
     */
    NEVER,

    /**
     * Multi-line output with fixed-step indentation.
     */
    ALWAYS,

    /**
     * Compact unless the expression contains a table-like environment.
     */
    AUTO;

    /**
     * Parses a pretty-print setting. The legacy boolean spellings are still accepted:
     * {@code true} means {@link #ALWAYS} and {@code false} means {@link #NEVER}.
     *
     * @param value setting name
     * @return parsed setting; null or blank selects {@link #NEVER}
     */
    public static PrettyPrint fromName(String value) {
        if (value == null || value.isBlank()) {
            return NEVER;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "never", "false" -> NEVER;
            case "always", "true" -> ALWAYS;
            case "auto" -> AUTO;
            default -> throw new IllegalArgumentException(
                "Invalid pretty_print value: '" + value + "'. Must be 'never', 'always', or 'auto'.");
        };
    }
}
