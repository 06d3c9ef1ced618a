package com.williamcallahan.mathcore.service.document;

/**
 * Opening and closing delimiters that mark formulas inside a document.
 *
 * <p>The inline opener may be a prefix of the block opener ({@code $} and {@code $$}); a match at
 * the same position is read as the block delimiter.</p>
 *
 * @param inlineOpen opens an inline formula
 * @param inlineClose closes an inline formula
 * @param blockOpen opens a block formula
 * @param blockClose closes a block formula
 */
public record MathDelimiters(String inlineOpen, String inlineClose, String blockOpen, String blockClose) {

    /** LaTeX's own delimiters: {@code \( \)} and {@code \[ \]}. */
    public static final MathDelimiters LATEX = new MathDelimiters("\\(", "\\)", "\\[", "\\]");

    /** TeX dollar delimiters: {@code $ $} and {@code $$ $$}. */
    public static final MathDelimiters DOLLARS = new MathDelimiters("$", "$", "$$", "$$");

    public MathDelimiters {
        requireNonEmpty(inlineOpen, "inlineOpen");
        requireNonEmpty(inlineClose, "inlineClose");
        requireNonEmpty(blockOpen, "blockOpen");
        requireNonEmpty(blockClose, "blockClose");
        if (inlineOpen.equals(blockOpen) && inlineClose.equals(blockClose)) {
            throw new IllegalArgumentException("Inline and block delimiters must differ");
        }
    }

    /**
     * Resolves a delimiter style by name.
     *
     * @param name {@code latex} or {@code dollars}, case-insensitive; null selects {@link #LATEX}
     * @return matching delimiters
     * @throws IllegalArgumentException for any other name
     */
    public static MathDelimiters fromName(String name) {
        if (name == null || name.isBlank() || "latex".equalsIgnoreCase(name.trim())) {
            return LATEX;
        }
        if ("dollars".equalsIgnoreCase(name.trim())) {
            return DOLLARS;
        }
        throw new IllegalArgumentException("Unknown delimiter style: " + name);
    }

    private static void requireNonEmpty(String delimiter, String field) {
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException(field + " cannot be empty");
        }
    }
}
