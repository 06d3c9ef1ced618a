package com.williamcallahan.mathcore.service.mathml.symbol;

import java.util.Objects;

/**
 * Classification of one codepoint.
 *
 * @param codepoint the Unicode codepoint
 * @param category dictionary subcategory
 */
public record SymbolDescriptor(int codepoint, SymbolCategory category) {

    public SymbolDescriptor {
        if (!Character.isValidCodePoint(codepoint)) {
            throw new IllegalArgumentException("Invalid codepoint: " + codepoint);
        }
        Objects.requireNonNull(category, "Symbol category cannot be null");
    }

    public SymbolClass symbolClass() {
        return category.symbolClass();
    }

    public Stretchy stretchy() {
        return category.stretchy();
    }

    /**
     * Returns the symbol as a string.
     *
     * @return the character, possibly a surrogate pair
     */
    public String text() {
        return new String(Character.toChars(codepoint));
    }

    /**
     * Indicates whether this symbol is rendered as an operator ({@code <mo>}) rather than an
     * identifier.
     *
     * @return false only for unmapped codepoints
     */
    public boolean isOperator() {
        return category != SymbolCategory.ORD_PLAIN;
    }

    /**
     * Indicates whether this relation may stretch and is eligible for line breaking.
     *
     * @return true for stretchy relations
     */
    public boolean isLineBreakable() {
        return category == SymbolCategory.REL_A;
    }
}
