package com.williamcallahan.mathcore.service.document;

import com.williamcallahan.mathcore.domain.mathml.MathDisplay;

/**
 * Converts a single formula found in a document.
 */
@FunctionalInterface
public interface FormulaRenderer {

    /**
     * Renders one formula.
     *
     * @param latex formula source without its delimiters
     * @param display display mode implied by the delimiters
     * @return markup that replaces the delimited formula
     */
    String render(String latex, MathDisplay display);
}
