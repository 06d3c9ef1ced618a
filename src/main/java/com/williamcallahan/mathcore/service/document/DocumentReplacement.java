package com.williamcallahan.mathcore.service.document;

import java.util.List;
import java.util.Objects;

/**
 * Result of replacing the formulas of one document.
 *
 * @param html document with converted formulas spliced in
 * @param formulas number of formulas converted
 * @param skipped formulas left verbatim because their conversion failed
 */
public record DocumentReplacement(String html, int formulas, List<SkippedFormula> skipped) {

    public DocumentReplacement {
        Objects.requireNonNull(html, "html");
        if (formulas < 0) {
            throw new IllegalArgumentException("formulas cannot be negative");
        }
        skipped = List.copyOf(Objects.requireNonNull(skipped, "skipped"));
    }

    /**
     * A formula whose conversion failed under continue-on-error.
     *
     * @param line 1-based line of the opening delimiter
     * @param column 1-based column of the opening delimiter
     * @param message conversion error text
     */
    public record SkippedFormula(int line, int column, String message) {
    }
}
