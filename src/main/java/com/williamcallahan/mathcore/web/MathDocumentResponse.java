package com.williamcallahan.mathcore.web;

import com.williamcallahan.mathcore.service.document.DocumentReplacement;
import com.williamcallahan.mathcore.service.document.DocumentReplacement.SkippedFormula;
import java.util.List;

/**
 * Document with its formulas converted.
 *
 * @param status fixed "success"
 * @param html rewritten document
 * @param formulas number of formulas converted
 * @param skipped formulas left verbatim
 */
public record MathDocumentResponse(String status, String html, int formulas, List<SkippedFormula> skipped)
    implements ApiResponse {

    public static MathDocumentResponse from(DocumentReplacement replacement) {
        return new MathDocumentResponse("success", replacement.html(), replacement.formulas(), replacement.skipped());
    }
}
