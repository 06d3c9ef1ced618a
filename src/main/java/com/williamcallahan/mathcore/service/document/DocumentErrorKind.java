package com.williamcallahan.mathcore.service.document;

/**
 * Reasons a document replacement stops.
 */
public enum DocumentErrorKind {
    UNCLOSED_DELIMITER("Unclosed delimiter"),
    NESTED_DELIMITERS("Nested delimiters are not allowed"),
    MISMATCHED_DELIMITERS("Unmatched delimiters"),
    CONVERSION_FAILED("Formula could not be converted");

    private final String description;

    DocumentErrorKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
