package com.williamcallahan.mathcore.service.latex;

import java.util.Objects;

/**
 * Signals that a LaTeX source could not be converted.
 */
public class LatexConversionException extends IllegalArgumentException {

    private final transient LatexError error;

    /**
     * Creates a conversion exception for a located error.
     *
     * @param error the failure
     */
    public LatexConversionException(LatexError error) {
        super(Objects.requireNonNull(error, "Error cannot be null").describe());
        this.error = error;
    }

    public LatexConversionException(LatexErrorKind kind, int offset, String message) {
        this(new LatexError(kind, offset, message));
    }

    public LatexError getError() {
        return error;
    }

    public LatexErrorKind getKind() {
        return error.kind();
    }

    public int getOffset() {
        return error.offset();
    }
}
