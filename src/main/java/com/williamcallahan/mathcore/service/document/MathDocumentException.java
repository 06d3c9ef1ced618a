package com.williamcallahan.mathcore.service.document;

import java.util.Objects;

/**
 * Signals that a document could not be processed, located by 1-based line and column.
 *
 * <p>Conversion failures keep the underlying {@code LatexConversionException} as the cause.</p>
 */
public class MathDocumentException extends IllegalArgumentException {

    private final DocumentErrorKind kind;
    private final int line;
    private final int column;

    /**
     * Creates a delimiter-structure failure.
     *
     * @param kind failure reason
     * @param line 1-based line of the offending delimiter
     * @param column 1-based column of the offending delimiter
     */
    public MathDocumentException(DocumentErrorKind kind, int line, int column) {
        this(kind, line, column, kind.description(), null);
    }

    /**
     * Creates a failure with an explicit detail and cause.
     *
     * @param kind failure reason
     * @param line 1-based line of the formula
     * @param column 1-based column of the formula
     * @param detail description of what went wrong
     * @param cause underlying failure, may be null
     */
    public MathDocumentException(DocumentErrorKind kind, int line, int column, String detail, Throwable cause) {
        super(line + ":" + column + ": " + detail, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.line = line;
        this.column = column;
    }

    public DocumentErrorKind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
