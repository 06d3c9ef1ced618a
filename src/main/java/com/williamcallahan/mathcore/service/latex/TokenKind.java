package com.williamcallahan.mathcore.service.latex;

/**
 * Lexical categories of LaTeX math source.
 */
public enum TokenKind {
    /** Backslash command; text is the name without the backslash. */
    COMMAND,
    /** Escaped special character such as {@code \{} or {@code \%}; text is the character. */
    ESCAPED_CHAR,
    GROUP_OPEN,
    GROUP_CLOSE,
    SUPERSCRIPT,
    SUBSCRIPT,
    /** Column separator {@code &}. */
    ALIGNMENT,
    /** Row separator {@code \\}. */
    ROW_BREAK,
    /** {@code \begin{name}}; text is the environment name. */
    BEGIN_ENV,
    /** {@code \end{name}}; text is the environment name. */
    END_ENV,
    /** A single codepoint of math input. */
    CHARACTER,
    /** Braced argument of a text command; text is the decoded content. */
    TEXT,
    /** A run of whitespace, collapsed to a single space. */
    WHITESPACE,
    /** {@code #n} inside a macro body; text is the digit. */
    MACRO_PARAMETER,
    END_OF_INPUT
}
