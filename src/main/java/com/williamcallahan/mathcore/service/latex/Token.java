package com.williamcallahan.mathcore.service.latex;

import java.util.Objects;

/**
 * One lexical unit with its UTF-8 byte range in the source.
 *
 * @param kind lexical category
 * @param text payload; meaning depends on the kind
 * @param offset start byte offset
 * @param end end byte offset, exclusive
 * @param expansionDepth number of macro expansions that produced this token, zero for input tokens
 */
public record Token(TokenKind kind, String text, int offset, int end, int expansionDepth) {

    public Token {
        Objects.requireNonNull(kind, "Token kind cannot be null");
        text = text == null ? "" : text;
        if (offset < 0 || end < offset) {
            throw new IllegalArgumentException("Invalid token range: " + offset + ".." + end);
        }
    }

    public Token(TokenKind kind, String text, int offset, int end) {
        this(kind, text, offset, end, 0);
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean isCommand(String name) {
        return kind == TokenKind.COMMAND && text.equals(name);
    }

    public boolean isCharacter(String value) {
        return kind == TokenKind.CHARACTER && text.equals(value);
    }

    /**
     * Returns a copy placed at a macro use site.
     *
     * @param useOffset start of the invoking command
     * @param useEnd end of the invoking command
     * @param depth expansion depth of the copy
     * @return relocated token
     */
    Token relocate(int useOffset, int useEnd, int depth) {
        return new Token(kind, text, useOffset, useEnd, depth);
    }

    /**
     * Reconstructs the LaTeX spelling of this token for error messages.
     *
     * @return source-like text
     */
    public String spelling() {
        return switch (kind) {
            case COMMAND -> "\\" + text;
            case ESCAPED_CHAR -> "\\" + text;
            case GROUP_OPEN -> "{";
            case GROUP_CLOSE -> "}";
            case SUPERSCRIPT -> "^";
            case SUBSCRIPT -> "_";
            case ALIGNMENT -> "&";
            case ROW_BREAK -> "\\\\";
            case BEGIN_ENV -> "\\begin{" + text + "}";
            case END_ENV -> "\\end{" + text + "}";
            case MACRO_PARAMETER -> "#" + text;
            case END_OF_INPUT -> "end of input";
            default -> text;
        };
    }
}
