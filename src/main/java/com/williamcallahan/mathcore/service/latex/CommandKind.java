package com.williamcallahan.mathcore.service.latex;

/**
 * Parser behavior selected by a command name.
 */
public enum CommandKind {
    /** Italic identifier, e.g. {@code \alpha}. */
    IDENTIFIER,
    /** Upright identifier, e.g. {@code \Gamma}. */
    UPRIGHT_IDENTIFIER,
    /** Single-character operator classified through the symbol table. */
    OPERATOR,
    /** Function name followed by function application, e.g. {@code \sin}. */
    FUNCTION,
    /** Function name taking limits in display mode, e.g. {@code \lim}. */
    LIMIT_FUNCTION,
    OPERATORNAME,
    /** Value is the display style: null, "true" or "false". */
    FRACTION,
    BINOM,
    SQRT,
    /** Script over a base, e.g. {@code \overset{!}{=}}. */
    OVERSET,
    UNDERSET,
    /** Value is the spacing class: "binary", "relation" or "operator". */
    MATH_CLASS,
    BMOD,
    PMOD,
    /** Value is the accent character, option "true" when it stretches. */
    ACCENT,
    UNDER_ACCENT,
    OVER_BRACE,
    UNDER_BRACE,
    LEFT,
    MIDDLE,
    RIGHT,
    /** Value is the min/max size. */
    SIZED_DELIMITER,
    NOT,
    LIMITS,
    NOLIMITS,
    /** Value is the display style flag, option the script level. */
    STYLE,
    /** Value is the width. */
    SPACE,
    NON_BREAKING_SPACE,
    HSPACE,
    /** Value is the mathvariant of the text, or null. */
    TEXT,
    /** Value is a {@code MathVariant} name. */
    MATH_ALPHABET,
    TAG,
    NOTAG
}
