package com.williamcallahan.mathcore.service.latex;

/**
 * Failure taxonomy of a conversion.
 */
public enum LatexErrorKind {
    /** Invalid or disallowed character, unmatched group close. */
    LEX,
    /** Command name not present in the command table. */
    UNKNOWN_COMMAND,
    /** Missing or ill-typed required argument. */
    ARGUMENT,
    /** Duplicate scripts, malformed environments, nesting limits. */
    STRUCTURAL,
    /** Malformed macro body, reported at construction time. */
    MACRO_DEFINITION
}
