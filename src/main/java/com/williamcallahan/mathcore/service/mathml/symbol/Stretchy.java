package com.williamcallahan.mathcore.service.mathml.symbol;

/**
 * Stretch behavior an operator gets by default in a MathML Core renderer.
 */
public enum Stretchy {
    /** Always stretchy and symmetric (e.g. {@code (}, {@code )}). */
    ALWAYS,
    /** Stretchy only in prefix or postfix position (e.g. {@code |}). */
    PRE_POSTFIX,
    /** Never stretchy (e.g. {@code /}). */
    NEVER,
    /** Always stretchy but not symmetric (e.g. {@code ↑}). */
    ALWAYS_ASYMMETRIC
}
