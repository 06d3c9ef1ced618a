package com.williamcallahan.mathcore.service.mathml.symbol;

/**
 * The four classification axes of the operator dictionary.
 */
public enum SymbolClass {
    /** Relation spacing on both sides (e.g. {@code =}). */
    RELATION,
    /** Binary-operator spacing when infix (e.g. {@code +}). */
    BINARY_OPERATOR,
    /** Operator spacing; includes the large operators (e.g. {@code ×}, {@code ∑}, {@code ∫}). */
    OPERATOR,
    /** Zero spacing unless forced (fences, punctuation, primes, and all unmapped characters). */
    ORDINARY_LIKE
}
