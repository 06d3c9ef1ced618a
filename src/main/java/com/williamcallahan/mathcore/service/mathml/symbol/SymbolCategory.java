package com.williamcallahan.mathcore.service.mathml.symbol;

/**
 * Subcategories of the operator dictionary, each owned by exactly one {@link SymbolClass}.
 *
 * <p>Letters A-M refer to the categories of the MathML Core operator dictionary.</p>
 */
public enum SymbolCategory {
    /** No form, relation spacing (e.g. {@code =}). */
    REL_DEFAULT(SymbolClass.RELATION, Stretchy.NEVER, false, false, false),
    /** A: infix, relation spacing, stretchy and line-breakable (e.g. {@code →}). */
    REL_A(SymbolClass.RELATION, Stretchy.ALWAYS_ASYMMETRIC, false, false, false),

    /** B: infix only, binary-operator spacing (e.g. {@code ∪}). */
    BIN_B(SymbolClass.BINARY_OPERATOR, Stretchy.NEVER, false, false, false),
    /** B and D: infix or prefix, binary-operator spacing when infix (e.g. {@code +}). */
    BIN_BD(SymbolClass.BINARY_OPERATOR, Stretchy.NEVER, false, false, true),

    /** C: infix, operator spacing (e.g. {@code ×}). */
    OP_C(SymbolClass.OPERATOR, Stretchy.NEVER, false, false, false),
    /** H: prefix, operator spacing, symmetric, large (e.g. {@code ∫}). */
    OP_H(SymbolClass.OPERATOR, Stretchy.NEVER, true, false, true),
    /** J: prefix, operator spacing, symmetric, large, movable limits (e.g. {@code ∑}). */
    OP_J(SymbolClass.OPERATOR, Stretchy.NEVER, true, true, true),

    /** D: prefix, zero spacing (e.g. {@code ¬}). */
    ORD_D(SymbolClass.ORDINARY_LIKE, Stretchy.NEVER, false, false, true),
    /** E: postfix, zero spacing (e.g. {@code ′}). */
    ORD_E(SymbolClass.ORDINARY_LIKE, Stretchy.NEVER, false, false, false),
    /** F: prefix, zero spacing, stretchy, symmetric (opening fences). */
    ORD_F(SymbolClass.ORDINARY_LIKE, Stretchy.ALWAYS, false, false, true),
    /** G: postfix, zero spacing, stretchy, symmetric (closing fences). */
    ORD_G(SymbolClass.ORDINARY_LIKE, Stretchy.ALWAYS, false, false, false),
    /** F and G: prefix or postfix, zero spacing, stretchy, symmetric (e.g. {@code ‖}). */
    ORD_FG(SymbolClass.ORDINARY_LIKE, Stretchy.ALWAYS, false, false, true),
    /**
     * F and G with an additional infix form that has relation spacing (e.g. {@code |}). Spacing
     * is forced to the default when the character is used as an ordinary symbol.
     */
    ORD_FG_FORCE_DEFAULT(SymbolClass.ORDINARY_LIKE, Stretchy.PRE_POSTFIX, false, false, true),
    /** I: postfix, zero spacing, stretchy (accents and braces). */
    ORD_I(SymbolClass.ORDINARY_LIKE, Stretchy.ALWAYS, false, false, false),
    /** K: infix, zero spacing (e.g. {@code \}). */
    ORD_K(SymbolClass.ORDINARY_LIKE, Stretchy.NEVER, false, false, false),
    /**
     * K, but listed as B in earlier dictionaries (e.g. {@code /}). Renderers still apply binary
     * spacing to it, so zero spacing is written out explicitly.
     */
    ORD_K_LEGACY_B(SymbolClass.ORDINARY_LIKE, Stretchy.NEVER, false, false, false),
    /** M: punctuation spacing (e.g. {@code ,}). */
    ORD_PUNCTUATION(SymbolClass.ORDINARY_LIKE, Stretchy.NEVER, false, false, false),
    /** Any codepoint not in the dictionary. */
    ORD_PLAIN(SymbolClass.ORDINARY_LIKE, Stretchy.NEVER, false, false, false);

    private final SymbolClass symbolClass;
    private final Stretchy stretchy;
    private final boolean largeOperator;
    private final boolean movableLimits;
    private final boolean prefixForm;

    SymbolCategory(
        SymbolClass symbolClass,
        Stretchy stretchy,
        boolean largeOperator,
        boolean movableLimits,
        boolean prefixForm
    ) {
        this.symbolClass = symbolClass;
        this.stretchy = stretchy;
        this.largeOperator = largeOperator;
        this.movableLimits = movableLimits;
        this.prefixForm = prefixForm;
    }

    public SymbolClass symbolClass() {
        return symbolClass;
    }

    public Stretchy stretchy() {
        return stretchy;
    }

    public boolean largeOperator() {
        return largeOperator;
    }

    public boolean movableLimits() {
        return movableLimits;
    }

    /**
     * Indicates whether the dictionary defines a prefix form for this category.
     *
     * @return true for categories with a prefix entry
     */
    public boolean prefixForm() {
        return prefixForm;
    }

    /**
     * Indicates whether zero spacing must be written out explicitly when the symbol is used as an
     * ordinary character, because consumers would otherwise apply non-zero spacing.
     *
     * @return true for {@link #ORD_FG_FORCE_DEFAULT} and {@link #ORD_K_LEGACY_B}
     */
    public boolean forcesDefaultSpacing() {
        return this == ORD_FG_FORCE_DEFAULT || this == ORD_K_LEGACY_B;
    }

    /**
     * Indicates whether the symbol opens a fenced sub-expression.
     *
     * @return true for opening fences
     */
    public boolean opensFence() {
        return this == ORD_F;
    }

    /**
     * Indicates whether the symbol closes a fenced sub-expression or is a postfix mark.
     *
     * @return true for closing fences and postfix symbols
     */
    public boolean closesOrFollows() {
        return this == ORD_G || this == ORD_E || this == ORD_I;
    }
}
