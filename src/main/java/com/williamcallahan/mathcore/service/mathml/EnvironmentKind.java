package com.williamcallahan.mathcore.service.mathml;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Supported {@code \begin{...}} environments.
 */
public enum EnvironmentKind {
    MATRIX("matrix", null, null, ColumnAlignment.CENTER, false, false),
    PMATRIX("pmatrix", "(", ")", ColumnAlignment.CENTER, false, false),
    BMATRIX("bmatrix", "[", "]", ColumnAlignment.CENTER, false, false),
    BRACE_MATRIX("Bmatrix", "{", "}", ColumnAlignment.CENTER, false, false),
    VMATRIX("vmatrix", "|", "|", ColumnAlignment.CENTER, false, false),
    DOUBLE_VMATRIX("Vmatrix", "‖", "‖", ColumnAlignment.CENTER, false, false),
    CASES("cases", "{", null, ColumnAlignment.LEFT, false, false),
    ALIGNED("aligned", null, null, ColumnAlignment.ALTERNATING, true, false),
    GATHERED("gathered", null, null, ColumnAlignment.CENTER, true, false),
    ALIGN("align", null, null, ColumnAlignment.ALTERNATING, true, true),
    ALIGN_STAR("align*", null, null, ColumnAlignment.ALTERNATING, true, false),
    GATHER("gather", null, null, ColumnAlignment.CENTER, true, true),
    GATHER_STAR("gather*", null, null, ColumnAlignment.CENTER, true, false),
    EQUATION("equation", null, null, ColumnAlignment.CENTER, true, true),
    EQUATION_STAR("equation*", null, null, ColumnAlignment.CENTER, true, false),
    MULTLINE("multline", null, null, ColumnAlignment.MULTLINE, true, true),
    MULTLINE_STAR("multline*", null, null, ColumnAlignment.MULTLINE, true, false),
    ARRAY("array", null, null, ColumnAlignment.CENTER, false, false),
    SUBARRAY("subarray", null, null, ColumnAlignment.CENTER, false, false);

    private static final Map<String, EnvironmentKind> BY_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(EnvironmentKind::latexName, Function.identity()));

    private final String latexName;
    private final String open;
    private final String close;
    private final ColumnAlignment alignment;
    private final boolean displayStyle;
    private final boolean numbered;

    EnvironmentKind(String latexName, String open, String close, ColumnAlignment alignment,
                    boolean displayStyle, boolean numbered) {
        this.latexName = latexName;
        this.open = open;
        this.close = close;
        this.alignment = alignment;
        this.displayStyle = displayStyle;
        this.numbered = numbered;
    }

    /**
     * Resolves an environment by its LaTeX name.
     *
     * @param name name between the braces of {@code \begin}
     * @return the environment, or empty when unknown
     */
    public static Optional<EnvironmentKind> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public String latexName() {
        return latexName;
    }

    /** Opening fence rendered before the table, or null. */
    public String open() {
        return open;
    }

    /** Closing fence rendered after the table, or null. */
    public String close() {
        return close;
    }

    public ColumnAlignment alignment() {
        return alignment;
    }

    public boolean displayStyle() {
        return displayStyle;
    }

    /**
     * Indicates whether rows take equation numbers by default.
     *
     * @return true for unstarred align, gather and equation
     */
    public boolean numbered() {
        return numbered;
    }

    /**
     * Indicates whether {@code \tag} and {@code \notag} may appear inside.
     *
     * @return true for the display-level environments
     */
    public boolean acceptsTags() {
        return this == ALIGN || this == ALIGN_STAR || this == GATHER || this == GATHER_STAR
            || this == EQUATION || this == EQUATION_STAR || this == MULTLINE || this == MULTLINE_STAR;
    }

    /** Multline numbers its last row only. */
    public boolean numbersLastRowOnly() {
        return this == MULTLINE;
    }

    /**
     * Indicates whether {@code \begin{name}} is followed by a column specification such as {@code {lcr}}.
     *
     * @return true for array and subarray
     */
    public boolean takesColumnSpec() {
        return this == ARRAY || this == SUBARRAY;
    }

    /** Column alignment schemes. */
    public enum ColumnAlignment {
        CENTER,
        LEFT,
        RIGHT,
        /** First row left, last row right, rows between centered. */
        MULTLINE,
        /** Right, left, right, ... as used by align. */
        ALTERNATING
    }
}
