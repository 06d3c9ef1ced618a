package com.williamcallahan.mathcore.service.mathml;

import com.williamcallahan.mathcore.service.mathml.symbol.SymbolDescriptor;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expression tree built by the parser and serialized by {@link MathMLRenderer}.
 *
 * <p>Trees are built per conversion call and never shared across calls.</p>
 */
public sealed interface MathNode {

    /**
     * Returns the source range this node was built from.
     *
     * @return byte range in the converted source
     */
    SourceSpan span();

    /** {@code <mi>}; upright forces {@code mathvariant="normal"} on single characters. */
    record Identifier(String text, boolean upright, SourceSpan span) implements MathNode {
        public Identifier {
            Objects.requireNonNull(text, "Identifier text cannot be null");
        }
    }

    /** {@code <mn>}. */
    record NumberLiteral(String digits, SourceSpan span) implements MathNode {
        public NumberLiteral {
            Objects.requireNonNull(digits, "Number digits cannot be null");
        }
    }

    /** {@code <mo>} with explicit attributes in output order. */
    record Operator(String text, SymbolDescriptor descriptor, Map<String, String> attributes, SourceSpan span)
        implements MathNode {
        public Operator {
            Objects.requireNonNull(text, "Operator text cannot be null");
            Objects.requireNonNull(descriptor, "Operator descriptor cannot be null");
            attributes = attributes == null ? Map.of() : OperatorAttributes.copyOf(attributes);
        }

        /**
         * Returns a copy with one attribute added or replaced.
         *
         * @param name attribute name
         * @param value attribute value
         * @return new operator
         */
        public Operator withAttribute(String name, String value) {
            return new Operator(text, descriptor, OperatorAttributes.with(attributes, name, value), span);
        }
    }

    /** {@code <mrow>}. */
    record Row(List<MathNode> children, SourceSpan span) implements MathNode {
        public Row {
            children = List.copyOf(children);
        }
    }

    /** {@code <mfrac>}; null line thickness and display style are omitted. */
    record Fraction(MathNode numerator, MathNode denominator, String lineThickness, Boolean displayStyle,
        SourceSpan span) implements MathNode {
        public Fraction {
            Objects.requireNonNull(numerator, "Numerator cannot be null");
            Objects.requireNonNull(denominator, "Denominator cannot be null");
        }
    }

    /** {@code <msqrt>} without index, {@code <mroot>} with one. */
    record Root(MathNode radicand, MathNode index, SourceSpan span) implements MathNode {
        public Root {
            Objects.requireNonNull(radicand, "Radicand cannot be null");
        }
    }

    /**
     * Base with optional sub and superscript. Limits placement renders {@code munder/mover/munderover},
     * script placement renders {@code msub/msup/msubsup}.
     */
    record Scripted(MathNode base, MathNode subscript, MathNode superscript, ScriptPlacement placement,
        SourceSpan span) implements MathNode {
        public Scripted {
            Objects.requireNonNull(base, "Scripted base cannot be null");
            Objects.requireNonNull(placement, "Script placement cannot be null");
            if (subscript == null && superscript == null) {
                throw new IllegalArgumentException("Scripted node needs a subscript or a superscript");
            }
        }
    }

    /** Accent above ({@code <mover accent="true">}) or below ({@code <munder accentunder="true">}). */
    record Accented(MathNode base, Operator accent, boolean under, SourceSpan span) implements MathNode {
        public Accented {
            Objects.requireNonNull(base, "Accent base cannot be null");
            Objects.requireNonNull(accent, "Accent cannot be null");
        }
    }

    /**
     * Table environment. Columns hold the alignments of an explicit column specification and are
     * empty when the environment kind decides the alignment.
     */
    record Environment(EnvironmentKind kind, List<EnvironmentRow> rows, List<EnvironmentKind.ColumnAlignment> columns,
        SourceSpan span) implements MathNode {
        public Environment {
            Objects.requireNonNull(kind, "Environment kind cannot be null");
            rows = List.copyOf(rows);
            columns = columns == null ? List.of() : List.copyOf(columns);
        }

        public Environment(EnvironmentKind kind, List<EnvironmentRow> rows, SourceSpan span) {
            this(kind, rows, List.of(), span);
        }
    }

    /** {@code <mtext>}. */
    record TextGroup(String text, String mathVariant, SourceSpan span) implements MathNode {
        public TextGroup {
            Objects.requireNonNull(text, "Text cannot be null");
        }
    }

    /** {@code <mspace width="..."/>}. */
    record Space(String width, SourceSpan span) implements MathNode {
        public Space {
            Objects.requireNonNull(width, "Space width cannot be null");
        }
    }

    /** {@code <mstyle>} style switch applied to the rest of a row. */
    record Styled(MathNode content, boolean displayStyle, int scriptLevel, SourceSpan span) implements MathNode {
        public Styled {
            Objects.requireNonNull(content, "Styled content cannot be null");
        }
    }

    /** Semantics wrapper carrying the TeX source as an annotation. */
    record Annotated(MathNode content, String source, SourceSpan span) implements MathNode {
        public Annotated {
            Objects.requireNonNull(content, "Annotated content cannot be null");
            Objects.requireNonNull(source, "Annotation source cannot be null");
        }
    }

    /** Literal placeholder for a command that is not in the command table. */
    record UnknownCommandPlaceholder(String name, SourceSpan span) implements MathNode {
        public UnknownCommandPlaceholder {
            Objects.requireNonNull(name, "Command name cannot be null");
        }
    }

    /** Row of an {@link Environment}. */
    record EnvironmentRow(List<MathNode> cells, RowLabel label) {
        public EnvironmentRow {
            cells = List.copyOf(cells);
            Objects.requireNonNull(label, "Row label cannot be null");
        }
    }

    /** Numbering of one environment row. */
    record RowLabel(RowLabelKind kind, String tag) {
        public static final RowLabel NONE = new RowLabel(RowLabelKind.NONE, null);
        public static final RowLabel NUMBERED = new RowLabel(RowLabelKind.NUMBERED, null);

        public RowLabel {
            Objects.requireNonNull(kind, "Row label kind cannot be null");
            if (kind == RowLabelKind.TAGGED && tag == null) {
                throw new IllegalArgumentException("Tagged row needs a tag");
            }
        }

        public static RowLabel tagged(String tag) {
            return new RowLabel(RowLabelKind.TAGGED, tag);
        }
    }

    /** Row numbering kinds. */
    enum RowLabelKind {
        NONE,
        NUMBERED,
        TAGGED
    }

    /** Script placement. */
    enum ScriptPlacement {
        SCRIPTS,
        LIMITS
    }
}
