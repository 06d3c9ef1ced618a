package com.williamcallahan.mathcore.service.mathml;

import com.williamcallahan.mathcore.domain.mathml.MathDisplay;
import com.williamcallahan.mathcore.domain.mathml.PrettyPrint;
import com.williamcallahan.mathcore.service.mathml.MathNode.Accented;
import com.williamcallahan.mathcore.service.mathml.MathNode.Annotated;
import com.williamcallahan.mathcore.service.mathml.MathNode.Environment;
import com.williamcallahan.mathcore.service.mathml.MathNode.EnvironmentRow;
import com.williamcallahan.mathcore.service.mathml.MathNode.Fraction;
import com.williamcallahan.mathcore.service.mathml.MathNode.Identifier;
import com.williamcallahan.mathcore.service.mathml.MathNode.NumberLiteral;
import com.williamcallahan.mathcore.service.mathml.MathNode.Operator;
import com.williamcallahan.mathcore.service.mathml.MathNode.Root;
import com.williamcallahan.mathcore.service.mathml.MathNode.Row;
import com.williamcallahan.mathcore.service.mathml.MathNode.ScriptPlacement;
import com.williamcallahan.mathcore.service.mathml.MathNode.Scripted;
import com.williamcallahan.mathcore.service.mathml.MathNode.Space;
import com.williamcallahan.mathcore.service.mathml.MathNode.Styled;
import com.williamcallahan.mathcore.service.mathml.MathNode.TextGroup;
import com.williamcallahan.mathcore.service.mathml.MathNode.UnknownCommandPlaceholder;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes a {@link MathNode} tree to MathML text.
 *
 * <p>Compact output inserts no whitespace. Pretty output puts every element on its own line,
 * indented four spaces per level, and closes containers on their own line.</p>
 */
public final class MathMLRenderer {

    public static final String MATHML_NAMESPACE = "http://www.w3.org/1998/Math/MathML";
    public static final String TEX_ENCODING = "application/x-tex";

    private static final String INDENT = "    ";
    private static final String LABEL_PADDING = "width: 50%";

    private final PrettyPrint prettyPrint;
    private final boolean xmlNamespace;

    public MathMLRenderer(PrettyPrint prettyPrint, boolean xmlNamespace) {
        this.prettyPrint = Objects.requireNonNull(prettyPrint, "Pretty print setting cannot be null");
        this.xmlNamespace = xmlNamespace;
    }

    /**
     * Renders a tree inside a {@code <math>} root.
     *
     * @param root top-level row, optionally wrapped in {@link Annotated}
     * @param display display mode of the root element
     * @param counter source of equation numbers for numbered rows
     * @return MathML markup
     */
    public String render(MathNode root, MathDisplay display, EquationCounter counter) {
        Objects.requireNonNull(root, "Root node cannot be null");
        Objects.requireNonNull(counter, "Equation counter cannot be null");
        boolean pretty = prettyPrint == PrettyPrint.ALWAYS
            || (prettyPrint == PrettyPrint.AUTO && containsEnvironment(root));
        Emitter emitter = new Emitter(pretty, counter);
        StringBuilder out = emitter.out;
        out.append("<math");
        if (xmlNamespace) {
            out.append(" xmlns=\"").append(MATHML_NAMESPACE).append('"');
        }
        if (display == MathDisplay.BLOCK) {
            out.append(" display=\"block\"");
        }
        out.append('>');
        int baseIndent = pretty ? 1 : 0;
        if (root instanceof Row row) {
            emitter.emitAll(row.children(), baseIndent);
        } else {
            emitter.emit(root, baseIndent);
        }
        if (pretty) {
            out.append('\n');
        }
        out.append("</math>");
        return out.toString();
    }

    /**
     * Indicates whether a tree has a node that needs multi-line layout.
     *
     * @param node tree root
     * @return true when an environment occurs anywhere in the tree
     */
    static boolean containsEnvironment(MathNode node) {
        if (node instanceof Environment) {
            return true;
        }
        if (node instanceof Row row) {
            return row.children().stream().anyMatch(MathMLRenderer::containsEnvironment);
        }
        if (node instanceof Annotated annotated) {
            return containsEnvironment(annotated.content());
        }
        if (node instanceof Styled styled) {
            return containsEnvironment(styled.content());
        }
        if (node instanceof Fraction fraction) {
            return containsEnvironment(fraction.numerator()) || containsEnvironment(fraction.denominator());
        }
        if (node instanceof Root root) {
            return containsEnvironment(root.radicand()) || (root.index() != null && containsEnvironment(root.index()));
        }
        if (node instanceof Scripted scripted) {
            return containsEnvironment(scripted.base())
                || (scripted.subscript() != null && containsEnvironment(scripted.subscript()))
                || (scripted.superscript() != null && containsEnvironment(scripted.superscript()));
        }
        if (node instanceof Accented accented) {
            return containsEnvironment(accented.base());
        }
        return false;
    }

    private static final class Emitter {

        private final StringBuilder out = new StringBuilder(256);
        private final boolean pretty;
        private final EquationCounter counter;

        Emitter(boolean pretty, EquationCounter counter) {
            this.pretty = pretty;
            this.counter = counter;
        }

        void emitAll(List<MathNode> nodes, int indent) {
            for (MathNode node : nodes) {
                emit(node, indent);
            }
        }

        void emit(MathNode node, int indent) {
            int childIndent = pretty ? indent + 1 : 0;
            newLine(indent);
            if (node instanceof Identifier identifier) {
                boolean normal = identifier.upright() && identifier.text().codePointCount(0, identifier.text().length()) == 1;
                out.append(normal ? "<mi mathvariant=\"normal\">" : "<mi>");
                XmlEscaper.appendContent(out, identifier.text());
                out.append("</mi>");
            } else if (node instanceof NumberLiteral number) {
                out.append("<mn>");
                XmlEscaper.appendContent(out, number.digits());
                out.append("</mn>");
            } else if (node instanceof Operator operator) {
                out.append("<mo");
                appendAttributes(operator.attributes());
                out.append('>');
                XmlEscaper.appendContent(out, operator.text());
                out.append("</mo>");
            } else if (node instanceof Row row) {
                container("mrow", "", row.children(), indent, childIndent);
            } else if (node instanceof Fraction fraction) {
                StringBuilder attributes = new StringBuilder();
                if (fraction.lineThickness() != null) {
                    attributes.append(" linethickness=\"").append(XmlEscaper.attribute(fraction.lineThickness())).append('"');
                }
                if (fraction.displayStyle() != null) {
                    attributes.append(" displaystyle=\"").append(fraction.displayStyle()).append('"');
                }
                container("mfrac", attributes.toString(), List.of(fraction.numerator(), fraction.denominator()),
                    indent, childIndent);
            } else if (node instanceof Root root) {
                if (root.index() == null) {
                    container("msqrt", "", List.of(root.radicand()), indent, childIndent);
                } else {
                    container("mroot", "", List.of(root.radicand(), root.index()), indent, childIndent);
                }
            } else if (node instanceof Scripted scripted) {
                emitScripted(scripted, indent, childIndent);
            } else if (node instanceof Accented accented) {
                if (accented.under()) {
                    container("munder", " accentunder=\"true\"", List.of(accented.base(), accented.accent()),
                        indent, childIndent);
                } else {
                    container("mover", " accent=\"true\"", List.of(accented.base(), accented.accent()),
                        indent, childIndent);
                }
            } else if (node instanceof Environment environment) {
                emitEnvironment(environment, indent, childIndent);
            } else if (node instanceof TextGroup text) {
                out.append(text.mathVariant() == null
                    ? "<mtext>"
                    : "<mtext mathvariant=\"" + XmlEscaper.attribute(text.mathVariant()) + "\">");
                XmlEscaper.appendContent(out, text.text());
                out.append("</mtext>");
            } else if (node instanceof Space space) {
                out.append("<mspace width=\"").append(XmlEscaper.attribute(space.width())).append("\"/>");
            } else if (node instanceof Styled styled) {
                String attributes = " displaystyle=\"" + styled.displayStyle() + "\" scriptlevel=\"" + styled.scriptLevel() + "\"";
                List<MathNode> children = styled.content() instanceof Row row ? row.children() : List.of(styled.content());
                container("mstyle", attributes, children, indent, childIndent);
            } else if (node instanceof Annotated annotated) {
                emitAnnotated(annotated, indent, childIndent);
            } else if (node instanceof UnknownCommandPlaceholder placeholder) {
                out.append("<merror>");
                newLine(childIndent);
                out.append("<mtext>");
                XmlEscaper.appendContent(out, "\\" + placeholder.name());
                out.append("</mtext>");
                newLine(indent);
                out.append("</merror>");
            }
        }

        private void emitScripted(Scripted scripted, int indent, int childIndent) {
            boolean limits = scripted.placement() == ScriptPlacement.LIMITS;
            String tag;
            List<MathNode> children;
            if (scripted.subscript() != null && scripted.superscript() != null) {
                tag = limits ? "munderover" : "msubsup";
                children = List.of(scripted.base(), scripted.subscript(), scripted.superscript());
            } else if (scripted.subscript() != null) {
                tag = limits ? "munder" : "msub";
                children = List.of(scripted.base(), scripted.subscript());
            } else {
                tag = limits ? "mover" : "msup";
                children = List.of(scripted.base(), scripted.superscript());
            }
            container(tag, "", children, indent, childIndent);
        }

        private void emitAnnotated(Annotated annotated, int indent, int childIndent) {
            int rowIndent = pretty ? childIndent + 1 : 0;
            out.append("<semantics>");
            newLine(childIndent);
            List<MathNode> children = annotated.content() instanceof Row row
                ? row.children()
                : List.of(annotated.content());
            container("mrow", "", children, childIndent, rowIndent);
            newLine(childIndent);
            out.append("<annotation encoding=\"").append(TEX_ENCODING).append("\">");
            XmlEscaper.appendContent(out, annotated.source());
            out.append("</annotation>");
            newLine(indent);
            out.append("</semantics>");
        }

        private void emitEnvironment(Environment environment, int indent, int childIndent) {
            EnvironmentKind kind = environment.kind();
            boolean fenced = kind.open() != null || kind.close() != null;
            int tableIndent = indent;
            if (fenced) {
                out.append("<mrow>");
                tableIndent = childIndent;
                if (kind.open() != null) {
                    newLine(tableIndent);
                    out.append("<mo>").append(XmlEscaper.content(kind.open())).append("</mo>");
                }
                newLine(tableIndent);
            }
            int rowIndent = pretty ? tableIndent + 1 : 0;
            int cellIndent = pretty ? rowIndent + 1 : 0;
            int contentIndent = pretty ? cellIndent + 1 : 0;
            boolean labelled = kind.numbered()
                || environment.rows().stream().anyMatch(row -> row.label().kind() == MathNode.RowLabelKind.TAGGED);
            out.append("<mtable").append(kind.displayStyle() ? " displaystyle=\"true\"" : "").append('>');
            int rowCount = environment.rows().size();
            for (int rowIndex = 0; rowIndex < rowCount; rowIndex++) {
                EnvironmentRow row = environment.rows().get(rowIndex);
                newLine(rowIndent);
                out.append("<mtr>");
                if (labelled) {
                    newLine(cellIndent);
                    out.append("<mtd style=\"").append(LABEL_PADDING).append("\"></mtd>");
                }
                for (int column = 0; column < row.cells().size(); column++) {
                    newLine(cellIndent);
                    out.append("<mtd").append(cellStyle(environment, column, rowIndex, rowCount)).append('>');
                    MathNode cell = row.cells().get(column);
                    emitAll(cell instanceof Row cellRow ? cellRow.children() : List.of(cell), contentIndent);
                    newLine(cellIndent);
                    out.append("</mtd>");
                }
                if (labelled) {
                    emitLabel(row.label(), cellIndent, contentIndent);
                }
                newLine(rowIndent);
                out.append("</mtr>");
            }
            newLine(tableIndent);
            out.append("</mtable>");
            if (fenced) {
                if (kind.close() != null) {
                    newLine(tableIndent);
                    out.append("<mo>").append(XmlEscaper.content(kind.close())).append("</mo>");
                }
                newLine(indent);
                out.append("</mrow>");
            }
        }

        private void emitLabel(MathNode.RowLabel label, int cellIndent, int contentIndent) {
            newLine(cellIndent);
            if (label.kind() == MathNode.RowLabelKind.NONE) {
                out.append("<mtd style=\"").append(LABEL_PADDING).append("\"></mtd>");
                return;
            }
            String text = label.kind() == MathNode.RowLabelKind.NUMBERED
                ? "(" + counter.next() + ")"
                : "(" + label.tag() + ")";
            out.append("<mtd style=\"").append(LABEL_PADDING).append("; text-align: right\">");
            newLine(contentIndent);
            out.append("<mtext>");
            XmlEscaper.appendContent(out, text);
            out.append("</mtext>");
            newLine(cellIndent);
            out.append("</mtd>");
        }

        private static String cellStyle(Environment environment, int column, int rowIndex, int rowCount) {
            List<EnvironmentKind.ColumnAlignment> columns = environment.columns();
            EnvironmentKind.ColumnAlignment alignment = column < columns.size()
                ? columns.get(column)
                : environment.kind().alignment();
            return switch (alignment) {
                case CENTER -> "";
                case LEFT -> " style=\"text-align: left\"";
                case RIGHT -> " style=\"text-align: right\"";
                case ALTERNATING -> column % 2 == 0
                    ? " style=\"text-align: right; padding-right: 0\""
                    : " style=\"text-align: left; padding-left: 0\"";
                case MULTLINE -> {
                    if (rowCount > 1 && rowIndex == 0) {
                        yield " style=\"text-align: left\"";
                    }
                    yield rowCount > 1 && rowIndex == rowCount - 1 ? " style=\"text-align: right\"" : "";
                }
            };
        }

        private void container(String tag, String attributes, List<MathNode> children, int indent, int childIndent) {
            out.append('<').append(tag).append(attributes).append('>');
            if (children.isEmpty()) {
                out.append("</").append(tag).append('>');
                return;
            }
            emitAll(children, childIndent);
            newLine(indent);
            out.append("</").append(tag).append('>');
        }

        private void appendAttributes(Map<String, String> attributes) {
            for (Map.Entry<String, String> attribute : attributes.entrySet()) {
                out.append(' ').append(attribute.getKey()).append("=\"")
                    .append(XmlEscaper.attribute(attribute.getValue())).append('"');
            }
        }

        private void newLine(int indent) {
            if (indent > 0) {
                out.append('\n');
                out.append(INDENT.repeat(indent));
            }
        }
    }
}
