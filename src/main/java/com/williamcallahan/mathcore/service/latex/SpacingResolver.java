package com.williamcallahan.mathcore.service.latex;

import com.williamcallahan.mathcore.service.mathml.MathNode;
import com.williamcallahan.mathcore.service.mathml.MathNode.Operator;
import com.williamcallahan.mathcore.service.mathml.symbol.SymbolCategory;
import com.williamcallahan.mathcore.service.mathml.symbol.SymbolClass;
import java.util.ArrayList;
import java.util.List;

/**
 * Context-dependent operator spacing for one row of siblings.
 *
 * <p>A binary operator is infix only when operands stand on both sides. Otherwise operators with a
 * prefix form are marked {@code form="prefix"} (unless first in the row, where the form is
 * implied) and the others lose their spacing. Relations drop the space next to the row edges and
 * next to other relations or punctuation.</p>
 */
final class SpacingResolver {

    static final String ZERO = "0";

    private SpacingResolver() {
    }

    static List<MathNode> resolve(List<MathNode> row) {
        List<MathNode> resolved = new ArrayList<>(row.size());
        for (int i = 0; i < row.size(); i++) {
            MathNode node = row.get(i);
            if (node instanceof Operator operator && !hasExplicitSpacing(operator)) {
                MathNode previous = i > 0 ? row.get(i - 1) : null;
                MathNode next = i + 1 < row.size() ? row.get(i + 1) : null;
                SymbolClass symbolClass = operator.descriptor().symbolClass();
                if (symbolClass == SymbolClass.BINARY_OPERATOR) {
                    node = resolveBinary(operator, previous, next);
                } else if (symbolClass == SymbolClass.RELATION) {
                    node = resolveRelation(operator, previous, next);
                }
            }
            resolved.add(node);
        }
        return resolved;
    }

    private static MathNode resolveBinary(Operator operator, MathNode previous, MathNode next) {
        if (endsOperand(previous) && startsOperand(next)) {
            return operator;
        }
        if (operator.descriptor().category().prefixForm() && startsOperand(next)) {
            return previous == null ? operator : operator.withAttribute("form", "prefix");
        }
        return operator.withAttribute("lspace", ZERO).withAttribute("rspace", ZERO);
    }

    private static MathNode resolveRelation(Operator operator, MathNode previous, MathNode next) {
        Operator result = operator;
        if (previous == null || isRelationOrPunctuation(previous) || opensFence(previous)) {
            result = result.withAttribute("lspace", ZERO);
        }
        if (next == null || isRelationOrPunctuation(next)) {
            result = result.withAttribute("rspace", ZERO);
        }
        return result;
    }

    private static boolean hasExplicitSpacing(Operator operator) {
        return operator.attributes().containsKey("lspace") || operator.attributes().containsKey("rspace");
    }

    private static boolean endsOperand(MathNode node) {
        if (node == null) {
            return false;
        }
        if (!(node instanceof Operator operator)) {
            return true;
        }
        SymbolCategory category = operator.descriptor().category();
        return category.closesOrFollows() || category == SymbolCategory.ORD_PLAIN;
    }

    private static boolean startsOperand(MathNode node) {
        if (node == null) {
            return false;
        }
        if (!(node instanceof Operator operator)) {
            return true;
        }
        SymbolCategory category = operator.descriptor().category();
        return category.opensFence()
            || category == SymbolCategory.ORD_D
            || category == SymbolCategory.ORD_PLAIN
            || category == SymbolCategory.BIN_BD
            || category.largeOperator();
    }

    private static boolean isRelationOrPunctuation(MathNode node) {
        return node instanceof Operator operator
            && (operator.descriptor().symbolClass() == SymbolClass.RELATION
                || operator.descriptor().category() == SymbolCategory.ORD_PUNCTUATION);
    }

    private static boolean opensFence(MathNode node) {
        return node instanceof Operator operator && operator.descriptor().category().opensFence();
    }
}
