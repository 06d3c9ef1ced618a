package com.williamcallahan.mathcore.service.mathml.symbol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Covers codepoint classification used for operator spacing and stretching.
 */
class SymbolTableTest {

    @Test
    void lookup_classifiesRelationsAndBinaryOperators() {
        assertEquals(SymbolClass.RELATION, SymbolTable.lookup('=').symbolClass());
        assertEquals(SymbolClass.RELATION, SymbolTable.lookup(0x2264).symbolClass());
        assertEquals(SymbolClass.BINARY_OPERATOR, SymbolTable.lookup('+').symbolClass());
        assertTrue(SymbolTable.lookup(0x2212).category().prefixForm());
        assertFalse(SymbolTable.lookup(0x222A).category().prefixForm());
    }

    @Test
    void lookup_marksLargeOperatorsWithMovableLimits() {
        SymbolDescriptor sum = SymbolTable.lookup(0x2211);
        assertEquals(SymbolCategory.OP_J, sum.category());
        assertTrue(sum.category().largeOperator());
        assertTrue(sum.category().movableLimits());

        SymbolDescriptor integral = SymbolTable.lookup(0x222B);
        assertTrue(integral.category().largeOperator());
        assertFalse(integral.category().movableLimits());
    }

    @Test
    void lookup_fallsBackToPlainOrdinaryForUnmappedCodepoints() {
        SymbolDescriptor letter = SymbolTable.lookup('x');
        assertEquals(SymbolCategory.ORD_PLAIN, letter.category());
        assertFalse(letter.isOperator());
        assertTrue(SymbolTable.find('x').isEmpty());
    }

    @Test
    void lookup_distinguishesFencesAndForcedSpacing() {
        assertTrue(SymbolTable.lookup('(').category().opensFence());
        assertTrue(SymbolTable.lookup(')').category().closesOrFollows());
        assertEquals(Stretchy.PRE_POSTFIX, SymbolTable.lookup('|').stretchy());
        assertTrue(SymbolTable.lookup('|').category().forcesDefaultSpacing());
        assertTrue(SymbolTable.lookup('/').category().forcesDefaultSpacing());
        assertEquals(SymbolCategory.ORD_PUNCTUATION, SymbolTable.lookup(',').category());
    }

    @Test
    void lookup_reportsStretchyArrowsAsLineBreakable() {
        assertTrue(SymbolTable.lookup(0x2192).isLineBreakable());
        assertFalse(SymbolTable.lookup('=').isLineBreakable());
    }

    @Test
    void entries_isOrderedAndUnmodifiable() {
        Integer previous = null;
        for (Integer codepoint : SymbolTable.entries().keySet()) {
            if (previous != null) {
                assertTrue(previous < codepoint, "entries should be sorted by codepoint");
            }
            previous = codepoint;
        }
        assertThrows(UnsupportedOperationException.class,
            () -> SymbolTable.entries().put(0x41, new SymbolDescriptor(0x41, SymbolCategory.ORD_PLAIN)));
    }
}
