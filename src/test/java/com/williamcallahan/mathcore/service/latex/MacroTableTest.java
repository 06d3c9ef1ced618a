package com.williamcallahan.mathcore.service.latex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Covers macro compilation and definition-relative error locations.
 */
class MacroTableTest {

    @Test
    void compile_recordsArityFromHighestParameter() {
        MacroTable table = MacroTable.compile(Map.of("pair", "(#1, #3)"));

        MacroDefinition pair = table.find("pair").orElseThrow();
        assertEquals(3, pair.arity());
        assertEquals("(#1, #3)", pair.replacement());
    }

    @Test
    void compile_reportsBodyErrorsRelativeToTheDefinition() {
        Map<String, String> macros = new LinkedHashMap<>();
        macros.put("ok", "x");
        macros.put("bad", "y_");

        MacroDefinitionException error = assertThrows(MacroDefinitionException.class,
            () -> MacroTable.compile(macros));

        assertEquals("macro1:1", error.location());
        assertEquals("bad", error.getMacroName());
        assertEquals("macro1:1: Expected argument but reached end of input.", error.getMessage());
        assertInstanceOf(LatexConversionException.class, error.getCause());
    }

    @Test
    void compile_acceptsParametersInLiteralArguments() {
        MacroTable table = MacroTable.compile(Map.of(
            "hs", "\\hspace{#1}", "word", "\\text{#1}", "op", "\\operatorname{#1}", "cols", "\\begin{array}{#1}x\\end{array}"));

        assertEquals(1, table.find("hs").orElseThrow().arity());
        assertEquals(1, table.find("word").orElseThrow().arity());
        assertEquals(1, table.find("op").orElseThrow().arity());
        assertEquals(1, table.find("cols").orElseThrow().arity());
    }

    @Test
    void compile_rejectsUnknownCommandsInLiteralArguments() {
        MacroDefinitionException error = assertThrows(MacroDefinitionException.class,
            () -> MacroTable.compile(Map.of("op", "\\operatorname{\\nope}")));

        assertEquals("macro0:14", error.location());
        assertEquals("Unknown command \"\\nope\"", error.getDetail());
    }

    @Test
    void compile_rejectsInvalidNames() {
        MacroDefinitionException error = assertThrows(MacroDefinitionException.class,
            () -> MacroTable.compile(Map.of("a1", "x")));

        assertEquals("macro0:0", error.location());
        assertEquals("Invalid macro name \"a1\"", error.getDetail());
    }

    @Test
    void compile_rejectsInvalidParameterNumbers() {
        MacroDefinitionException error = assertThrows(MacroDefinitionException.class,
            () -> MacroTable.compile(Map.of("p", "#0")));

        assertEquals("macro0:1", error.location());
        assertEquals(LatexErrorKind.MACRO_DEFINITION, error.toLatexError().kind());
        assertEquals("Invalid parameter number; must be 1-9", error.getDetail());
    }

    @Test
    void compile_acceptsBodiesThatUseOtherMacros() {
        Map<String, String> macros = new LinkedHashMap<>();
        macros.put("RR", "\\mathbb{R}");
        macros.put("vecR", "\\RR^#1");

        MacroTable table = MacroTable.compile(macros);

        assertEquals(2, table.size());
        assertTrue(table.find("vecR").isPresent());
    }

    @Test
    void isValidName_acceptsSingleCharactersAndLetterRuns() {
        assertTrue(MacroTable.isValidName("ℝ"));
        assertTrue(MacroTable.isValidName("!"));
        assertTrue(MacroTable.isValidName("norm"));
        assertFalse(MacroTable.isValidName("two words"));
        assertFalse(MacroTable.isValidName(""));
    }

    @Test
    void empty_hasNoDefinitions() {
        assertTrue(MacroTable.empty().isEmpty());
        assertTrue(MacroTable.compile(null).isEmpty());
    }
}
