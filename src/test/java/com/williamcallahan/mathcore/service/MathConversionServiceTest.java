package com.williamcallahan.mathcore.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.mathcore.config.MathCoreProperties;
import com.williamcallahan.mathcore.domain.mathml.MathDisplay;
import com.williamcallahan.mathcore.domain.mathml.RenderConfig;
import com.williamcallahan.mathcore.service.document.DocumentReplacement;
import com.williamcallahan.mathcore.service.document.MathDelimiters;
import com.williamcallahan.mathcore.service.document.MathDocumentReplacer;
import com.williamcallahan.mathcore.service.latex.LatexToMathMLConverter;
import com.williamcallahan.mathcore.service.latex.MacroDefinitionException;
import com.williamcallahan.mathcore.service.mathml.CounterScope;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Covers converter reuse, numbering scopes and document conversion through the service.
 */
class MathConversionServiceTest {

    private static final String NUMBERED = "\\begin{equation}x\\end{equation}";

    private MathConversionService service;

    @BeforeEach
    void setUp() {
        MathCoreProperties properties = new MathCoreProperties();
        service = new MathConversionService(new LatexToMathMLConverter(properties.toRenderConfig()), properties);
    }

    @Test
    void converterFor_reusesDefaultAndCachesOverrides() {
        RenderConfig defaults = service.defaultConfig();
        RenderConfig withMacro = defaults.withMacros(Map.of("R", "\\mathbb{R}"));

        LatexToMathMLConverter first = service.converterFor(withMacro);

        assertSame(service.converterFor(defaults), service.converterFor(null));
        assertSame(first, service.converterFor(defaults.withMacros(Map.of("R", "\\mathbb{R}"))));
        assertNotSame(service.converterFor(defaults), first);
    }

    @Test
    void render_usesOverriddenMacros() {
        RenderConfig withMacro = service.defaultConfig().withMacros(Map.of("R", "\\mathbb{R}"));

        assertEquals("<math><mi>ℝ</mi></math>",
            service.render("\\R", MathDisplay.INLINE, withMacro, CounterScope.LOCAL));
    }

    @Test
    void render_malformedOverrideMacroFails() {
        RenderConfig broken = service.defaultConfig().withMacros(Map.of("bad", "\\frac{1}"));

        assertThrows(MacroDefinitionException.class,
            () -> service.render("x", MathDisplay.INLINE, broken, CounterScope.LOCAL));
    }

    @Test
    void render_globalNumberingSpansConvertersUntilReset() {
        RenderConfig pretty = service.defaultConfig().withXmlNamespace(true);

        String first = service.render(NUMBERED, MathDisplay.BLOCK, service.defaultConfig(), CounterScope.GLOBAL);
        String second = service.render(NUMBERED, MathDisplay.BLOCK, pretty, CounterScope.GLOBAL);
        String local = service.render(NUMBERED, MathDisplay.BLOCK, pretty, CounterScope.LOCAL);

        assertTrue(first.contains("(1)"), first);
        assertTrue(second.contains("(2)"), second);
        assertTrue(local.contains("(1)"), local);
        assertEquals(2, service.resetGlobalCounter());

        String afterReset = service.render(NUMBERED, MathDisplay.BLOCK, null, CounterScope.GLOBAL);
        assertTrue(afterReset.contains("(1)"), afterReset);
    }

    @Test
    void renderDocument_numbersEquationsAcrossOneDocument() {
        MathDocumentReplacer replacer = new MathDocumentReplacer(MathDelimiters.LATEX, false, true);
        String content = "\\[" + NUMBERED + "\\] and \\[" + NUMBERED + "\\]";

        DocumentReplacement first = service.renderDocument(content, replacer, null, CounterScope.LOCAL);
        DocumentReplacement second = service.renderDocument(content, replacer, null, CounterScope.LOCAL);

        assertEquals(2, first.formulas());
        assertTrue(first.html().contains("(1)") && first.html().contains("(2)"), first.html());
        assertEquals(first.html(), second.html());
    }

    @Test
    void lookupSymbol_exposesTableEntries() {
        assertTrue(service.lookupSymbol('=').isPresent());
        assertTrue(service.lookupSymbol('a').isEmpty());
    }
}
