package com.williamcallahan.mathcore.service.latex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.mathcore.domain.mathml.ErrorPolicy;
import com.williamcallahan.mathcore.domain.mathml.MathDisplay;
import com.williamcallahan.mathcore.domain.mathml.RenderConfig;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Covers end-to-end conversion behavior, error policies and equation numbering.
 */
class LatexToMathMLConverterTest {

    private final LatexToMathMLConverter converter = new LatexToMathMLConverter(RenderConfig.defaults());

    @Test
    @DisplayName("Single identifier converts to a bare math root")
    void convert_singleIdentifier() {
        assertEquals("<math><mi>x</mi></math>", converter.convert("x", MathDisplay.INLINE));
        assertEquals("<math display=\"block\"><mi>x</mi></math>", converter.convert("x", MathDisplay.BLOCK));
    }

    @Test
    void convert_addsNamespaceWhenConfigured() {
        LatexToMathMLConverter namespaced = new LatexToMathMLConverter(RenderConfig.defaults().withXmlNamespace(true));

        assertEquals("<math xmlns=\"http://www.w3.org/1998/Math/MathML\"><mi>x</mi></math>",
            namespaced.convert("x", MathDisplay.INLINE));
    }

    @Test
    void convert_isIdempotentWithCompactOutput() {
        String source = "\\frac{a+b}{\\sqrt[3]{x}} \\le \\sum_{i=1}^{n} i^2";

        assertEquals(converter.convert(source, MathDisplay.BLOCK), converter.convert(source, MathDisplay.BLOCK));
    }

    @Test
    @DisplayName("Annotation holds the exact source and survives an XML round-trip")
    void convert_annotationRoundTrip() {
        LatexToMathMLConverter annotated = new LatexToMathMLConverter(RenderConfig.defaults().withAnnotation(true));
        String source = "a<b \\text{&} c>d";

        String mathml = annotated.convert(source, MathDisplay.INLINE);
        Document document = Jsoup.parse(mathml, "", Parser.xmlParser());

        assertTrue(mathml.startsWith("<math><semantics><mrow>"), mathml);
        assertTrue(mathml.contains("<annotation encoding=\"application/x-tex\">a&lt;b \\text{&amp;} c&gt;d</annotation>"),
            mathml);
        assertEquals(source, document.selectFirst("annotation").wholeText());
    }

    @Test
    void convert_unknownCommandRaisesAtOffsetZeroByDefault() {
        LatexConversionException error = assertThrows(LatexConversionException.class,
            () -> converter.convert("\\asdf x", MathDisplay.INLINE));

        assertEquals(LatexErrorKind.UNKNOWN_COMMAND, error.getKind());
        assertEquals(0, error.getOffset());
        assertEquals("0: Unknown command \"\\asdf\".", error.getMessage());
    }

    @Test
    void convert_continueInlineRendersSpanFallbackForInlineFormulas() {
        LatexToMathMLConverter lenient = new LatexToMathMLConverter(
            RenderConfig.defaults().withErrorPolicy(ErrorPolicy.CONTINUE_INLINE));

        String html = lenient.convert("\\asdf<b>", MathDisplay.INLINE);

        assertEquals("<span class=\"math-core-error\" title=\"0: Unknown command &quot;\\asdf&quot;.\">"
            + "<code>\\asdf&lt;b&gt;</code></span>", html);
    }

    @Test
    void convert_continueInlineRendersParagraphFallbackForBlockFormulas() {
        LatexToMathMLConverter lenient = new LatexToMathMLConverter(
            RenderConfig.defaults().withErrorPolicy(ErrorPolicy.CONTINUE_INLINE));

        String html = lenient.convert("x+\u0001y", MathDisplay.BLOCK);

        assertTrue(html.startsWith("<p class=\"math-core-error\" title=\"2: Disallowed character: U+0001.\"><code>"), html);
        assertTrue(html.endsWith("y</code></p>"), html);
    }

    @Test
    void convert_ignoreUnknownCommandsRendersPlaceholder() {
        LatexToMathMLConverter lenient = new LatexToMathMLConverter(
            RenderConfig.defaults().withErrorPolicy(ErrorPolicy.IGNORE_UNKNOWN_COMMANDS));

        assertEquals("<math><merror><mtext>\\foo</mtext></merror><mo>+</mo><mi>x</mi></math>",
            lenient.convert("\\foo+x", MathDisplay.INLINE));
    }

    @Test
    void convert_ignoreUnknownCommandsStillRaisesOtherErrors() {
        LatexToMathMLConverter lenient = new LatexToMathMLConverter(
            RenderConfig.defaults().withErrorPolicy(ErrorPolicy.IGNORE_UNKNOWN_COMMANDS));

        LatexConversionException error = assertThrows(LatexConversionException.class,
            () -> lenient.convert("\\foo^", MathDisplay.INLINE));
        assertEquals(LatexErrorKind.ARGUMENT, error.getKind());
    }

    @Test
    void convert_ignoreUnknownCommandsKeepsUnknownNamesInOperatorNames() {
        LatexToMathMLConverter lenient = new LatexToMathMLConverter(
            RenderConfig.defaults().withErrorPolicy(ErrorPolicy.IGNORE_UNKNOWN_COMMANDS));

        assertEquals("<math><mi>\\asdf</mi><mo>\u2061</mo></math>",
            lenient.convert("\\operatorname{\\asdf}", MathDisplay.INLINE));
    }

    @Test
    void convert_continueInlineCoversRunawayStyleSwitches() {
        LatexToMathMLConverter lenient = new LatexToMathMLConverter(
            RenderConfig.defaults().withErrorPolicy(ErrorPolicy.CONTINUE_INLINE));

        String html = lenient.convert("\\displaystyle ".repeat(50_000) + "x", MathDisplay.INLINE);

        assertTrue(html.startsWith("<span class=\"math-core-error\" title=\"1400: Nesting limit exceeded.\"><code>"),
            html.substring(0, 120));
    }

    @Test
    void convert_superscriptAtEndOfInputIsAnArgumentError() {
        LatexConversionException error = assertThrows(LatexConversionException.class,
            () -> converter.convert("é^", MathDisplay.INLINE));

        assertEquals(LatexErrorKind.ARGUMENT, error.getKind());
        assertEquals(2, error.getOffset());
        assertTrue(error.getError().message().contains("argument"), error.getMessage());
    }

    @Test
    void convert_expandsMacroIntoSiblingIdentifiers() {
        LatexToMathMLConverter withMacros = new LatexToMathMLConverter(
            RenderConfig.defaults().withMacros(Map.of("foo", "ab")));

        assertEquals("<math><mi>a</mi><mi>b</mi></math>", withMacros.convert("\\foo", MathDisplay.INLINE));
    }

    @Test
    void convert_substitutesMacroArguments() {
        LatexToMathMLConverter withMacros = new LatexToMathMLConverter(
            RenderConfig.defaults().withMacros(Map.of("pow", "#1^{#2}")));

        assertEquals("<math><msup><mi>x</mi><mn>2</mn></msup></math>",
            withMacros.convert("\\pow{x}{2}", MathDisplay.INLINE));
    }

    @Test
    @DisplayName("Macro parameters may stand for literal arguments of hspace, text and operatorname")
    void convert_substitutesLiteralMacroArguments() {
        Map<String, String> macros = new LinkedHashMap<>();
        macros.put("hs", "\\hspace{#1}");
        macros.put("word", "\\text{#1}");
        macros.put("lbl", "\\text{is #1}");
        macros.put("op", "\\operatorname{#1}");
        LatexToMathMLConverter withMacros = new LatexToMathMLConverter(RenderConfig.defaults().withMacros(macros));

        assertEquals("<math><mspace width=\"0.1667em\"/></math>", withMacros.convert("\\hs{3mu}", MathDisplay.INLINE));
        assertEquals("<math><mtext>a b</mtext></math>", withMacros.convert("\\word{a b}", MathDisplay.INLINE));
        assertEquals("<math><mtext>is x</mtext></math>", withMacros.convert("\\lbl{x}", MathDisplay.INLINE));
        assertEquals("<math><mi>rank</mi><mo>\u2061</mo><mi>A</mi></math>",
            withMacros.convert("\\op{rank}A", MathDisplay.INLINE));
    }

    @Test
    void convert_literalMacroArgumentsAreStillChecked() {
        LatexToMathMLConverter withMacros = new LatexToMathMLConverter(
            RenderConfig.defaults().withMacros(Map.of("hs", "\\hspace{#1}")));

        LatexConversionException error = assertThrows(LatexConversionException.class,
            () -> withMacros.convert("a\\hs{3}", MathDisplay.INLINE));
        assertEquals(LatexErrorKind.ARGUMENT, error.getKind());
        assertEquals(1, error.getOffset());
        assertEquals("Expected length with units, got \"3\"", error.getError().message());
    }

    @Test
    @DisplayName("Errors inside expanded macros point at the use site")
    void convert_reportsExpansionErrorsAtTheInvocation() {
        LatexToMathMLConverter withMacros = new LatexToMathMLConverter(
            RenderConfig.defaults().withMacros(Map.of("pow", "#1^{#2}")));

        LatexConversionException missing = assertThrows(LatexConversionException.class,
            () -> withMacros.convert("a+\\pow{x}", MathDisplay.INLINE));
        assertEquals("2: Expected argument but reached end of input.", missing.getMessage());

        LatexConversionException unknown = assertThrows(LatexConversionException.class,
            () -> withMacros.convert("ab\\pow{\\nope}{2}", MathDisplay.INLINE));
        assertEquals(LatexErrorKind.UNKNOWN_COMMAND, unknown.getKind());
        assertEquals(2, unknown.getOffset());
    }

    @Test
    void construct_failsEagerlyOnMalformedMacros() {
        Map<String, String> macros = new LinkedHashMap<>();
        macros.put("ok", "x");
        macros.put("bad", "\\frac{1}");
        RenderConfig config = RenderConfig.defaults().withMacros(macros);

        MacroDefinitionException error = assertThrows(MacroDefinitionException.class,
            () -> new LatexToMathMLConverter(config));
        assertEquals("macro1:0", error.location());
    }

    @Test
    void convertWithGlobalCounter_numbersAcrossCallsUntilReset() {
        String equation = "\\begin{equation}x\\end{equation}";

        assertTrue(converter.convertWithGlobalCounter(equation, MathDisplay.BLOCK).contains("<mtext>(1)</mtext>"));
        assertTrue(converter.convertWithGlobalCounter(equation, MathDisplay.BLOCK).contains("<mtext>(2)</mtext>"));
        assertEquals(2, converter.globalCounterValue());

        converter.resetGlobalCounter();

        assertTrue(converter.convertWithGlobalCounter(equation, MathDisplay.BLOCK).contains("<mtext>(1)</mtext>"));
    }

    @Test
    void convertWithGlobalCounter_handsOutUniqueNumbersAcrossThreads() throws Exception {
        String equation = "\\begin{equation}x\\end{equation}";
        Pattern label = Pattern.compile("<mtext>\\((\\d+)\\)</mtext>");
        int conversions = 200;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < conversions; i++) {
                results.add(pool.submit(() -> converter.convertWithGlobalCounter(equation, MathDisplay.BLOCK)));
            }
            Set<Integer> numbers = new HashSet<>();
            for (Future<String> result : results) {
                Matcher matcher = label.matcher(result.get(30, TimeUnit.SECONDS));
                assertTrue(matcher.find());
                assertTrue(numbers.add(Integer.parseInt(matcher.group(1))), "duplicate " + matcher.group(1));
            }

            assertEquals(IntStream.rangeClosed(1, conversions).boxed().collect(Collectors.toSet()), numbers);
            assertEquals(conversions, converter.globalCounterValue());
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        }
    }

    @Test
    void convert_localCounterRestartsEveryCall() {
        String equations = "\\begin{align}a&=b\\\\c&=d\\end{align}";

        String first = converter.convert(equations, MathDisplay.BLOCK);
        String second = converter.convert(equations, MathDisplay.BLOCK);

        assertTrue(first.contains("<mtext>(1)</mtext>") && first.contains("<mtext>(2)</mtext>"), first);
        assertEquals(first, second);
        assertEquals(0, converter.globalCounterValue());
    }

    @Test
    void errorHtml_escapesTitleAndCode() {
        LatexError error = new LatexError(LatexErrorKind.STRUCTURAL, 1, "Got \"&\"");

        assertEquals("<p class=\"math-core-error\" title=\"1: Got &quot;&amp;&quot;.\"><code>&amp;&lt;</code></p>",
            LatexToMathMLConverter.errorHtml("a&<", MathDisplay.BLOCK, error));
    }
}
