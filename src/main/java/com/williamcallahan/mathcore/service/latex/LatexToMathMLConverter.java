package com.williamcallahan.mathcore.service.latex;

import com.williamcallahan.mathcore.domain.mathml.ErrorPolicy;
import com.williamcallahan.mathcore.domain.mathml.MathDisplay;
import com.williamcallahan.mathcore.domain.mathml.RenderConfig;
import com.williamcallahan.mathcore.service.mathml.CounterScope;
import com.williamcallahan.mathcore.service.mathml.EquationCounter;
import com.williamcallahan.mathcore.service.mathml.MathMLRenderer;
import com.williamcallahan.mathcore.service.mathml.MathNode;
import com.williamcallahan.mathcore.service.mathml.MathNode.Annotated;
import com.williamcallahan.mathcore.service.mathml.MathNode.Row;
import com.williamcallahan.mathcore.service.mathml.XmlEscaper;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts LaTeX math to MathML under a fixed {@link RenderConfig}.
 *
 * <p>Macros are compiled once, in the constructor. After construction the converter is safe to
 * share between threads: conversions with the local counter share no state, and conversions with
 * the global counter are serialized on that counter.</p>
 */
public final class LatexToMathMLConverter {

    private static final Logger log = LoggerFactory.getLogger(LatexToMathMLConverter.class);

    /** CSS class of the fallback markup written under {@link ErrorPolicy#continueInline()}. */
    public static final String ERROR_CSS_CLASS = "math-core-error";

    private final RenderConfig config;
    private final MacroTable macros;
    private final MathMLRenderer renderer;
    private final EquationCounter globalCounter = new EquationCounter(CounterScope.GLOBAL);

    /**
     * Creates a converter.
     *
     * @param config conversion settings
     * @throws MacroDefinitionException when a configured macro is malformed
     */
    public LatexToMathMLConverter(RenderConfig config) {
        this.config = Objects.requireNonNull(config, "Render config cannot be null");
        this.macros = MacroTable.compile(config.macros());
        this.renderer = new MathMLRenderer(config.prettyPrint(), config.xmlNamespace());
        log.debug("Created converter (prettyPrint={}, macros={}, policy={})",
            config.prettyPrint(), macros.size(), config.errorPolicy());
    }

    /**
     * Converts with equation numbering restarting at 1.
     *
     * @param latex math source
     * @param display display mode
     * @return MathML markup, or fallback markup under the continue-inline policy
     * @throws LatexConversionException when conversion fails and the policy raises
     */
    public String convert(String latex, MathDisplay display) {
        return convert(latex, display, EquationCounter.local());
    }

    /**
     * Converts with equation numbering that continues across calls until
     * {@link #resetGlobalCounter()}. Concurrent calls are serialized.
     *
     * @param latex math source
     * @param display display mode
     * @return MathML markup, or fallback markup under the continue-inline policy
     * @throws LatexConversionException when conversion fails and the policy raises
     */
    public String convertWithGlobalCounter(String latex, MathDisplay display) {
        synchronized (globalCounter) {
            return convert(latex, display, globalCounter);
        }
    }

    public void resetGlobalCounter() {
        globalCounter.reset();
    }

    /**
     * Returns the last equation number handed out by the global counter.
     *
     * @return 0 after construction or reset
     */
    public int globalCounterValue() {
        return globalCounter.current();
    }

    public RenderConfig config() {
        return config;
    }

    /**
     * Converts with a caller-owned equation counter, for numbering that spans several formulas
     * such as the equations of one document. The caller serializes access to a shared counter.
     *
     * @param latex math source
     * @param display display mode
     * @param counter counter handing out equation numbers
     * @return MathML markup, or fallback markup under the continue-inline policy
     * @throws LatexConversionException when conversion fails and the policy raises
     */
    public String convert(String latex, MathDisplay display, EquationCounter counter) {
        Objects.requireNonNull(counter, "Equation counter cannot be null");
        String source = latex == null ? "" : latex;
        MathDisplay mode = display == null ? MathDisplay.INLINE : display;
        ErrorPolicy policy = config.errorPolicy();
        try {
            TokenStream tokens = new TokenStream(new Lexer(source).tokenize(), macros);
            Row root = new Parser(tokens, mode, policy.ignoreUnknownCommands(), Set.of()).parse();
            MathNode tree = config.annotation() ? new Annotated(root, source, root.span()) : root;
            return renderer.render(tree, mode, counter);
        } catch (LatexConversionException conversionFailure) {
            if (!policy.continueInline()) {
                throw conversionFailure;
            }
            log.debug("Rendering fallback markup: {}", conversionFailure.getMessage());
            return errorHtml(source, mode, conversionFailure.getError());
        }
    }

    /**
     * Formats a failure as HTML fallback markup.
     *
     * <p>Block formulas use a paragraph, inline formulas a span. The title carries
     * {@code "{offset}: {message}."} and the code child the source from the error offset to the
     * end of the formula; both are XML-escaped.</p>
     *
     * @param latex the failing formula
     * @param display display mode of the formula
     * @param error the failure
     * @return fallback markup
     */
    public static String errorHtml(String latex, MathDisplay display, LatexError error) {
        String tag = display == MathDisplay.BLOCK ? "p" : "span";
        return "<" + tag + " class=\"" + ERROR_CSS_CLASS + "\" title=\"" + XmlEscaper.attribute(error.describe())
            + "\"><code>" + XmlEscaper.content(Utf8.suffixFrom(latex, error.offset()))
            + "</code></" + tag + ">";
    }
}
