package com.williamcallahan.mathcore.service.document;

import com.williamcallahan.mathcore.domain.mathml.MathDisplay;
import com.williamcallahan.mathcore.service.document.DocumentReplacement.SkippedFormula;
import com.williamcallahan.mathcore.service.latex.LatexConversionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds delimited formulas in a text or HTML document and replaces each with its markup.
 *
 * <p>Formulas may not nest, and every opening delimiter must be closed by the closing delimiter
 * of the same kind. HTML entities inside a formula ({@code &lt;}, {@code &amp;}) are decoded
 * before conversion, since the formula was authored as HTML text.</p>
 */
public final class MathDocumentReplacer {

    private static final Logger log = LoggerFactory.getLogger(MathDocumentReplacer.class);

    private final MathDelimiters delimiters;
    private final boolean continueOnError;
    private final boolean ignoreEscapedDelimiters;

    /**
     * Creates a replacer.
     *
     * @param delimiters formula delimiters
     * @param continueOnError leave failed formulas verbatim instead of aborting
     * @param ignoreEscapedDelimiters skip delimiters preceded by an unescaped backslash
     */
    public MathDocumentReplacer(MathDelimiters delimiters, boolean continueOnError, boolean ignoreEscapedDelimiters) {
        this.delimiters = Objects.requireNonNull(delimiters, "delimiters");
        this.continueOnError = continueOnError;
        this.ignoreEscapedDelimiters = ignoreEscapedDelimiters;
    }

    /**
     * Replaces every delimited formula in the document.
     *
     * @param document source text
     * @param renderer converts one formula
     * @return the rewritten document and formula counts
     * @throws MathDocumentException on malformed delimiters, or on the first conversion failure
     *     unless continue-on-error is set
     */
    public DocumentReplacement replace(String document, FormulaRenderer renderer) {
        Objects.requireNonNull(renderer, "renderer");
        String input = document == null ? "" : document;
        StringBuilder output = new StringBuilder(input.length());
        List<SkippedFormula> skipped = new ArrayList<>();
        int converted = 0;
        int position = 0;
        while (position < input.length()) {
            DelimiterMatch opening = findNext(input, position, delimiters.inlineOpen(), delimiters.blockOpen());
            if (opening == null) {
                output.append(input, position, input.length());
                break;
            }
            output.append(input, position, opening.index());
            int contentStart = opening.end();
            DelimiterMatch closing = findNext(input, contentStart, delimiters.inlineClose(), delimiters.blockClose());
            if (closing == null) {
                throw failure(DocumentErrorKind.UNCLOSED_DELIMITER, input, opening.index());
            }
            if (closing.display() != opening.display()) {
                throw failure(DocumentErrorKind.MISMATCHED_DELIMITERS, input, closing.index());
            }
            String content = input.substring(contentStart, closing.index());
            DelimiterMatch nested = findNext(content, 0, delimiters.inlineOpen(), delimiters.blockOpen());
            if (nested != null) {
                throw failure(DocumentErrorKind.NESTED_DELIMITERS, input, contentStart + nested.index());
            }
            MathDisplay display = opening.display() ? MathDisplay.BLOCK : MathDisplay.INLINE;
            String latex = Parser.unescapeEntities(content, false);
            try {
                output.append(renderer.render(latex, display));
                converted++;
            } catch (LatexConversionException conversionFailure) {
                int[] location = locate(input, opening.index());
                if (!continueOnError) {
                    throw new MathDocumentException(DocumentErrorKind.CONVERSION_FAILED, location[0], location[1],
                        conversionFailure.getError().describe(), conversionFailure);
                }
                log.warn("Leaving formula at {}:{} unconverted: {}",
                    location[0], location[1], conversionFailure.getMessage());
                skipped.add(new SkippedFormula(location[0], location[1], conversionFailure.getError().describe()));
                output.append(input, opening.index(), closing.end());
            }
            position = closing.end();
        }
        log.debug("Replaced {} formulas ({} skipped)", converted, skipped.size());
        return new DocumentReplacement(output.toString(), converted, skipped);
    }

    /**
     * Finds the nearest inline or block delimiter at or after {@code from}. The block delimiter
     * wins a tie, so {@code $$} is never read as two inline openers.
     */
    private DelimiterMatch findNext(String text, int from, String inlineToken, String blockToken) {
        int inlineIndex = indexOf(text, inlineToken, from);
        int blockIndex = indexOf(text, blockToken, from);
        if (blockIndex >= 0 && (inlineIndex < 0 || blockIndex <= inlineIndex)) {
            return new DelimiterMatch(true, blockIndex, blockIndex + blockToken.length());
        }
        if (inlineIndex >= 0) {
            return new DelimiterMatch(false, inlineIndex, inlineIndex + inlineToken.length());
        }
        return null;
    }

    private int indexOf(String text, String token, int from) {
        int index = text.indexOf(token, from);
        while (ignoreEscapedDelimiters && index >= 0 && isEscaped(text, index)) {
            index = text.indexOf(token, index + 1);
        }
        return index;
    }

    private static boolean isEscaped(String text, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    private static MathDocumentException failure(DocumentErrorKind kind, String input, int index) {
        int[] location = locate(input, index);
        return new MathDocumentException(kind, location[0], location[1]);
    }

    /** Returns the 1-based line and column of a character index. */
    static int[] locate(String text, int index) {
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < index; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new int[] {line, text.codePointCount(lineStart, index) + 1};
    }

    private record DelimiterMatch(boolean display, int index, int end) {
    }
}
