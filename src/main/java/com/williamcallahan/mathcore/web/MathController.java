package com.williamcallahan.mathcore.web;

import com.williamcallahan.mathcore.config.MathCoreProperties;
import com.williamcallahan.mathcore.domain.mathml.MathDisplay;
import com.williamcallahan.mathcore.domain.mathml.RenderConfig;
import com.williamcallahan.mathcore.service.MathConversionService;
import com.williamcallahan.mathcore.service.document.DocumentReplacement;
import com.williamcallahan.mathcore.service.document.MathDelimiters;
import com.williamcallahan.mathcore.service.document.MathDocumentException;
import com.williamcallahan.mathcore.service.document.MathDocumentReplacer;
import com.williamcallahan.mathcore.service.latex.LatexConversionException;
import com.williamcallahan.mathcore.service.latex.MacroDefinitionException;
import com.williamcallahan.mathcore.service.mathml.CounterScope;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for LaTeX to MathML conversion.
 */
@RestController
@RequestMapping("/api/math")
public class MathController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(MathController.class);

    private final MathConversionService conversionService;
    private final MathCoreProperties properties;

    public MathController(MathConversionService conversionService, MathCoreProperties properties,
                          ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.conversionService = conversionService;
        this.properties = properties;
    }

    /**
     * Converts one formula.
     *
     * @param request A JSON object with the formula. Expected format:
     *                <pre>{@code
     *                  {"latex": "x^2", "display": "block", "options": {"prettyPrint": "auto"}}
     *                }</pre>
     * @return {@code {"status": "success", "mathml": "<math>...", "display": "block"}}, 422 with
     *         the failure offset when the formula does not convert
     */
    @PostMapping(value = "/render",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse> render(@RequestBody MathRenderRequest request) {
        try {
            if (request == null || request.latex() == null) {
                return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "latex is required");
            }
            MathDisplay display = MathDisplay.fromName(request.display());
            MathRenderOptions options = request.options();
            RenderConfig config = options == null
                ? conversionService.defaultConfig()
                : options.applyTo(conversionService.defaultConfig());
            CounterScope scope = options == null ? CounterScope.LOCAL : options.counterScope();

            log.debug("Rendering {} formula of length {}", display, request.latex().length());
            String mathml = conversionService.render(request.latex(), display, config, scope);
            return ResponseEntity.ok(MathRenderResponse.success(mathml, display.name().toLowerCase(Locale.ROOT)));
        } catch (LatexConversionException conversionFailure) {
            log.warn("Formula conversion failed: {}", conversionFailure.getMessage());
            return handleConversionException(conversionFailure);
        } catch (MacroDefinitionException macroFailure) {
            log.warn("Rejected macro definition: {}", macroFailure.getMessage());
            return handleValidationException(macroFailure);
        } catch (IllegalArgumentException e) {
            return handleValidationException(e);
        } catch (Exception e) {
            log.error("Unexpected error rendering formula: {}", e.getMessage(), e);
            return handleServiceException(e, "render formula");
        }
    }

    /**
     * Converts every delimited formula in a document.
     *
     * @param request A JSON object with the document. Expected format:
     *                <pre>{@code
     *                  {"content": "<p>Let \\(x\\) be...</p>", "delimiters": "latex", "continueOnError": true}
     *                }</pre>
     * @return {@code {"status": "success", "html": "...", "formulas": 1, "skipped": []}}, 422 on
     *         malformed delimiters or an aborting conversion failure
     */
    @PostMapping(value = "/document",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse> renderDocument(@RequestBody MathDocumentRequest request) {
        try {
            if (request == null || request.content() == null) {
                return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "content is required");
            }
            MathCoreProperties.Document defaults = properties.getDocument();
            MathDelimiters delimiters = MathDelimiters.fromName(
                request.delimiters() != null ? request.delimiters() : defaults.getDelimiters());
            MathDocumentReplacer replacer = new MathDocumentReplacer(
                delimiters,
                request.continueOnError() != null ? request.continueOnError() : defaults.isContinueOnError(),
                request.ignoreEscapedDelimiters() != null
                    ? request.ignoreEscapedDelimiters()
                    : defaults.isIgnoreEscapedDelimiters());
            MathRenderOptions options = request.options();
            RenderConfig config = options == null
                ? conversionService.defaultConfig()
                : options.applyTo(conversionService.defaultConfig());
            CounterScope scope = options == null ? CounterScope.LOCAL : options.counterScope();

            DocumentReplacement replacement = conversionService.renderDocument(request.content(), replacer, config, scope);
            return ResponseEntity.ok(MathDocumentResponse.from(replacement));
        } catch (MathDocumentException documentFailure) {
            log.warn("Document conversion failed: {}", documentFailure.getMessage());
            return exceptionBuilder.buildErrorResponse(
                HttpStatus.UNPROCESSABLE_ENTITY, documentFailure.getMessage(), documentFailure);
        } catch (MacroDefinitionException macroFailure) {
            log.warn("Rejected macro definition: {}", macroFailure.getMessage());
            return handleValidationException(macroFailure);
        } catch (IllegalArgumentException e) {
            return handleValidationException(e);
        } catch (Exception e) {
            log.error("Unexpected error rendering document: {}", e.getMessage(), e);
            return handleServiceException(e, "render document");
        }
    }

    /**
     * Restarts global equation numbering at 1.
     *
     * @return success message with the previous counter value
     */
    @PostMapping(value = "/counter/reset", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse> resetCounter() {
        try {
            int previous = conversionService.resetGlobalCounter();
            return createSuccessResponse("Global equation counter reset (was " + previous + ")");
        } catch (Exception e) {
            log.error("Counter reset failed: {}", e.getMessage(), e);
            return handleServiceException(e, "reset counter");
        }
    }

    /**
     * Looks up the operator metadata of a codepoint.
     *
     * @param codepoint hexadecimal codepoint, optionally prefixed with {@code U+} or {@code 0x}
     * @return the symbol descriptor, or 404 when the codepoint has no entry
     */
    @GetMapping(value = "/symbols/{codepoint}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse> symbol(@PathVariable("codepoint") String codepoint) {
        try {
            int value = parseCodepoint(codepoint);
            return conversionService.lookupSymbol(value)
                .<ResponseEntity<ApiResponse>>map(descriptor -> ResponseEntity.ok(SymbolDescriptorResponse.from(descriptor)))
                .orElseGet(() -> exceptionBuilder.buildErrorResponse(
                    HttpStatus.NOT_FOUND, "No symbol entry for " + codepoint));
        } catch (IllegalArgumentException e) {
            return handleValidationException(e);
        }
    }

    static int parseCodepoint(String text) {
        String digits = text == null ? "" : text.trim();
        String upper = digits.toUpperCase(Locale.ROOT);
        if (upper.startsWith("U+") || upper.startsWith("0X")) {
            digits = digits.substring(2);
        }
        try {
            int value = Integer.parseInt(digits, 16);
            if (!Character.isValidCodePoint(value)) {
                throw new IllegalArgumentException("Codepoint out of range: " + text);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid codepoint: " + text, e);
        }
    }
}
