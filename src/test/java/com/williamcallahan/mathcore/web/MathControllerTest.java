package com.williamcallahan.mathcore.web;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.williamcallahan.mathcore.config.MathCoreProperties;
import com.williamcallahan.mathcore.domain.mathml.MathDisplay;
import com.williamcallahan.mathcore.domain.mathml.RenderConfig;
import com.williamcallahan.mathcore.service.MathConversionService;
import com.williamcallahan.mathcore.service.document.DocumentErrorKind;
import com.williamcallahan.mathcore.service.document.DocumentReplacement;
import com.williamcallahan.mathcore.service.document.DocumentReplacement.SkippedFormula;
import com.williamcallahan.mathcore.service.document.MathDocumentException;
import com.williamcallahan.mathcore.service.latex.LatexConversionException;
import com.williamcallahan.mathcore.service.latex.LatexErrorKind;
import com.williamcallahan.mathcore.service.mathml.CounterScope;
import com.williamcallahan.mathcore.service.mathml.symbol.SymbolTable;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Verifies the math endpoints map service results and failures to JSON responses under WebMvcTest.
 */
@WebMvcTest(controllers = MathController.class)
@Import({ExceptionResponseBuilder.class, MathCoreProperties.class})
class MathControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    MathConversionService conversionService;

    @BeforeEach
    void defaultConfiguration() {
        given(conversionService.defaultConfig()).willReturn(RenderConfig.defaults());
    }

    @Test
    void render_returnsMathmlAndDisplay() throws Exception {
        given(conversionService.render(eq("x^2"), eq(MathDisplay.BLOCK), any(RenderConfig.class), eq(CounterScope.LOCAL)))
            .willReturn("<math display=\"block\"><msup><mi>x</mi><mn>2</mn></msup></math>");

        mockMvc.perform(post("/api/math/render")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"latex\": \"x^2\", \"display\": \"block\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"))
            .andExpect(jsonPath("$.display").value("block"))
            .andExpect(jsonPath("$.mathml").value(containsString("<msup>")));
    }

    @Test
    void render_requiresLatex() throws Exception {
        mockMvc.perform(post("/api/math/render")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"display\": \"inline\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.message").value("latex is required"));
    }

    @Test
    void render_rejectsUnknownDisplay() throws Exception {
        mockMvc.perform(post("/api/math/render")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"latex\": \"x\", \"display\": \"sideways\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value(containsString("Invalid display value")));
    }

    @Test
    void render_reportsConversionFailureWithOffset() throws Exception {
        given(conversionService.render(anyString(), any(), any(), any()))
            .willThrow(new LatexConversionException(LatexErrorKind.UNKNOWN_COMMAND, 2, "Unknown command \"\\foo\""));

        mockMvc.perform(post("/api/math/render")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"latex\": \"x+\\\\foo\"}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.message").value("Unknown command \"\\foo\""))
            .andExpect(jsonPath("$.offset").value(2))
            .andExpect(jsonPath("$.details").value("kind=UNKNOWN_COMMAND, error=2: Unknown command \"\\foo\"."));
    }

    @Test
    void render_appliesOptionsAndGlobalCounter() throws Exception {
        given(conversionService.render(anyString(), any(), any(), any())).willReturn("<math></math>");

        mockMvc.perform(post("/api/math/render")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"latex\": \"\\\\R\", \"options\": {\"prettyPrint\": \"auto\", "
                    + "\"macros\": {\"R\": \"\\\\mathbb{R}\"}, \"counter\": \"global\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.display").value("inline"));

        then(conversionService).should().render(eq("\\R"), eq(MathDisplay.INLINE),
            argThat(config -> "\\mathbb{R}".equals(config.macros().get("R"))), eq(CounterScope.GLOBAL));
    }

    @Test
    void render_rejectsUnknownCounterScope() throws Exception {
        mockMvc.perform(post("/api/math/render")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"latex\": \"x\", \"options\": {\"counter\": \"shared\"}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value(containsString("Invalid counter value")));
    }

    @Test
    void renderDocument_returnsRewrittenHtmlAndCounts() throws Exception {
        given(conversionService.renderDocument(anyString(), any(), any(), eq(CounterScope.LOCAL)))
            .willReturn(new DocumentReplacement("<p><math><mi>x</mi></math> $\\foo$</p>", 1,
                List.of(new SkippedFormula(1, 8, "0: Unknown command \"\\foo\"."))));

        mockMvc.perform(post("/api/math/document")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\": \"<p>$x$ $\\\\foo$</p>\", \"delimiters\": \"dollars\", \"continueOnError\": true}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"))
            .andExpect(jsonPath("$.formulas").value(1))
            .andExpect(jsonPath("$.skipped", hasSize(1)))
            .andExpect(jsonPath("$.skipped[0].column").value(8));
    }

    @Test
    void renderDocument_reportsDelimiterErrors() throws Exception {
        given(conversionService.renderDocument(anyString(), any(), any(), any()))
            .willThrow(new MathDocumentException(DocumentErrorKind.UNCLOSED_DELIMITER, 1, 10));

        mockMvc.perform(post("/api/math/document")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\": \"Unclosed \\\\(delimiter\"}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.message").value("1:10: Unclosed delimiter"))
            .andExpect(jsonPath("$.details").value("kind=UNCLOSED_DELIMITER, line=1, column=10"));
    }

    @Test
    void renderDocument_rejectsUnknownDelimiterStyle() throws Exception {
        mockMvc.perform(post("/api/math/document")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\": \"text\", \"delimiters\": \"brackets\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Unknown delimiter style: brackets"));
    }

    @Test
    void renderDocument_requiresContent() throws Exception {
        mockMvc.perform(post("/api/math/document")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("content is required"));
    }

    @Test
    void resetCounter_reportsPreviousValue() throws Exception {
        given(conversionService.resetGlobalCounter()).willReturn(3);

        mockMvc.perform(post("/api/math/counter/reset"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"))
            .andExpect(jsonPath("$.message").value("Global equation counter reset (was 3)"));
    }

    @Test
    void symbol_returnsDescriptor() throws Exception {
        given(conversionService.lookupSymbol(0x2211)).willReturn(SymbolTable.find(0x2211));

        mockMvc.perform(get("/api/math/symbols/U+2211"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.codepoint").value("U+2211"))
            .andExpect(jsonPath("$.symbolClass").value("OPERATOR"))
            .andExpect(jsonPath("$.largeOperator").value(true))
            .andExpect(jsonPath("$.movableLimits").value(true));
    }

    @Test
    void symbol_returnsNotFoundWithoutEntry() throws Exception {
        given(conversionService.lookupSymbol(0x41)).willReturn(Optional.empty());

        mockMvc.perform(get("/api/math/symbols/0041"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("No symbol entry for 0041"));
    }

    @Test
    void symbol_rejectsMalformedCodepoint() throws Exception {
        mockMvc.perform(get("/api/math/symbols/zz"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Invalid codepoint: zz"));
    }
}
