package com.williamcallahan.mathcore.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.williamcallahan.mathcore.service.document.DocumentErrorKind;
import com.williamcallahan.mathcore.service.document.MathDocumentException;
import com.williamcallahan.mathcore.service.latex.LatexConversionException;
import com.williamcallahan.mathcore.service.latex.LatexErrorKind;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Verifies exception descriptions include conversion locations when available.
 */
class ExceptionResponseBuilderTest {

    private final ExceptionResponseBuilder builder = new ExceptionResponseBuilder();

    @Test
    void describeException_includesKindAndOffsetForConversionFailures() {
        LatexConversionException failure = new LatexConversionException(LatexErrorKind.ARGUMENT, 4,
            "Expected argument but reached end of input");

        assertEquals("kind=ARGUMENT, error=4: Expected argument but reached end of input.",
            builder.describeException(failure));
    }

    @Test
    void describeException_includesCauseOfDocumentFailures() {
        LatexConversionException cause = new LatexConversionException(LatexErrorKind.STRUCTURAL, 1, "Nesting limit exceeded");
        MathDocumentException failure = new MathDocumentException(DocumentErrorKind.CONVERSION_FAILED, 3, 7,
            cause.getError().describe(), cause);

        assertEquals("kind=CONVERSION_FAILED, line=3, column=7, error=1: Nesting limit exceeded.",
            builder.describeException(failure));
    }

    @Test
    void describeException_fallsBackToTypeAndMessage() {
        assertEquals("IllegalStateException: boom", builder.describeException(new IllegalStateException("boom")));
        assertEquals("IllegalStateException", builder.describeException(new IllegalStateException()));
        assertNull(builder.describeException(null));
    }

    @Test
    void buildConversionErrorResponse_isUnprocessableWithOffset() {
        LatexConversionException failure = new LatexConversionException(LatexErrorKind.LEX, 9, "Invalid character");

        ResponseEntity<ApiResponse> response = builder.buildConversionErrorResponse(failure);

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        ApiErrorResponse body = assertInstanceOf(ApiErrorResponse.class, response.getBody());
        assertEquals("Invalid character", body.message());
        assertEquals(9, body.offset());
    }
}
