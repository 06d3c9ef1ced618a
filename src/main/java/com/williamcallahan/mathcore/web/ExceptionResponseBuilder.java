package com.williamcallahan.mathcore.web;

import com.williamcallahan.mathcore.service.document.MathDocumentException;
import com.williamcallahan.mathcore.service.latex.LatexConversionException;
import com.williamcallahan.mathcore.service.latex.MacroDefinitionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Centralized utility for building consistent error responses across controllers.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds a standardized error response with status and message.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds a standardized error response with status, message, and exception details.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @param exception The exception that occurred
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    /**
     * Builds the 422 response for a formula that failed to convert, carrying the failure offset.
     *
     * @param conversionFailure the failure
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildConversionErrorResponse(LatexConversionException conversionFailure) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(ApiErrorResponse.conversionError(
                conversionFailure.getError().message(),
                describeException(conversionFailure),
                conversionFailure.getOffset()));
    }

    /**
     * Builds a standardized success response with a simple message.
     *
     * @param message The success message
     * @return ResponseEntity with success details
     */
    public ResponseEntity<ApiResponse> buildSuccessResponse(String message) {
        return ResponseEntity.ok(ApiSuccessResponse.success(message));
    }

    /**
     * Describes an exception with its conversion location when available.
     *
     * @param exception exception to describe
     * @return formatted exception details or null when no exception is provided
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        if (exception instanceof LatexConversionException conversionFailure) {
            return "kind=" + conversionFailure.getKind() + ", error=" + conversionFailure.getError().describe();
        }
        if (exception instanceof MacroDefinitionException macroFailure) {
            return "location=" + macroFailure.location() + ", macro=" + macroFailure.getMacroName();
        }
        if (exception instanceof MathDocumentException documentFailure) {
            StringBuilder details = new StringBuilder()
                .append("kind=").append(documentFailure.getKind())
                .append(", line=").append(documentFailure.getLine())
                .append(", column=").append(documentFailure.getColumn());
            if (documentFailure.getCause() instanceof LatexConversionException conversionFailure) {
                details.append(", error=").append(conversionFailure.getError().describe());
            }
            return details.toString();
        }
        String message = exception.getMessage();
        return exception.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
