package com.williamcallahan.mathcore.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Represents a standardized JSON error payload returned by API endpoints.
 *
 * @param status fixed status indicator (typically "error")
 * @param message user-facing error message
 * @param details optional diagnostic details suitable for clients
 * @param offset UTF-8 byte offset of a conversion failure in the submitted source, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(String status, String message, String details, Integer offset) implements ApiResponse {

    /**
     * Creates an error response with no diagnostic details.
     *
     * @param message user-facing error message
     * @return standardized error payload
     */
    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse("error", message, null, null);
    }

    /**
     * Creates an error response including diagnostic details.
     *
     * @param message user-facing error message
     * @param details diagnostic details suitable for clients
     * @return standardized error payload
     */
    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse("error", message, details, null);
    }

    /**
     * Creates an error response for a located conversion failure.
     *
     * @param message error text without the offset
     * @param details diagnostic details suitable for clients
     * @param offset byte offset of the failure
     * @return standardized error payload
     */
    public static ApiErrorResponse conversionError(String message, String details, int offset) {
        return new ApiErrorResponse("error", message, details, offset);
    }
}
