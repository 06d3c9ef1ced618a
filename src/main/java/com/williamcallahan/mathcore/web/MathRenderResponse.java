package com.williamcallahan.mathcore.web;

/**
 * Converted formula.
 *
 * @param status fixed "success"
 * @param mathml MathML markup, or fallback markup when the request continued on error
 * @param display display mode used, in lower case
 */
public record MathRenderResponse(String status, String mathml, String display) implements ApiResponse {

    public static MathRenderResponse success(String mathml, String display) {
        return new MathRenderResponse("success", mathml, display);
    }
}
