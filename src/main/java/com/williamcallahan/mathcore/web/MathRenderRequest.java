package com.williamcallahan.mathcore.web;

/**
 * Request body for single-formula conversion.
 *
 * @param latex The formula source, without delimiters
 * @param display {@code inline} (default) or {@code block}
 * @param options Optional converter overrides
 */
public record MathRenderRequest(String latex, String display, MathRenderOptions options) {}
