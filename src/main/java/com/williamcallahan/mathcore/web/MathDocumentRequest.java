package com.williamcallahan.mathcore.web;

/**
 * Request body for converting every delimited formula of a document.
 *
 * @param content The document text or HTML
 * @param delimiters {@code latex} for {@code \( \)}/{@code \[ \]} or {@code dollars} for {@code $}/{@code $$}
 * @param continueOnError Leave failed formulas verbatim instead of failing the request
 * @param ignoreEscapedDelimiters Skip delimiters preceded by a backslash
 * @param options Optional converter overrides
 */
public record MathDocumentRequest(
    String content,
    String delimiters,
    Boolean continueOnError,
    Boolean ignoreEscapedDelimiters,
    MathRenderOptions options
) {}
