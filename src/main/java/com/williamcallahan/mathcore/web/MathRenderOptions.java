package com.williamcallahan.mathcore.web;

import com.williamcallahan.mathcore.domain.mathml.ErrorPolicy;
import com.williamcallahan.mathcore.domain.mathml.PrettyPrint;
import com.williamcallahan.mathcore.domain.mathml.RenderConfig;
import com.williamcallahan.mathcore.service.mathml.CounterScope;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Per-request overrides of the configured converter defaults. Absent fields keep the default.
 *
 * @param prettyPrint {@code never}, {@code always}, {@code auto}, or a legacy boolean spelling
 * @param xmlNamespace include the MathML namespace
 * @param annotation include a TeX annotation of the source
 * @param continueOnError render fallback markup instead of failing
 * @param ignoreUnknownCommands render unknown commands as placeholders
 * @param macros extra macros, added after (and overriding) the configured ones
 * @param counter {@code local} (default) or {@code global} equation numbering
 */
public record MathRenderOptions(
    String prettyPrint,
    Boolean xmlNamespace,
    Boolean annotation,
    Boolean continueOnError,
    Boolean ignoreUnknownCommands,
    Map<String, String> macros,
    String counter
) {

    /**
     * Applies these overrides to a base configuration.
     *
     * @param base configured defaults
     * @return effective configuration
     * @throws IllegalArgumentException when {@code prettyPrint} is not a known value
     */
    public RenderConfig applyTo(RenderConfig base) {
        RenderConfig effective = base;
        if (prettyPrint != null) {
            effective = effective.withPrettyPrint(PrettyPrint.fromName(prettyPrint));
        }
        if (xmlNamespace != null) {
            effective = effective.withXmlNamespace(xmlNamespace);
        }
        if (annotation != null) {
            effective = effective.withAnnotation(annotation);
        }
        if (continueOnError != null || ignoreUnknownCommands != null) {
            ErrorPolicy current = effective.errorPolicy();
            effective = effective.withErrorPolicy(new ErrorPolicy(
                continueOnError != null ? continueOnError : current.continueInline(),
                ignoreUnknownCommands != null ? ignoreUnknownCommands : current.ignoreUnknownCommands()));
        }
        if (macros != null && !macros.isEmpty()) {
            Map<String, String> merged = new LinkedHashMap<>(effective.macros());
            merged.putAll(macros);
            effective = effective.withMacros(merged);
        }
        return effective;
    }

    /**
     * Resolves the numbering scope.
     *
     * @return {@link CounterScope#LOCAL} unless {@code counter} is {@code global}
     * @throws IllegalArgumentException for an unknown scope name
     */
    public CounterScope counterScope() {
        return parseScope(counter);
    }

    static CounterScope parseScope(String value) {
        if (value == null || value.isBlank()) {
            return CounterScope.LOCAL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "local" -> CounterScope.LOCAL;
            case "global" -> CounterScope.GLOBAL;
            default -> throw new IllegalArgumentException(
                "Invalid counter value: '" + value + "'. Must be 'local' or 'global'.");
        };
    }
}
