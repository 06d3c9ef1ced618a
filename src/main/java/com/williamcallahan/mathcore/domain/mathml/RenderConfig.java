package com.williamcallahan.mathcore.domain.mathml;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable converter configuration.
 *
 * <p>Macros keep their insertion order: the position of a definition is its index in
 * construction-time error locations ({@code macro{N}:{M}}).</p>
 *
 * @param prettyPrint whitespace policy for the output
 * @param xmlNamespace include the MathML namespace on the root element
 * @param annotation wrap the output in semantics with a TeX annotation of the source
 * @param macros user macros, name to replacement text
 * @param errorPolicy failure handling
 */
public record RenderConfig(
    PrettyPrint prettyPrint,
    boolean xmlNamespace,
    boolean annotation,
    Map<String, String> macros,
    ErrorPolicy errorPolicy
) {

    public RenderConfig {
        Objects.requireNonNull(prettyPrint, "Pretty print setting cannot be null");
        Objects.requireNonNull(errorPolicy, "Error policy cannot be null");
        macros = macros == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(macros));
    }

    /**
     * Returns the default configuration: compact output, no namespace, no annotation, no macros,
     * errors raised.
     *
     * @return default configuration
     */
    public static RenderConfig defaults() {
        return new RenderConfig(PrettyPrint.NEVER, false, false, Map.of(), ErrorPolicy.RAISE);
    }

    public RenderConfig withPrettyPrint(PrettyPrint value) {
        return new RenderConfig(value, xmlNamespace, annotation, macros, errorPolicy);
    }

    public RenderConfig withXmlNamespace(boolean value) {
        return new RenderConfig(prettyPrint, value, annotation, macros, errorPolicy);
    }

    public RenderConfig withAnnotation(boolean value) {
        return new RenderConfig(prettyPrint, xmlNamespace, value, macros, errorPolicy);
    }

    public RenderConfig withMacros(Map<String, String> value) {
        return new RenderConfig(prettyPrint, xmlNamespace, annotation, value, errorPolicy);
    }

    public RenderConfig withErrorPolicy(ErrorPolicy value) {
        return new RenderConfig(prettyPrint, xmlNamespace, annotation, macros, value);
    }
}
