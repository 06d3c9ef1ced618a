package com.williamcallahan.mathcore.config;

import com.williamcallahan.mathcore.domain.mathml.ErrorPolicy;
import com.williamcallahan.mathcore.domain.mathml.PrettyPrint;
import com.williamcallahan.mathcore.domain.mathml.RenderConfig;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Converter defaults bound from {@code app.math.*}.
 */
@Component
@ConfigurationProperties(prefix = "app.math")
public class MathCoreProperties {

    private String prettyPrint = "never";
    private boolean xmlNamespace = false;
    private boolean annotation = false;
    private boolean continueOnError = false;
    private boolean ignoreUnknownCommands = false;
    private Map<String, String> macros = new LinkedHashMap<>();
    private int converterCacheSize = 64;
    private Duration converterCacheTtl = Duration.ofMinutes(30);
    private Document document = new Document();

    /**
     * Builds the immutable engine configuration these properties describe.
     *
     * @return render configuration
     * @throws IllegalArgumentException when {@code pretty-print} is not a known value
     */
    public RenderConfig toRenderConfig() {
        ErrorPolicy policy = new ErrorPolicy(continueOnError, ignoreUnknownCommands);
        return new RenderConfig(PrettyPrint.fromName(prettyPrint), xmlNamespace, annotation, macros, policy);
    }

    public String getPrettyPrint() {
        return prettyPrint;
    }

    public void setPrettyPrint(String prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public boolean isXmlNamespace() {
        return xmlNamespace;
    }

    public void setXmlNamespace(boolean xmlNamespace) {
        this.xmlNamespace = xmlNamespace;
    }

    public boolean isAnnotation() {
        return annotation;
    }

    public void setAnnotation(boolean annotation) {
        this.annotation = annotation;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public void setContinueOnError(boolean continueOnError) {
        this.continueOnError = continueOnError;
    }

    public boolean isIgnoreUnknownCommands() {
        return ignoreUnknownCommands;
    }

    public void setIgnoreUnknownCommands(boolean ignoreUnknownCommands) {
        this.ignoreUnknownCommands = ignoreUnknownCommands;
    }

    public Map<String, String> getMacros() {
        return macros;
    }

    public void setMacros(Map<String, String> macros) {
        this.macros = macros == null ? new LinkedHashMap<>() : new LinkedHashMap<>(macros);
    }

    public int getConverterCacheSize() {
        return converterCacheSize;
    }

    public void setConverterCacheSize(int converterCacheSize) {
        this.converterCacheSize = converterCacheSize;
    }

    public Duration getConverterCacheTtl() {
        return converterCacheTtl;
    }

    public void setConverterCacheTtl(Duration converterCacheTtl) {
        this.converterCacheTtl = converterCacheTtl;
    }

    public Document getDocument() {
        return document;
    }

    public void setDocument(Document document) {
        this.document = document;
    }

    /**
     * Defaults for delimited-math document replacement.
     */
    public static class Document {
        private String delimiters = "latex";
        private boolean continueOnError = false;
        private boolean ignoreEscapedDelimiters = true;

        public String getDelimiters() { return delimiters; }
        public void setDelimiters(String delimiters) { this.delimiters = delimiters; }

        public boolean isContinueOnError() { return continueOnError; }
        public void setContinueOnError(boolean continueOnError) { this.continueOnError = continueOnError; }

        public boolean isIgnoreEscapedDelimiters() { return ignoreEscapedDelimiters; }
        public void setIgnoreEscapedDelimiters(boolean ignoreEscapedDelimiters) {
            this.ignoreEscapedDelimiters = ignoreEscapedDelimiters;
        }
    }
}
