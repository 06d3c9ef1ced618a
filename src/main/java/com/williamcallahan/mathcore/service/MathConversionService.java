package com.williamcallahan.mathcore.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.mathcore.config.MathCoreProperties;
import com.williamcallahan.mathcore.domain.mathml.MathDisplay;
import com.williamcallahan.mathcore.domain.mathml.RenderConfig;
import com.williamcallahan.mathcore.service.document.DocumentReplacement;
import com.williamcallahan.mathcore.service.document.MathDocumentReplacer;
import com.williamcallahan.mathcore.service.latex.LatexToMathMLConverter;
import com.williamcallahan.mathcore.service.mathml.CounterScope;
import com.williamcallahan.mathcore.service.mathml.EquationCounter;
import com.williamcallahan.mathcore.service.mathml.symbol.SymbolDescriptor;
import com.williamcallahan.mathcore.service.mathml.symbol.SymbolTable;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for conversions requested through the application.
 *
 * <p>Requests using the default configuration share the startup converter. Requests with
 * overrides get a converter from a Caffeine cache keyed by the effective {@link RenderConfig},
 * so each distinct macro set is compiled once. Global numbering uses a single counter shared by
 * all converters; conversions against it are serialized.</p>
 */
@Service
public class MathConversionService {
    private static final Logger log = LoggerFactory.getLogger(MathConversionService.class);

    private final LatexToMathMLConverter defaultConverter;
    private final Cache<RenderConfig, LatexToMathMLConverter> converterCache;
    private final EquationCounter globalCounter = new EquationCounter(CounterScope.GLOBAL);

    /**
     * Creates the service.
     *
     * @param defaultConverter converter built from the configured defaults
     * @param properties converter cache settings
     */
    public MathConversionService(LatexToMathMLConverter defaultConverter, MathCoreProperties properties) {
        this.defaultConverter = Objects.requireNonNull(defaultConverter, "defaultConverter");
        this.converterCache = Caffeine.newBuilder()
            .maximumSize(Math.max(1, properties.getConverterCacheSize()))
            .expireAfterAccess(properties.getConverterCacheTtl())
            .recordStats()
            .build();
        log.info("MathConversionService initialized (converter cache size={}, ttl={})",
            properties.getConverterCacheSize(), properties.getConverterCacheTtl());
    }

    public RenderConfig defaultConfig() {
        return defaultConverter.config();
    }

    /**
     * Converts one formula.
     *
     * @param latex math source
     * @param display display mode
     * @param config effective configuration
     * @param scope numbering scope; {@link CounterScope#GLOBAL} continues across calls
     * @return MathML markup, or fallback markup under the continue-inline policy
     * @throws com.williamcallahan.mathcore.service.latex.LatexConversionException when conversion fails
     * @throws com.williamcallahan.mathcore.service.latex.MacroDefinitionException when an override
     *     macro is malformed
     */
    public String render(String latex, MathDisplay display, RenderConfig config, CounterScope scope) {
        LatexToMathMLConverter converter = converterFor(config);
        if (scope == CounterScope.GLOBAL) {
            synchronized (globalCounter) {
                return converter.convert(latex, display, globalCounter);
            }
        }
        return converter.convert(latex, display);
    }

    /**
     * Converts every delimited formula of a document. With local numbering, equation numbers
     * run from 1 across the whole document.
     *
     * @param content document text
     * @param replacer delimiter handling
     * @param config effective configuration
     * @param scope numbering scope
     * @return rewritten document
     * @throws com.williamcallahan.mathcore.service.document.MathDocumentException on malformed
     *     delimiters or an aborting conversion failure
     */
    public DocumentReplacement renderDocument(String content, MathDocumentReplacer replacer,
                                              RenderConfig config, CounterScope scope) {
        LatexToMathMLConverter converter = converterFor(config);
        if (scope == CounterScope.GLOBAL) {
            synchronized (globalCounter) {
                return replacer.replace(content, (latex, display) -> converter.convert(latex, display, globalCounter));
            }
        }
        EquationCounter documentCounter = EquationCounter.local();
        return replacer.replace(content, (latex, display) -> converter.convert(latex, display, documentCounter));
    }

    /**
     * Restarts global numbering at 1.
     *
     * @return the last number handed out before the reset
     */
    public int resetGlobalCounter() {
        synchronized (globalCounter) {
            int previous = globalCounter.current();
            globalCounter.reset();
            log.info("Global equation counter reset (was {})", previous);
            return previous;
        }
    }

    public Optional<SymbolDescriptor> lookupSymbol(int codepoint) {
        return SymbolTable.find(codepoint);
    }

    LatexToMathMLConverter converterFor(RenderConfig config) {
        if (config == null || config.equals(defaultConverter.config())) {
            return defaultConverter;
        }
        return converterCache.get(config, key -> {
            log.debug("Building converter for overridden configuration ({} macros)", key.macros().size());
            return new LatexToMathMLConverter(key);
        });
    }
}
