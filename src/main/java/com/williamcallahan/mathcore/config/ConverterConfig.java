package com.williamcallahan.mathcore.config;

import com.williamcallahan.mathcore.domain.mathml.RenderConfig;
import com.williamcallahan.mathcore.service.latex.LatexToMathMLConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the default converter from {@link MathCoreProperties}.
 *
 * <p>Configured macros are compiled here, so a malformed definition fails application startup
 * with its {@code macro{N}:{M}} location.</p>
 */
@Configuration
public class ConverterConfig {
    private static final Logger log = LoggerFactory.getLogger(ConverterConfig.class);

    /**
     * Creates the shared converter for requests without overrides.
     *
     * @param properties bound converter defaults
     * @return default converter
     */
    @Bean
    public LatexToMathMLConverter defaultConverter(MathCoreProperties properties) {
        RenderConfig config = properties.toRenderConfig();
        LatexToMathMLConverter converter = new LatexToMathMLConverter(config);
        log.info("Default MathML converter ready (prettyPrint={}, macros={}, continueOnError={})",
            config.prettyPrint(), config.macros().size(), config.errorPolicy().continueInline());
        return converter;
    }
}
