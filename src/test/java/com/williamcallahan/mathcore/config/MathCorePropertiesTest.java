package com.williamcallahan.mathcore.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.mathcore.domain.mathml.PrettyPrint;
import com.williamcallahan.mathcore.domain.mathml.RenderConfig;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Verifies property values map onto the engine configuration.
 */
class MathCorePropertiesTest {

    @Test
    void defaultsMatchEngineDefaults() {
        assertEquals(RenderConfig.defaults(), new MathCoreProperties().toRenderConfig());
    }

    @Test
    void mapsEverySetting() {
        MathCoreProperties properties = new MathCoreProperties();
        properties.setPrettyPrint("auto");
        properties.setXmlNamespace(true);
        properties.setAnnotation(true);
        properties.setContinueOnError(true);
        properties.setIgnoreUnknownCommands(true);
        properties.setMacros(Map.of("R", "\\mathbb{R}"));

        RenderConfig config = properties.toRenderConfig();

        assertEquals(PrettyPrint.AUTO, config.prettyPrint());
        assertTrue(config.xmlNamespace());
        assertTrue(config.annotation());
        assertTrue(config.errorPolicy().continueInline());
        assertTrue(config.errorPolicy().ignoreUnknownCommands());
        assertEquals("\\mathbb{R}", config.macros().get("R"));
    }

    @Test
    void acceptsLegacyBooleanPrettyPrint() {
        MathCoreProperties properties = new MathCoreProperties();
        properties.setPrettyPrint("true");

        assertEquals(PrettyPrint.ALWAYS, properties.toRenderConfig().prettyPrint());
    }

    @Test
    void rejectsUnknownPrettyPrint() {
        MathCoreProperties properties = new MathCoreProperties();
        properties.setPrettyPrint("sometimes");

        assertThrows(IllegalArgumentException.class, properties::toRenderConfig);
    }
}
