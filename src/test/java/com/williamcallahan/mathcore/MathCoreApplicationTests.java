package com.williamcallahan.mathcore;

import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.mathcore.domain.mathml.MathDisplay;
import com.williamcallahan.mathcore.service.MathConversionService;
import com.williamcallahan.mathcore.service.mathml.CounterScope;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "app.math.macros.rr=\\\\mathbb{R}",
        "app.math.converter-cache-size=4"
})
class MathCoreApplicationTests {

    @Autowired
    MathConversionService conversionService;

    @Test
    void contextLoads() {
    }

    @Test
    void configuredMacrosReachTheDefaultConverter() {
        String mathml = conversionService.render("x \\in \\rr", MathDisplay.INLINE,
            conversionService.defaultConfig(), CounterScope.LOCAL);

        assertTrue(mathml.contains("<mi>ℝ</mi>"), mathml);
    }
}
