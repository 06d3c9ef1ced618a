package com.williamcallahan.mathcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot entry point for the LaTeX to MathML service.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MathCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(MathCoreApplication.class, args);
    }
}
