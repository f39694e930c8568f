package com.discovery.generator.codegen;

import java.nio.file.Path;

import com.discovery.generator.decorator.json.ObjectToJsonConfig;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for the service generator.
 */
@Data
@Builder
public class GeneratorConfig {

    public static final String DEFAULT_PACKAGE = "com.discovery.client.services";

    private Path discoveryDoc;
    private Path outputDir;

    @Builder.Default
    private String basePackage = DEFAULT_PACKAGE;

    private boolean force;

    @Builder.Default
    private ObjectToJsonConfig objectToJson = ObjectToJsonConfig.defaults();

    /**
     * Directory of the generated class, relative to the output directory.
     */
    public Path getPackagePath() {
        if (basePackage == null || basePackage.isEmpty()) {
            return Path.of("");
        }
        return Path.of(basePackage.replace('.', '/'));
    }
}
