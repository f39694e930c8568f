package com.discovery.generator.codegen;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Result of the service generation process.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    private String serviceName;
    private String serviceVersion;
    private String className;
    private int decoratorsApplied;
    private int membersGenerated;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
