package com.discovery.generator.codegen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.discovery.generator.codedom.ClassDeclaration;
import com.discovery.generator.codegen.util.FileWriteUtil;
import com.discovery.generator.decorator.ServiceDecorator;
import com.discovery.generator.decorator.json.ObjectToJsonDecorator;
import com.discovery.generator.emit.CompilationUnitRenderer;
import com.discovery.generator.model.ServiceDescription;
import com.discovery.generator.parser.DiscoveryDocumentParser;
import com.discovery.generator.parser.DiscoveryParseException;

/**
 * Generates the Java source of a service class from a discovery document.
 */
public class ServiceGenerator {
    private static final Logger log = LoggerFactory.getLogger(ServiceGenerator.class);

    private final GeneratorConfig config;
    private final DiscoveryDocumentParser parser;
    private final ServiceClassGenerator classGenerator;
    private final CompilationUnitRenderer renderer;

    public ServiceGenerator(GeneratorConfig config) {
        this(config, defaultDecorators(config));
    }

    public ServiceGenerator(GeneratorConfig config, List<ServiceDecorator> decorators) {
        this.config = config;
        this.parser = new DiscoveryDocumentParser();
        this.classGenerator = new ServiceClassGenerator(config.getBasePackage(), decorators);
        this.renderer = new CompilationUnitRenderer();
    }

    private static List<ServiceDecorator> defaultDecorators(GeneratorConfig config) {
        return List.of(new ObjectToJsonDecorator(config.getObjectToJson()));
    }

    /**
     * Parse, build, render and write the service class.
     */
    public GeneratorResult generate() {
        try {
            log.info("Starting service generation...");

            // Step 1: Parse discovery document
            log.info("Step 1: Parsing discovery document...");
            ServiceDescription service = parser.parse(config.getDiscoveryDoc());

            // Step 2: Build class AST
            log.info("Step 2: Building service class...");
            ClassDeclaration serviceClass = classGenerator.generate(service);

            // Step 3: Render and write
            log.info("Step 3: Writing source...");
            Path target = config.getOutputDir()
                    .resolve(config.getPackagePath())
                    .resolve(serviceClass.getName() + ".java");
            if (Files.exists(target) && !config.isForce()) {
                return GeneratorResult.failure("Output file already exists: " + target + ". Use --force to overwrite.");
            }
            String source = renderer.render(serviceClass, service);
            FileWriteUtil.safeWriteString(target, source);
            log.info("Wrote {}", target.toAbsolutePath());

            return GeneratorResult.builder()
                    .success(true)
                    .outputPath(target)
                    .serviceName(service.getName())
                    .serviceVersion(service.getVersion())
                    .className(serviceClass.getQualifiedName())
                    .decoratorsApplied(classGenerator.getDecorators().size())
                    .membersGenerated(serviceClass.getMembers().size())
                    .build();

        } catch (DiscoveryParseException e) {
            log.error("Invalid discovery document", e);
            return GeneratorResult.failure(e.getMessage());
        } catch (IOException e) {
            log.error("Generation failed", e);
            return GeneratorResult.failure("Failed to write service class: " + e.getMessage());
        }
    }
}
