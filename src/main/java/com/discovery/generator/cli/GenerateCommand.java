package com.discovery.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.discovery.generator.cli.exception.OptionsValidationException;
import com.discovery.generator.cli.model.GenerateOptions;
import com.discovery.generator.cli.model.ValidatedGenerateOptions;
import com.discovery.generator.cli.output.GenerateResultsPrinter;
import com.discovery.generator.cli.validation.GenerateOptionsValidator;
import com.discovery.generator.codegen.GeneratorConfig;
import com.discovery.generator.codegen.GeneratorResult;
import com.discovery.generator.codegen.ServiceGenerator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for generating a client service class from a discovery document.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "discovery-client-generator 1.0.0",
        description = "Generates the Java service class of a client library from a discovery document."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        printer.printBanner(options, validated);

        GeneratorConfig config = GeneratorConfig.builder()
                .discoveryDoc(validated.getDiscoveryDoc())
                .outputDir(validated.getNormalizedOutputDir())
                .basePackage(options.getBasePackage())
                .force(options.isForce())
                .build();

        GeneratorResult result = new ServiceGenerator(config).generate();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }

        printer.printSuccess(result);
        return 0;
    }
}
