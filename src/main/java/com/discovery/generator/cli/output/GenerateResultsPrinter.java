package com.discovery.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.discovery.generator.cli.model.GenerateOptions;
import com.discovery.generator.cli.model.ValidatedGenerateOptions;
import com.discovery.generator.codegen.GeneratorResult;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution, no prompting.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Discovery Client Generator");
        log.info("=================================================");
        log.info("Discovery Document: {}", v.getDiscoveryDoc().toAbsolutePath());
        log.info("Package: {}", o.getBasePackage());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Force: {}", o.isForce());
        log.info("=================================================");
    }

    public void printSuccess(GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Service: {} {}", result.getServiceName(), result.getServiceVersion());
        log.info("Class: {}", result.getClassName());
        log.info("Decorators Applied: {}", result.getDecoratorsApplied());
        log.info("Members Generated: {}", result.getMembersGenerated());
        log.info("Output Path: {}", result.getOutputPath().toAbsolutePath());
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }
}
