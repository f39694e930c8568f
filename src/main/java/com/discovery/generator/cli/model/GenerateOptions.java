package com.discovery.generator.cli.model;

import java.nio.file.Path;

import com.discovery.generator.codegen.GeneratorConfig;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--discovery-doc", "-d" }, required = true, description = "Path to the discovery document (JSON)")
	private Path discoveryDoc;

	@Option(names = { "--output-dir", "-o" }, description = "Source root to write into (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--package", "-p" }, defaultValue = GeneratorConfig.DEFAULT_PACKAGE, description = "Package of the generated service class")
	private String basePackage;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing service class")
	private boolean force;
}
