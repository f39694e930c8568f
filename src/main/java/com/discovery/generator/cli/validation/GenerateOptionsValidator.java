package com.discovery.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.discovery.generator.cli.exception.OptionsValidationException;
import com.discovery.generator.cli.model.GenerateOptions;
import com.discovery.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	private static final Pattern PACKAGE_NAME = Pattern
			.compile("[A-Za-z_$][A-Za-z0-9_$]*(\\.[A-Za-z_$][A-Za-z0-9_$]*)*");

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getDiscoveryDoc() == null) {
			errors.add("Discovery document is required (--discovery-doc / -d).");
		} else if (!Files.isRegularFile(o.getDiscoveryDoc())) {
			errors.add("Discovery document does not exist or is not a file: " + o.getDiscoveryDoc());
		}

		if (o.getBasePackage() != null && !o.getBasePackage().isEmpty()
				&& !PACKAGE_NAME.matcher(o.getBasePackage()).matches()) {
			errors.add("Package is not a valid Java package name: " + o.getBasePackage());
		}

		// Normalize output dir
		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();

		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists but is not a directory: " + normalizedOutputDir);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(o.getDiscoveryDoc(), normalizedOutputDir);
	}
}
