package com.discovery.generator;

import com.discovery.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Discovery Client Generator.
 * This CLI tool reads a discovery document and generates the Java service class
 * of a client library for it.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand()).execute(args);
        System.exit(exitCode);
    }
}
