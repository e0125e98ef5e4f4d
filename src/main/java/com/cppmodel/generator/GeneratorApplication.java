package com.cppmodel.generator;

import com.cppmodel.generator.cli.GenerateCommand;

import picocli.CommandLine;

/**
 * Main entry point for the Cursor AST Generator.
 * Builds entity trees from recorded cursor traversals and renders them back as C++ source.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
