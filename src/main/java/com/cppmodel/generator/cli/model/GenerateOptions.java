package com.cppmodel.generator.cli.model;

import java.nio.file.Path;

import com.cppmodel.generator.codegen.OutputFormat;
import com.cppmodel.generator.codegen.SynopsisMode;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--input-dir", "-i" }, required = true, description = "Directory containing *.cursors dumps")
	private Path inputDir;

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to ./synopsis)")
	private Path outputDir;

	@Option(names = { "--format" }, defaultValue = "TEXT", description = "Output format: TEXT or HTML")
	private OutputFormat format;

	@Option(names = {
			"--synopsis" }, defaultValue = "DEFINITION", description = "DEFINITION renders bodies, DECLARATION only declarations of classes, enums and functions")
	private SynopsisMode synopsisMode;

	@Option(names = { "--exclude-private" }, description = "Leave private members out of the synopsis")
	private boolean excludePrivate;

	@Option(names = { "--indent-width" }, defaultValue = "4", description = "Spaces per indentation level")
	private int indentWidth;

	@Option(names = { "--force", "-f" }, description = "Overwrite a non-empty output directory")
	private boolean force;
}
