package com.cppmodel.generator.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import com.cppmodel.generator.cli.exception.OptionsValidationException;
import com.cppmodel.generator.cli.model.GenerateOptions;
import com.cppmodel.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	static final Path DEFAULT_OUTPUT_DIR = Path.of("synopsis");
	static final int MAX_INDENT_WIDTH = 16;

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		Path inputDir = null;
		if (o.getInputDir() == null) {
			errors.add("Input directory is required (--input-dir / -i).");
		} else if (!existsDirectory(o.getInputDir())) {
			errors.add("Input directory does not exist or is not a directory: " + o.getInputDir());
		} else {
			inputDir = o.getInputDir().toAbsolutePath().normalize();
		}

		if (o.getFormat() == null) {
			errors.add("Output format is required (TEXT or HTML).");
		}
		if (o.getSynopsisMode() == null) {
			errors.add("Synopsis mode is required (DEFINITION or DECLARATION).");
		}
		if (o.getIndentWidth() < 0 || o.getIndentWidth() > MAX_INDENT_WIDTH) {
			errors.add("Indent width must be in range 0-" + MAX_INDENT_WIDTH + ". Got: " + o.getIndentWidth());
		}

		Path outputDir = (o.getOutputDir() == null ? DEFAULT_OUTPUT_DIR : o.getOutputDir()).toAbsolutePath()
				.normalize();
		if (inputDir != null && inputDir.equals(outputDir)) {
			errors.add("Output directory must differ from the input directory: " + outputDir);
		} else if (Files.isRegularFile(outputDir)) {
			errors.add("Output path is a file: " + outputDir);
		} else if (isNonEmptyDirectory(outputDir, errors) && !o.isForce()) {
			errors.add("Output directory is not empty: " + outputDir + ". Use --force to overwrite.");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
		return new ValidatedGenerateOptions(inputDir, outputDir);
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isNonEmptyDirectory(Path p, List<String> errors) {
		if (!Files.isDirectory(p)) {
			return false;
		}
		try (Stream<Path> entries = Files.list(p)) {
			return entries.findAny().isPresent();
		} catch (IOException e) {
			errors.add("Output directory cannot be read: " + p + " (" + e.getMessage() + ")");
			return false;
		}
	}
}
