package com.cppmodel.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppmodel.generator.cli.model.GenerateOptions;
import com.cppmodel.generator.cli.model.ValidatedGenerateOptions;
import com.cppmodel.generator.codegen.GeneratorResult;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {
    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Cursor AST Generator");
        log.info("=================================================");
        log.info("Input Directory: {}", v.getNormalizedInputDir());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Format: {}", o.getFormat());
        log.info("Synopsis: {}", o.getSynopsisMode());
        log.info("Exclude Private: {}", o.isExcludePrivate());
        log.info("Indent Width: {}", o.getIndentWidth());
        log.info("=================================================");
    }

    public void printSuccess(ValidatedGenerateOptions v, GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", v.getNormalizedOutputDir());
        log.info("Translation Units Parsed: {}", result.getUnitsParsed());
        log.info("Entities Built: {}", result.getEntitiesBuilt());
        log.info("Definitions Indexed: {}", result.getDefinitionsIndexed());
        log.info("Files Written: {}", result.getFilesWritten());

        if (!result.getWarnings().isEmpty()) {
            log.info("");
            log.info("Warnings:");
            for (String warning : result.getWarnings()) {
                log.info("  {}", warning);
            }
        }
        log.info("=================================================");
    }

    public void printValidationErrors(Iterable<String> errors) {
        log.error("Invalid options:");
        for (String error : errors) {
            log.error("  {}", error);
        }
    }
}
