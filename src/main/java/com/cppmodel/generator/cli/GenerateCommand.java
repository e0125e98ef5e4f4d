package com.cppmodel.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppmodel.generator.cli.exception.OptionsValidationException;
import com.cppmodel.generator.cli.model.GenerateOptions;
import com.cppmodel.generator.cli.model.ValidatedGenerateOptions;
import com.cppmodel.generator.cli.output.GenerateResultsPrinter;
import com.cppmodel.generator.cli.validation.GenerateOptionsValidator;
import com.cppmodel.generator.codegen.GeneratorConfig;
import com.cppmodel.generator.codegen.GeneratorResult;
import com.cppmodel.generator.codegen.SourceGenerator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command rendering recorded translation units as C++ synopses.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "cursor-ast-generator 1.0.0",
        description = "Builds the entity model of recorded translation units and renders it as C++ source or HTML."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedGenerateOptions validated;
            try {
                validated = validator.validate(options);
            } catch (OptionsValidationException e) {
                printer.printValidationErrors(e.getErrors());
                return 1;
            }

            GeneratorConfig config = GeneratorConfig.builder()
                    .inputDir(validated.getNormalizedInputDir())
                    .outputDir(validated.getNormalizedOutputDir())
                    .format(options.getFormat())
                    .synopsisMode(options.getSynopsisMode())
                    .excludePrivate(options.isExcludePrivate())
                    .indentWidth(options.getIndentWidth())
                    .force(options.isForce())
                    .build();

            printer.printBanner(options, validated);

            SourceGenerator generator = new SourceGenerator(config);
            GeneratorResult result = generator.generate();

            if (!result.isSuccess()) {
                log.error("Generation failed: {}", result.getErrorMessage());
                return 1;
            }

            printer.printSuccess(validated, result);
            return 0;

        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }
}
