package com.cppmodel.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppmodel.generator.codegen.util.FileWriteUtil;
import com.cppmodel.generator.cursor.recorded.RecordedTranslationUnit;
import com.cppmodel.generator.cursor.recorded.TranslationUnitLoader;
import com.cppmodel.generator.diagnostics.ToolDiagnostics;
import com.cppmodel.generator.model.EntityIndex;
import com.cppmodel.generator.model.FileEntity;
import com.cppmodel.generator.parser.ParseResult;
import com.cppmodel.generator.parser.TranslationUnitParser;

/**
 * Generates C++ synopses from a directory of recorded translation units.
 *
 * All units are built into one shared {@link EntityIndex}, so references
 * between units resolve; the index is sealed before rendering starts.
 */
public class SourceGenerator {
    private static final Logger log = LoggerFactory.getLogger(SourceGenerator.class);

    private final GeneratorConfig config;
    private final HtmlPageRenderer pageRenderer;

    public SourceGenerator(GeneratorConfig config) {
        this.config = config;
        this.pageRenderer = new HtmlPageRenderer();
    }

    public GeneratorResult generate() {
        try {
            log.info("Starting source generation...");

            // Step 1: Read cursor dumps
            log.info("Step 1: Reading cursor dumps from {}...", config.getInputDir());
            ToolDiagnostics diagnostics = new ToolDiagnostics();
            TranslationUnitLoader loader = new TranslationUnitLoader(config.getInputDir());
            List<RecordedTranslationUnit> units = loader.loadAll(diagnostics);

            for (String warning : diagnostics.getWarnings()) {
                log.warn(warning);
            }
            if (diagnostics.hasErrors()) {
                return GeneratorResult.failure(String.join("\n", diagnostics.getErrors()));
            }
            if (units.isEmpty()) {
                return GeneratorResult.failure("No cursor dumps found in " + config.getInputDir());
            }

            // Step 2: Build entities
            log.info("Step 2: Building entities...");
            EntityIndex index = new EntityIndex();
            TranslationUnitParser parser = new TranslationUnitParser(index);
            List<FileEntity> files = new ArrayList<>();
            int entitiesBuilt = 0;
            for (RecordedTranslationUnit unit : units) {
                ParseResult result = parser.parse(unit.getName(), unit.getRoot());
                files.add(result.getFile());
                entitiesBuilt += result.getFile().treeSize();
            }
            index.seal();

            // Step 3: Prepare output directory
            log.info("Step 3: Preparing output directory...");
            Path outputDir = config.getOutputDir();
            FileWriteUtil.prepareOutputDirectory(outputDir, config.isForce());

            // Step 4: Render
            log.info("Step 4: Rendering {} file(s) as {}...", files.size(), config.getFormat());
            for (FileEntity file : files) {
                Path target = outputDir.resolve(config.getOutputFileName(file.getName()));
                FileWriteUtil.safeWriteString(target, render(file, index));
                log.debug("Wrote {}", target);
            }

            log.info("Source generation complete!");

            return GeneratorResult.builder()
                    .success(true)
                    .outputPath(outputDir)
                    .unitsParsed(units.size())
                    .entitiesBuilt(entitiesBuilt)
                    .definitionsIndexed(index.definitionCount())
                    .filesWritten(files.size())
                    .warnings(List.copyOf(diagnostics.getWarnings()))
                    .build();

        } catch (Exception e) {
            log.error("Generation failed", e);
            return GeneratorResult.failure(e.getMessage());
        }
    }

    /**
     * Renders one file with the configured backend. References are resolved
     * against the sealed index.
     */
    String render(FileEntity file, EntityIndex index) throws IOException {
        SynopsisPolicy policy = config.getSynopsisPolicy();
        if (config.getFormat() == OutputFormat.HTML) {
            HtmlCodeGenerator generator = new HtmlCodeGenerator(config.getIndentWidth(), policy, index);
            CodeGeneration.generate(generator, file);
            return pageRenderer.render(file.getName(), generator.getResult());
        }
        TextCodeGenerator generator = new TextCodeGenerator(config.getIndentWidth(), policy);
        CodeGeneration.generate(generator, file);
        return generator.getResult();
    }
}
