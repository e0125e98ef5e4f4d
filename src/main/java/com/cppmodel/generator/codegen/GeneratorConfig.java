package com.cppmodel.generator.codegen;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for the source generator.
 */
@Data
@Builder
public class GeneratorConfig {
    private Path inputDir;
    private Path outputDir;

    @Builder.Default
    private OutputFormat format = OutputFormat.TEXT;

    @Builder.Default
    private SynopsisMode synopsisMode = SynopsisMode.DEFINITION;

    private boolean excludePrivate;

    @Builder.Default
    private int indentWidth = TextCodeGenerator.DEFAULT_INDENT_WIDTH;

    private boolean force;

    /**
     * The synopsis policy the backends apply.
     */
    public SynopsisPolicy getSynopsisPolicy() {
        return SynopsisPolicy.builder()
                .mode(synopsisMode)
                .excludePrivate(excludePrivate)
                .build();
    }

    /**
     * Name of the generated file for a translation unit.
     */
    public String getOutputFileName(String unitName) {
        return unitName + format.getExtension();
    }
}
