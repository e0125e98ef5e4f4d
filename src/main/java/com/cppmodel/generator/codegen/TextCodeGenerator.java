package com.cppmodel.generator.codegen;

import com.cppmodel.generator.model.Entity;

/**
 * Plain C++ source backend.
 */
public class TextCodeGenerator extends IndentingCodeGenerator {
    public static final int DEFAULT_INDENT_WIDTH = 4;

    public TextCodeGenerator() {
        this(DEFAULT_INDENT_WIDTH, SynopsisPolicy.definitions());
    }

    public TextCodeGenerator(int indentWidth, SynopsisPolicy policy) {
        super(indentWidth, policy);
    }

    /**
     * Renders a single entity with the default settings.
     */
    public static String render(Entity entity) {
        TextCodeGenerator generator = new TextCodeGenerator();
        CodeGeneration.generate(generator, entity);
        return generator.getResult();
    }

    @Override
    protected String escape(String text) {
        return text;
    }
}
