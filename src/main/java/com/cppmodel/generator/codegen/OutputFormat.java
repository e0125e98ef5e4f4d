package com.cppmodel.generator.codegen;

/**
 * Backend used for the generated files.
 */
public enum OutputFormat {
    TEXT(".hpp"),
    HTML(".html");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
