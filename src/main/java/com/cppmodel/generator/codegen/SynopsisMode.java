package com.cppmodel.generator.codegen;

/**
 * How much of classes, enums and functions the generated synopsis shows.
 */
public enum SynopsisMode {
    DEFINITION,
    DECLARATION
}
