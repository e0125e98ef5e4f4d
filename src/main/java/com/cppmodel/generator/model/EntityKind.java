package com.cppmodel.generator.model;

/**
 * Closed set of entity kinds. Every consumer dispatches through
 * {@link EntityVisitor}, so a new kind has to be handled everywhere.
 */
public enum EntityKind {
    FILE,
    NAMESPACE,
    CLASS,
    BASE_CLASS,
    ACCESS_SPECIFIER,
    FUNCTION,
    FUNCTION_PARAMETER,
    VARIABLE,
    ENUM,
    ENUM_VALUE,
    TYPE_ALIAS
}
