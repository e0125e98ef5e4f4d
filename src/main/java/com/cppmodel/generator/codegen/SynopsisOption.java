package com.cppmodel.generator.codegen;

/**
 * A backend's choice of how much of an entity to render.
 */
public enum SynopsisOption {
    /** Nothing is rendered for the entity, children included. */
    EXCLUDE,
    /** Only the declaration; bodies and children are suppressed. */
    DECLARATION,
    /** The full definition. */
    DEFINITION
}
