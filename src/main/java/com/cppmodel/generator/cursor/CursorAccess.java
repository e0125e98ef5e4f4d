package com.cppmodel.generator.cursor;

/**
 * Access value reported by the traversal provider for access-specifier
 * and base-specifier cursors.
 */
public enum CursorAccess {
    INVALID,
    PUBLIC,
    PROTECTED,
    PRIVATE
}
