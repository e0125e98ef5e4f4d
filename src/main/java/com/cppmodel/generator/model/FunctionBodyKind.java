package com.cppmodel.generator.model;

/**
 * What follows a function's declarator.
 */
public enum FunctionBodyKind {
    /** {@code ;} */
    DECLARATION,
    /** a body */
    DEFINITION,
    /** {@code = 0;} */
    PURE_VIRTUAL,
    /** {@code = default;} */
    DEFAULTED,
    /** {@code = delete;} */
    DELETED
}
