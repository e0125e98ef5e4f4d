package com.cppmodel.generator.model;

public enum FunctionKind {
    FREE,
    MEMBER,
    CONSTRUCTOR,
    DESTRUCTOR
}
