package com.cppmodel.generator.model;

public enum CppTypeKind {
    BUILTIN,
    USER_DEFINED,
    UNEXPOSED
}
