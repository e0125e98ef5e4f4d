package com.cppmodel.generator.model;

public enum TemplateParameterKind {
    TYPE,
    NON_TYPE,
    TEMPLATE
}
