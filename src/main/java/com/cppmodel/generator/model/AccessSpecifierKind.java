package com.cppmodel.generator.model;

/**
 * C++ member and base access.
 */
public enum AccessSpecifierKind {
    PUBLIC("public"),
    PROTECTED("protected"),
    PRIVATE("private");

    private final String spelling;

    AccessSpecifierKind(String spelling) {
        this.spelling = spelling;
    }

    public String getSpelling() {
        return spelling;
    }
}
