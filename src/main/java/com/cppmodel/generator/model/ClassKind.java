package com.cppmodel.generator.model;

/**
 * The class-key a class was declared with.
 */
public enum ClassKind {
    CLASS("class", AccessSpecifierKind.PRIVATE),
    STRUCT("struct", AccessSpecifierKind.PUBLIC),
    UNION("union", AccessSpecifierKind.PUBLIC);

    private final String keyword;
    private final AccessSpecifierKind defaultAccess;

    ClassKind(String keyword, AccessSpecifierKind defaultAccess) {
        this.keyword = keyword;
        this.defaultAccess = defaultAccess;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Access of members and bases before any explicit access specifier.
     */
    public AccessSpecifierKind getDefaultAccess() {
        return defaultAccess;
    }
}
