package com.cppmodel.generator.cursor;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Kinds of cursors yielded by the traversal provider.
 * Only the kinds the entity builder distinguishes are named individually;
 * everything else the provider reports maps onto one of the category kinds.
 */
public enum CursorKind {
    TRANSLATION_UNIT(Category.TRANSLATION_UNIT),

    NAMESPACE(Category.DECLARATION),
    CLASS_DECL(Category.DECLARATION),
    STRUCT_DECL(Category.DECLARATION),
    UNION_DECL(Category.DECLARATION),
    CLASS_TEMPLATE(Category.DECLARATION),
    CLASS_TEMPLATE_PARTIAL_SPECIALIZATION(Category.DECLARATION),
    CXX_ACCESS_SPECIFIER(Category.DECLARATION),
    CXX_BASE_SPECIFIER(Category.DECLARATION),
    FRIEND_DECL(Category.DECLARATION),
    FUNCTION_DECL(Category.DECLARATION),
    FUNCTION_TEMPLATE(Category.DECLARATION),
    CXX_METHOD(Category.DECLARATION),
    CONSTRUCTOR(Category.DECLARATION),
    DESTRUCTOR(Category.DECLARATION),
    PARM_DECL(Category.DECLARATION),
    VAR_DECL(Category.DECLARATION),
    FIELD_DECL(Category.DECLARATION),
    ENUM_DECL(Category.DECLARATION),
    ENUM_CONSTANT_DECL(Category.DECLARATION),
    TYPEDEF_DECL(Category.DECLARATION),
    TYPE_ALIAS_DECL(Category.DECLARATION),
    TEMPLATE_TYPE_PARAMETER(Category.DECLARATION),
    NON_TYPE_TEMPLATE_PARAMETER(Category.DECLARATION),
    TEMPLATE_TEMPLATE_PARAMETER(Category.DECLARATION),
    UNEXPOSED_DECL(Category.DECLARATION),

    TYPE_REF(Category.REFERENCE),
    TEMPLATE_REF(Category.REFERENCE),
    NAMESPACE_REF(Category.REFERENCE),
    MEMBER_REF(Category.REFERENCE),

    UNEXPOSED_EXPR(Category.EXPRESSION),
    DECL_REF_EXPR(Category.EXPRESSION),
    CALL_EXPR(Category.EXPRESSION),
    INTEGER_LITERAL(Category.EXPRESSION),
    FLOATING_LITERAL(Category.EXPRESSION),
    STRING_LITERAL(Category.EXPRESSION),

    COMPOUND_STMT(Category.STATEMENT),

    UNEXPOSED_ATTR(Category.ATTRIBUTE),
    CXX_FINAL_ATTR(Category.ATTRIBUTE),
    CXX_OVERRIDE_ATTR(Category.ATTRIBUTE),

    NO_DECL_FOUND(Category.INVALID);

    private enum Category {
        TRANSLATION_UNIT,
        DECLARATION,
        REFERENCE,
        EXPRESSION,
        STATEMENT,
        ATTRIBUTE,
        INVALID
    }

    private static final Map<String, CursorKind> BY_DUMP_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(CursorKind::getDumpName, Function.identity()));

    private final Category category;

    CursorKind(Category category) {
        this.category = category;
    }

    public boolean isDeclaration() {
        return category == Category.DECLARATION;
    }

    public boolean isReference() {
        return category == Category.REFERENCE;
    }

    public boolean isExpression() {
        return category == Category.EXPRESSION;
    }

    public boolean isStatement() {
        return category == Category.STATEMENT;
    }

    public boolean isAttribute() {
        return category == Category.ATTRIBUTE;
    }

    public boolean isTemplateParameter() {
        return this == TEMPLATE_TYPE_PARAMETER || this == NON_TYPE_TEMPLATE_PARAMETER
                || this == TEMPLATE_TEMPLATE_PARAMETER;
    }

    /**
     * Name used for this kind in recorded cursor dumps, e.g. {@code class_decl}.
     */
    public String getDumpName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CursorKind> fromDumpName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_DUMP_NAME.get(name.toLowerCase(Locale.ROOT)));
    }
}
