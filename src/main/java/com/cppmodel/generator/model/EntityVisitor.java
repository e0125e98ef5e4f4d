package com.cppmodel.generator.model;

/**
 * Visitor over the closed entity taxonomy.
 */
public interface EntityVisitor<R> {
    R visit(FileEntity file);
    R visit(NamespaceEntity namespace);
    R visit(ClassEntity classEntity);
    R visit(BaseClassEntity baseClass);
    R visit(AccessSpecifierEntity accessSpecifier);
    R visit(FunctionEntity function);
    R visit(FunctionParameterEntity parameter);
    R visit(VariableEntity variable);
    R visit(EnumEntity enumEntity);
    R visit(EnumValueEntity enumValue);
    R visit(TypeAliasEntity typeAlias);
}
