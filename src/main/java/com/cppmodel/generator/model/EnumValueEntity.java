package com.cppmodel.generator.model;

import java.util.Optional;

/**
 * An enumerator, optionally with its explicit value expression.
 */
public class EnumValueEntity extends Entity {
    private final String value;

    private EnumValueEntity(String name, String value) {
        super(EntityKind.ENUM_VALUE, name);
        this.value = value;
    }

    /**
     * Builds an enumerator and registers it as a definition.
     */
    public static EnumValueEntity build(EntityIndex index, EntityId id, String name, String value) {
        EnumValueEntity enumValue = new EnumValueEntity(name, value);
        enumValue.complete(id, true, false, null);
        index.registerDefinition(id, enumValue);
        return enumValue;
    }

    public Optional<String> getValue() {
        return Optional.ofNullable(value);
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
