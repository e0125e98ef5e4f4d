package com.cppmodel.generator.model;

import java.util.Objects;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * A function parameter; the name may be empty.
 */
@Getter
public class FunctionParameterEntity extends Entity {
    private final CppType type;

    @Getter(AccessLevel.NONE)
    private final String defaultValue;

    private FunctionParameterEntity(String name, CppType type, String defaultValue) {
        super(EntityKind.FUNCTION_PARAMETER, name);
        this.type = Objects.requireNonNull(type, "type");
        this.defaultValue = defaultValue;
    }

    /**
     * Builds a parameter and registers it as a definition.
     */
    public static FunctionParameterEntity build(EntityIndex index, EntityId id, String name, CppType type,
                                                String defaultValue) {
        FunctionParameterEntity parameter = new FunctionParameterEntity(name, type, defaultValue);
        parameter.complete(id, true, false, null);
        index.registerDefinition(id, parameter);
        return parameter;
    }

    public Optional<String> getDefaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
