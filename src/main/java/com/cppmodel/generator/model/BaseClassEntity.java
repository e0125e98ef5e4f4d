package com.cppmodel.generator.model;

import java.util.Objects;

import lombok.Getter;

/**
 * A base-specifier of a class: spelled name, parsed type, access and virtual-ness.
 */
@Getter
public class BaseClassEntity extends Entity {
    private final CppType type;
    private final AccessSpecifierKind access;
    private final boolean virtual;

    public BaseClassEntity(String name, CppType type, AccessSpecifierKind access, boolean virtual) {
        super(EntityKind.BASE_CLASS, name);
        this.type = Objects.requireNonNull(type, "type");
        this.access = Objects.requireNonNull(access, "access");
        this.virtual = virtual;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
