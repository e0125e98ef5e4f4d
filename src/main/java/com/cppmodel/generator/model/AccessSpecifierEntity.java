package com.cppmodel.generator.model;

import java.util.Objects;

import lombok.Getter;

/**
 * An access specifier label inside a class body, e.g. {@code public:}.
 */
@Getter
public class AccessSpecifierEntity extends Entity {
    private final AccessSpecifierKind access;

    public AccessSpecifierEntity(AccessSpecifierKind access) {
        super(EntityKind.ACCESS_SPECIFIER, Objects.requireNonNull(access, "access").getSpelling());
        this.access = access;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
