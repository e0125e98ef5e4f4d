package com.cppmodel.generator.model;

import java.util.Objects;

import lombok.Getter;

/**
 * A {@code typedef} or {@code using} alias declaration.
 */
@Getter
public class TypeAliasEntity extends Entity {
    private final CppType target;
    private final boolean usingSyntax;

    private TypeAliasEntity(String name, CppType target, boolean usingSyntax) {
        super(EntityKind.TYPE_ALIAS, name);
        this.target = Objects.requireNonNull(target, "target");
        this.usingSyntax = usingSyntax;
    }

    public static Builder builder(String name, CppType target, boolean usingSyntax) {
        return new Builder(name, target, usingSyntax);
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public static final class Builder extends EntityBuilder<TypeAliasEntity, Builder> {

        private Builder(String name, CppType target, boolean usingSyntax) {
            super(new TypeAliasEntity(name, target, usingSyntax));
        }

        @Override
        protected Builder self() {
            return this;
        }
    }
}
