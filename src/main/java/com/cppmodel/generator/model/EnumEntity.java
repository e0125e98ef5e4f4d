package com.cppmodel.generator.model;

import java.util.Optional;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * An enumeration; its enumerators are its children.
 */
@Getter
public class EnumEntity extends Entity {
    private final boolean scoped;

    @Getter(AccessLevel.NONE)
    private CppType underlyingType;

    private EnumEntity(String name, boolean scoped) {
        super(EntityKind.ENUM, name);
        this.scoped = scoped;
    }

    public static Builder builder(String name, boolean scoped) {
        return new Builder(name, scoped);
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visit(this);
    }

    /**
     * The explicitly spelled underlying type.
     */
    public Optional<CppType> getUnderlyingType() {
        return Optional.ofNullable(underlyingType);
    }

    public static final class Builder extends EntityBuilder<EnumEntity, Builder> {

        private Builder(String name, boolean scoped) {
            super(new EnumEntity(name, scoped));
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder underlyingType(CppType type) {
            get().underlyingType = type;
            return this;
        }

        public Builder value(EnumValueEntity value) {
            return addChild(value);
        }
    }
}
