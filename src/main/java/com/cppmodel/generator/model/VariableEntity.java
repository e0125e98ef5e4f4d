package com.cppmodel.generator.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * A namespace-scope variable, static data member or non-static data member.
 */
@Getter
public class VariableEntity extends Entity {

    public enum StorageSpecifier {
        STATIC,
        EXTERN,
        THREAD_LOCAL,
        CONSTEXPR,
        MUTABLE;

        public String getSpelling() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Optional<StorageSpecifier> fromSpelling(String spelling) {
            for (StorageSpecifier specifier : values()) {
                if (specifier.getSpelling().equals(spelling)) {
                    return Optional.of(specifier);
                }
            }
            return Optional.empty();
        }
    }

    private final CppType type;
    private final boolean member;

    @Getter(AccessLevel.NONE)
    private String defaultValue;

    @Getter(AccessLevel.NONE)
    private final Set<StorageSpecifier> storage = EnumSet.noneOf(StorageSpecifier.class);

    private VariableEntity(String name, CppType type, boolean member) {
        super(EntityKind.VARIABLE, name);
        this.type = Objects.requireNonNull(type, "type");
        this.member = member;
    }

    public static Builder builder(String name, CppType type, boolean member) {
        return new Builder(name, type, member);
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public Optional<String> getDefaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    public Set<StorageSpecifier> getStorage() {
        return Collections.unmodifiableSet(storage);
    }

    public static final class Builder extends EntityBuilder<VariableEntity, Builder> {

        private Builder(String name, CppType type, boolean member) {
            super(new VariableEntity(name, type, member));
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder defaultValue(String value) {
            get().defaultValue = value;
            return this;
        }

        public Builder storage(StorageSpecifier specifier) {
            get().storage.add(Objects.requireNonNull(specifier, "specifier"));
            return this;
        }
    }
}
