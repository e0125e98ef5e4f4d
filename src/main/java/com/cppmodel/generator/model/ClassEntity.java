package com.cppmodel.generator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * A class, struct or union.
 *
 * Access-specifier labels are ordinary children at the position they were
 * declared; the base-specifier list is kept separately in declaration order,
 * which is also base-initialization order.
 */
@Getter
public class ClassEntity extends Entity {
    private final ClassKind classKind;
    private boolean finalClass;

    @Getter(AccessLevel.NONE)
    private final List<BaseClassEntity> bases = new ArrayList<>();

    private ClassEntity(String name, ClassKind classKind) {
        super(EntityKind.CLASS, name);
        this.classKind = Objects.requireNonNull(classKind, "classKind");
    }

    public static Builder builder(String name, ClassKind classKind) {
        return new Builder(name, classKind);
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public List<BaseClassEntity> getBases() {
        return Collections.unmodifiableList(bases);
    }

    public AccessSpecifierKind getDefaultAccess() {
        return classKind.getDefaultAccess();
    }

    /**
     * Access in effect for the given member: the last access specifier
     * preceding it, or the class-key default.
     *
     * @throws IllegalArgumentException if {@code member} is not a child of this class
     */
    public AccessSpecifierKind accessOf(Entity member) {
        AccessSpecifierKind access = getDefaultAccess();
        for (Entity child : getChildren()) {
            if (child == member) {
                return access;
            }
            if (child instanceof AccessSpecifierEntity specifier) {
                access = specifier.getAccess();
            }
        }
        throw new IllegalArgumentException(member + " is not a member of " + this);
    }

    public static final class Builder extends EntityBuilder<ClassEntity, Builder> {
        private AccessSpecifierKind currentAccess;

        private Builder(String name, ClassKind classKind) {
            super(new ClassEntity(name, classKind));
            this.currentAccess = classKind.getDefaultAccess();
        }

        @Override
        protected Builder self() {
            return this;
        }

        /**
         * Access applied to members added from now on.
         */
        public AccessSpecifierKind getCurrentAccess() {
            return currentAccess;
        }

        /**
         * Adds an access-specifier label and makes it the current access.
         */
        public Builder accessSpecifier(AccessSpecifierKind access) {
            addChild(new AccessSpecifierEntity(access));
            currentAccess = access;
            return this;
        }

        public Builder baseClass(String name, CppType type, AccessSpecifierKind access, boolean virtual) {
            ClassEntity entity = get();
            BaseClassEntity base = new BaseClassEntity(name, type, access, virtual);
            entity.adopt(base);
            entity.bases.add(base);
            return this;
        }

        public Builder finalClass() {
            get().finalClass = true;
            return this;
        }

        @Override
        protected void discardDefinitionPayload() {
            ClassEntity entity = get();
            entity.bases.clear();
            entity.finalClass = false;
        }
    }
}
