package com.cppmodel.generator.codegen;

import com.cppmodel.generator.model.AccessSpecifierEntity;
import com.cppmodel.generator.model.AccessSpecifierKind;
import com.cppmodel.generator.model.ClassEntity;
import com.cppmodel.generator.model.Entity;
import com.cppmodel.generator.model.EntityKind;

import lombok.Builder;
import lombok.Value;

/**
 * Per-entity synopsis choice of the bundled backends.
 *
 * Private members, and the {@code private:} labels introducing them, can be
 * left out. In {@link SynopsisMode#DECLARATION} mode classes, enums and
 * functions are reduced to their declarations; namespaces always show their
 * contents.
 */
@Value
@Builder
public class SynopsisPolicy {
    @Builder.Default
    SynopsisMode mode = SynopsisMode.DEFINITION;

    boolean excludePrivate;

    public static SynopsisPolicy definitions() {
        return SynopsisPolicy.builder().build();
    }

    public SynopsisOption choose(Entity entity) {
        if (excludePrivate && isPrivateMember(entity)) {
            return SynopsisOption.EXCLUDE;
        }
        if (mode == SynopsisMode.DECLARATION && reducible(entity.getKind())) {
            return SynopsisOption.DECLARATION;
        }
        return SynopsisOption.DEFINITION;
    }

    private static boolean reducible(EntityKind kind) {
        return kind == EntityKind.CLASS || kind == EntityKind.ENUM || kind == EntityKind.FUNCTION;
    }

    private static boolean isPrivateMember(Entity entity) {
        if (entity instanceof AccessSpecifierEntity specifier) {
            return specifier.getAccess() == AccessSpecifierKind.PRIVATE;
        }
        return entity.getParent()
                .filter(ClassEntity.class::isInstance)
                .map(ClassEntity.class::cast)
                .map(owner -> owner.getChildren().contains(entity) && owner.accessOf(entity) == AccessSpecifierKind.PRIVATE)
                .orElse(false);
    }
}
