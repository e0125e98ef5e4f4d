package com.cppmodel.generator.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import lombok.Value;

/**
 * Non-owning reference to one or more entities (several for an overload set)
 * together with the name it is displayed as.
 *
 * Resolution goes through an {@link EntityIndex}; a reference whose target is
 * outside the parsed set simply stays unresolved.
 */
@Value
public class EntityRef {
    List<EntityId> ids;
    String name;

    public EntityRef(EntityId id, String name) {
        this(List.of(id), name);
    }

    public EntityRef(List<EntityId> ids, String name) {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException("reference needs at least one id");
        }
        this.ids = List.copyOf(ids);
        this.name = Objects.requireNonNull(name, "name");
    }

    public EntityId getId() {
        return ids.get(0);
    }

    public boolean isOverloadSet() {
        return ids.size() > 1;
    }

    /**
     * Resolves the first id that is known to the index.
     */
    public Optional<Entity> resolve(EntityIndex index) {
        for (EntityId id : ids) {
            Optional<Entity> entity = index.lookup(id);
            if (entity.isPresent()) {
                return entity;
            }
        }
        return Optional.empty();
    }
}
