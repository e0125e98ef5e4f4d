package com.cppmodel.generator.model;

import java.util.Objects;

import lombok.Value;

/**
 * Opaque identity of an entity, minted by the parse frontend.
 * Used as the key for every cross-reference; never a pointer.
 */
@Value
public class EntityId {
    String value;

    private EntityId(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public static EntityId of(String value) {
        return new EntityId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
