package com.cppmodel.generator.model;

import java.util.Objects;
import java.util.Optional;

import lombok.Value;

/**
 * A type as spelled in the source. Types naming a declaration carry a
 * symbolic reference to it.
 */
@Value
public class CppType {
    CppTypeKind kind;
    String spelling;
    EntityRef reference;

    public static CppType builtin(String spelling) {
        return new CppType(CppTypeKind.BUILTIN, spelling, null);
    }

    public static CppType userDefined(EntityRef reference) {
        Objects.requireNonNull(reference, "reference");
        return new CppType(CppTypeKind.USER_DEFINED, reference.getName(), reference);
    }

    public static CppType unexposed(String spelling) {
        return new CppType(CppTypeKind.UNEXPOSED, spelling, null);
    }

    public Optional<EntityRef> getReference() {
        return Optional.ofNullable(reference);
    }

    @Override
    public String toString() {
        return spelling;
    }
}
