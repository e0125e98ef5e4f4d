package com.cppmodel.generator.cursor;

import java.util.Optional;

import lombok.Value;

/**
 * Type handle attached to a cursor: the spelled type and, for types naming a
 * declaration, the identity of that declaration.
 */
@Value
public class CursorType {
    String spelling;
    String declarationUsr;

    public static CursorType of(String spelling) {
        return new CursorType(spelling, null);
    }

    public Optional<String> getDeclaration() {
        return Optional.ofNullable(declarationUsr);
    }

    public boolean isEmpty() {
        return spelling == null || spelling.isBlank();
    }
}
