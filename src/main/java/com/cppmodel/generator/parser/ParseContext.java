package com.cppmodel.generator.parser;

import java.util.Objects;
import java.util.Optional;

import com.cppmodel.generator.cursor.Cursor;
import com.cppmodel.generator.cursor.CursorType;
import com.cppmodel.generator.model.CppType;
import com.cppmodel.generator.model.Entity;
import com.cppmodel.generator.model.EntityId;
import com.cppmodel.generator.model.EntityIndex;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * State shared by the per-kind parsers during one build pass: the symbol
 * table being populated, the type-parsing collaborator and the dispatcher
 * used to recurse into child cursors.
 */
@Getter
public class ParseContext {
    private final EntityIndex index;
    private final TypeParser typeParser;
    private final ScopeResolver scopeResolver = new ScopeResolver();

    @Getter(AccessLevel.NONE)
    private final EntityParser entityParser;

    public ParseContext(EntityIndex index, TypeParser typeParser) {
        this.index = Objects.requireNonNull(index, "index");
        this.typeParser = Objects.requireNonNull(typeParser, "typeParser");
        this.entityParser = new EntityParser(this);
    }

    public ParseContext(EntityIndex index) {
        this(index, new SpellingTypeParser());
    }

    /**
     * Parses {@code cur}, a child of {@code parentCur}, into an entity.
     *
     * @return empty if the cursor does not describe an entity
     */
    public Optional<Entity> parseEntity(Cursor cur, Cursor parentCur) {
        return entityParser.parse(cur, parentCur);
    }

    public CppType parseType(Cursor cur, CursorType type) {
        return typeParser.parse(this, cur, type);
    }

    static EntityId idOf(Cursor cur) {
        return EntityId.of(cur.getUsr());
    }
}
