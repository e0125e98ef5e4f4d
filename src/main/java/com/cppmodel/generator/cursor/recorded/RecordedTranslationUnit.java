package com.cppmodel.generator.cursor.recorded;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.cppmodel.generator.cursor.Cursor;
import com.cppmodel.generator.cursor.CursorKind;

/**
 * A recorded translation unit: its root cursor plus the cursors recorded
 * with an explicit identity, for resolving {@code semantic_parent} and
 * {@code specialized} references.
 */
public class RecordedTranslationUnit {
    private final String name;
    private RecordedCursor root;

    private final Map<String, RecordedCursor> byId = new HashMap<>();

    /** Stand-ins for identities that were referenced but never recorded. */
    private final Map<String, RecordedCursor> placeholders = new HashMap<>();

    RecordedTranslationUnit(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    public RecordedCursor getRoot() {
        return root;
    }

    void setRoot(RecordedCursor root) {
        this.root = root;
    }

    /**
     * Records a cursor under its explicit identity. A definition takes the
     * place of declarations recorded earlier under the same identity.
     */
    void register(String id, RecordedCursor cursor) {
        RecordedCursor existing = byId.get(id);
        if (existing == null || (!existing.isDefinition() && cursor.isDefinition())) {
            byId.put(id, cursor);
        }
    }

    public Optional<RecordedCursor> lookup(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public int size() {
        return byId.size();
    }

    /**
     * The cursor recorded under {@code id}; an unknown identity yields a
     * stable placeholder of kind {@link CursorKind#NO_DECL_FOUND}, so it still
     * differs from every lexical parent.
     */
    Cursor resolve(String id) {
        RecordedCursor cursor = byId.get(id);
        if (cursor != null) {
            return cursor;
        }
        return placeholders.computeIfAbsent(id, key -> new RecordedCursor(this, CursorKind.NO_DECL_FOUND, "",
                Map.of(RecordedCursor.ID, key), Set.of(), "", 0));
    }
}
