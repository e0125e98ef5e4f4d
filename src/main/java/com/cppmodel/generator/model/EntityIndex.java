package com.cppmodel.generator.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session-wide symbol table mapping identities to entities.
 *
 * Populated during the build pass, then {@link #seal() sealed}; afterwards
 * it is read-only and can be shared between concurrent renders. The index
 * holds non-owning references: entity lifetime follows the ownership tree.
 */
public class EntityIndex {
    private static final Logger log = LoggerFactory.getLogger(EntityIndex.class);

    private static final class Entry {
        private final Entity entity;
        private final boolean definition;

        private Entry(Entity entity, boolean definition) {
            this.entity = entity;
            this.definition = definition;
        }
    }

    private final Map<EntityId, Entry> entities = new ConcurrentHashMap<>();
    private final Map<String, FileEntity> files = new ConcurrentHashMap<>();
    private volatile boolean sealed;

    /**
     * Registers a definition. A previously registered forward declaration
     * is replaced; a previously registered definition is kept.
     *
     * @return whether the entity is now the registered one
     */
    public boolean registerDefinition(EntityId id, Entity entity) {
        checkOpen();
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(entity, "entity");
        if (entity.isTemplate()) {
            throw new IllegalArgumentException("Templates are not registered: " + entity);
        }

        Entry existing = entities.get(id);
        if (existing != null && existing.definition) {
            log.debug("Duplicate definition for {}, keeping {}", id, existing.entity);
            return false;
        }
        entities.put(id, new Entry(entity, true));
        return true;
    }

    /**
     * Registers a forward declaration unless the id is already known.
     *
     * @return whether the entity is now the registered one
     */
    public boolean registerForwardDeclaration(EntityId id, Entity entity) {
        checkOpen();
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(entity, "entity");
        return entities.putIfAbsent(id, new Entry(entity, false)) == null;
    }

    public void registerFile(FileEntity file) {
        checkOpen();
        Objects.requireNonNull(file, "file");
        FileEntity previous = files.putIfAbsent(file.getName(), file);
        if (previous != null && previous != file) {
            throw new IllegalArgumentException("File '" + file.getName() + "' is already registered");
        }
    }

    public Optional<Entity> lookup(EntityId id) {
        Entry entry = entities.get(id);
        return entry != null ? Optional.of(entry.entity) : Optional.empty();
    }

    public Optional<Entity> lookupDefinition(EntityId id) {
        Entry entry = entities.get(id);
        return entry != null && entry.definition ? Optional.of(entry.entity) : Optional.empty();
    }

    public Optional<FileEntity> lookupFile(String name) {
        return Optional.ofNullable(files.get(name));
    }

    public boolean contains(EntityId id) {
        return entities.containsKey(id);
    }

    public int size() {
        return entities.size();
    }

    public long definitionCount() {
        return entities.values().stream().filter(e -> e.definition).count();
    }

    /**
     * Ends the build pass. Registration afterwards is a programming error.
     */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void checkOpen() {
        if (sealed) {
            throw new IllegalStateException("Entity index is sealed");
        }
    }
}
