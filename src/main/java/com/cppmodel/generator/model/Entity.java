package com.cppmodel.generator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Base class for all entity model nodes.
 *
 * An entity exclusively owns its children; the order of the children is the
 * order in which the traversal encountered them. Cross-references to other
 * entities are {@link EntityRef}s and never participate in ownership.
 * Entities are only mutated by their {@link EntityBuilder} and are read-only
 * once finished.
 */
@Getter
public abstract class Entity {
    private final EntityKind kind;
    private final String name;
    private EntityId id;
    private boolean definition;
    private boolean template;
    private boolean friend;

    @Getter(AccessLevel.NONE)
    private EntityRef semanticParent;

    @Getter(AccessLevel.NONE)
    private Entity parent;

    @Getter(AccessLevel.NONE)
    private final List<Entity> children = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<TemplateParameter> templateParameters = new ArrayList<>();

    protected Entity(EntityKind kind, String name) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = name != null ? name : "";
    }

    public abstract <R> R accept(EntityVisitor<R> visitor);

    public List<Entity> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<TemplateParameter> getTemplateParameters() {
        return Collections.unmodifiableList(templateParameters);
    }

    /**
     * The semantic parent, present only for out-of-line constructs whose
     * lexical and semantic scopes differ.
     */
    public Optional<EntityRef> getSemanticParent() {
        return Optional.ofNullable(semanticParent);
    }

    /**
     * The owning entity, empty for roots and entities not attached yet.
     */
    public Optional<Entity> getParent() {
        return Optional.ofNullable(parent);
    }

    public boolean isAnonymous() {
        return name.isEmpty();
    }

    /**
     * Number of entities in the subtree rooted here, this one included.
     */
    public int treeSize() {
        int size = 1;
        for (Entity child : children) {
            size += child.treeSize();
        }
        return size;
    }

    void attach(Entity child) {
        Objects.requireNonNull(child, "child");
        if (child.parent != null) {
            throw new IllegalStateException("Entity '" + child.getName() + "' is already owned by '"
                    + child.parent.getName() + "'");
        }
        child.parent = this;
        children.add(child);
    }

    void adopt(Entity child) {
        Objects.requireNonNull(child, "child");
        if (child.parent != null) {
            throw new IllegalStateException("Entity '" + child.getName() + "' is already owned by '"
                    + child.parent.getName() + "'");
        }
        child.parent = this;
    }

    void dropChildren() {
        for (Entity child : children) {
            child.parent = null;
        }
        children.clear();
    }

    void addTemplateParameter(TemplateParameter parameter) {
        templateParameters.add(Objects.requireNonNull(parameter, "parameter"));
    }

    void markFriend() {
        this.friend = true;
    }

    void complete(EntityId id, boolean definition, boolean template, EntityRef semanticParent) {
        Objects.requireNonNull(id, "id");
        if (semanticParent != null && semanticParent.getIds().contains(id)) {
            throw new IllegalArgumentException("Entity '" + name + "' cannot be its own semantic parent");
        }
        this.id = id;
        this.definition = definition;
        this.template = template;
        this.semanticParent = semanticParent;
    }

    @Override
    public String toString() {
        return kind + " " + (name.isEmpty() ? "<anonymous>" : name) + (id != null ? " [" + id + "]" : "");
    }
}
