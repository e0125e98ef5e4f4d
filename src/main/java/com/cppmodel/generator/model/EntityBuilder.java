package com.cppmodel.generator.model;

import java.util.Objects;

/**
 * Single-use accumulator for an entity under construction.
 *
 * Children and attributes are added while the builder is
 * {@link State#ACCUMULATING}; one of the {@code finish} operations moves it
 * into a terminal state and hands the finished entity to the caller. Any
 * further call fails with {@link IllegalStateException}.
 *
 * @param <T> the entity type being built
 * @param <B> the concrete builder type, for chaining
 */
public abstract class EntityBuilder<T extends Entity, B extends EntityBuilder<T, B>> {

    public enum State {
        ACCUMULATING,
        FINISHED_DECLARATION,
        FINISHED_DEFINITION
    }

    private final T entity;
    private State state = State.ACCUMULATING;

    protected EntityBuilder(T entity) {
        this.entity = Objects.requireNonNull(entity, "entity");
    }

    protected abstract B self();

    /**
     * Clears kind-specific payload that only a definition carries.
     * Children have already been dropped when this is called.
     */
    protected void discardDefinitionPayload() {
    }

    public State getState() {
        return state;
    }

    /**
     * The entity under construction. It must not be retained past
     * the terminal operation by anyone but the new owner.
     */
    public T get() {
        checkAccumulating();
        return entity;
    }

    public B addChild(Entity child) {
        checkAccumulating();
        entity.attach(child);
        return self();
    }

    public B templateParameter(TemplateParameter parameter) {
        checkAccumulating();
        entity.addTemplateParameter(parameter);
        return self();
    }

    public B friend() {
        checkAccumulating();
        entity.markFriend();
        return self();
    }

    /**
     * Finishes a non-template declaration and records it as a forward
     * declaration in the index.
     */
    public T finishDeclaration(EntityIndex index, EntityId id) {
        Objects.requireNonNull(index, "index");
        T result = declaration(id, false);
        index.registerForwardDeclaration(id, result);
        return result;
    }

    /**
     * Finishes a template declaration. The index is not touched.
     */
    public T finishTemplateDeclaration(EntityId id) {
        return declaration(id, true);
    }

    /**
     * Finishes a non-template definition and registers it in the index.
     *
     * @param semanticParent the semantic parent of an out-of-line definition, or {@code null}
     */
    public T finishDefinition(EntityIndex index, EntityId id, EntityRef semanticParent) {
        Objects.requireNonNull(index, "index");
        T result = definition(id, false, semanticParent);
        index.registerDefinition(id, result);
        return result;
    }

    /**
     * Finishes a template definition. Templates are never registered, their
     * specializations would collide under one identity.
     */
    public T finishTemplateDefinition(EntityId id, EntityRef semanticParent) {
        return definition(id, true, semanticParent);
    }

    protected void checkAccumulating() {
        if (state != State.ACCUMULATING) {
            throw new IllegalStateException("Builder for " + entity.getKind() + " '" + entity.getName()
                    + "' is already " + state);
        }
    }

    private T declaration(EntityId id, boolean template) {
        checkAccumulating();
        entity.dropChildren();
        discardDefinitionPayload();
        entity.complete(id, false, template, null);
        state = State.FINISHED_DECLARATION;
        return entity;
    }

    private T definition(EntityId id, boolean template, EntityRef semanticParent) {
        checkAccumulating();
        entity.complete(id, true, template, semanticParent);
        state = State.FINISHED_DEFINITION;
        return entity;
    }
}
