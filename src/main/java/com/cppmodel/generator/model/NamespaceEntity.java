package com.cppmodel.generator.model;

import lombok.Getter;

/**
 * A namespace definition. Every namespace block is its own entity.
 */
@Getter
public class NamespaceEntity extends Entity {
    private boolean inlineNamespace;

    private NamespaceEntity(String name) {
        super(EntityKind.NAMESPACE, name);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public static final class Builder extends EntityBuilder<NamespaceEntity, Builder> {

        private Builder(String name) {
            super(new NamespaceEntity(name));
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder inlineNamespace(boolean value) {
            get().inlineNamespace = value;
            return this;
        }
    }
}
