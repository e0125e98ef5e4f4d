package com.cppmodel.generator.model;

/**
 * Root of a translation unit's entity tree.
 */
public class FileEntity extends Entity {

    private FileEntity(String name) {
        super(EntityKind.FILE, name);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public static final class Builder extends EntityBuilder<FileEntity, Builder> {
        private final String name;

        private Builder(String name) {
            super(new FileEntity(name));
            this.name = name;
        }

        @Override
        protected Builder self() {
            return this;
        }

        /**
         * Finishes the file and registers it with the index under its name.
         */
        public FileEntity finish(EntityIndex index) {
            FileEntity file = finishDefinition(index, EntityId.of("file:" + name), null);
            index.registerFile(file);
            return file;
        }
    }
}
