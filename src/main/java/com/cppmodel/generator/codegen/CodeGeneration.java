package com.cppmodel.generator.codegen;

import com.cppmodel.generator.model.Entity;
import com.cppmodel.generator.model.FileEntity;

/**
 * Whole-tree driver of the code generator protocol.
 */
public final class CodeGeneration {

    private CodeGeneration() {
    }

    /**
     * Renders {@code entity} with {@code generator}, followed by exactly one
     * newline if it was rendered. The children of a {@link FileEntity} count
     * as top-level entities and are each followed by one newline.
     *
     * @return whether anything was rendered
     */
    public static boolean generate(CodeGenerator generator, Entity entity) {
        EntityCodeWriter writer = new EntityCodeWriter(generator);
        if (entity instanceof FileEntity) {
            // the file writer separates its children itself
            return writer.write(entity);
        }
        boolean written = writer.write(entity);
        if (written) {
            generator.doWriteNewline();
        }
        return written;
    }
}
