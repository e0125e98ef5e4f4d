package com.cppmodel.generator.codegen;

import java.util.List;

import com.cppmodel.generator.model.Entity;
import com.cppmodel.generator.model.EntityId;

/**
 * Rendering backend driven by {@link CodeGeneration}.
 *
 * A minimal backend implements {@link #doWriteTokenSeq(String)},
 * {@link #doIndent()} and {@link #doUnindent()}; every other write forwards to
 * the token sequence primitive by default and can be overridden to highlight
 * or link individual token classes.
 *
 * <p>Backends never see a newline character outside {@link #doWriteNewline()}.
 * {@code doIndent} takes effect on the next newline; {@code doUnindent} takes
 * effect immediately if nothing was written on the current line yet, and on
 * the next newline otherwise.
 */
public interface CodeGenerator {

    /**
     * Called before an entity with renderable children is rendered.
     */
    default SynopsisOption onContainerBegin(Entity entity) {
        return SynopsisOption.DEFINITION;
    }

    /**
     * Called once after a container that was not excluded, when all of its
     * children are rendered.
     */
    default void onContainerEnd(Entity entity) {
    }

    /**
     * Called before an entity without renderable children is rendered.
     */
    default SynopsisOption onLeaf(Entity entity) {
        return SynopsisOption.DEFINITION;
    }

    void doIndent();

    void doUnindent();

    /**
     * Writes an unclassified sequence of tokens.
     */
    void doWriteTokenSeq(String tokens);

    default void doWriteKeyword(String keyword) {
        doWriteTokenSeq(keyword);
    }

    default void doWriteIdentifier(String identifier) {
        doWriteTokenSeq(identifier);
    }

    /**
     * Writes a name referring to other entities.
     *
     * @param ids  the referred entities, several for overload sets
     * @param name the name as spelled
     */
    default void doWriteReference(List<EntityId> ids, String name) {
        doWriteTokenSeq(name);
    }

    default void doWritePunctuation(String punctuation) {
        doWriteTokenSeq(punctuation);
    }

    default void doWriteStrLiteral(String literal) {
        doWriteTokenSeq(literal);
    }

    default void doWriteIntLiteral(String literal) {
        doWriteTokenSeq(literal);
    }

    default void doWriteFloatLiteral(String literal) {
        doWriteTokenSeq(literal);
    }

    default void doWritePreprocessor(String token) {
        doWriteTokenSeq(token);
    }

    default void doWriteNewline() {
        doWriteTokenSeq("\n");
    }

    default void doWriteWhitespace() {
        doWriteTokenSeq(" ");
    }
}
