package com.cppmodel.generator.codegen;

import java.util.List;
import java.util.Objects;

import com.cppmodel.generator.model.Entity;
import com.cppmodel.generator.model.EntityId;

/**
 * Write channel for rendering one entity.
 *
 * Opening an output asks the backend for the entity's {@link SynopsisOption};
 * an excluded output ignores every write. Closing a non-excluded container
 * output notifies the backend exactly once. Use with try-with-resources so
 * the notification follows the rendering of all children.
 */
public final class Output implements AutoCloseable {
    private final CodeGenerator generator;
    private final Entity entity;
    private final boolean container;
    private final SynopsisOption option;
    private boolean closed;

    public Output(CodeGenerator generator, Entity entity, boolean container) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.entity = Objects.requireNonNull(entity, "entity");
        this.container = container;
        SynopsisOption chosen = container ? generator.onContainerBegin(entity) : generator.onLeaf(entity);
        this.option = chosen != null ? chosen : SynopsisOption.DEFINITION;
    }

    public SynopsisOption getOption() {
        return option;
    }

    public boolean isExcluded() {
        return option == SynopsisOption.EXCLUDE;
    }

    /**
     * Whether bodies and children of the entity are to be rendered.
     */
    public boolean generateDefinition() {
        return option == SynopsisOption.DEFINITION;
    }

    public CodeGenerator getGenerator() {
        return generator;
    }

    public Output indent() {
        if (!isExcluded()) {
            generator.doIndent();
        }
        return this;
    }

    public Output unindent() {
        if (!isExcluded()) {
            generator.doUnindent();
        }
        return this;
    }

    public Output keyword(String keyword) {
        if (!isExcluded()) {
            generator.doWriteKeyword(checkToken(keyword));
        }
        return this;
    }

    public Output identifier(String identifier) {
        if (!isExcluded()) {
            generator.doWriteIdentifier(checkToken(identifier));
        }
        return this;
    }

    public Output reference(List<EntityId> ids, String name) {
        if (!isExcluded()) {
            generator.doWriteReference(List.copyOf(ids), checkToken(name));
        }
        return this;
    }

    public Output punctuation(String punctuation) {
        if (!isExcluded()) {
            generator.doWritePunctuation(checkToken(punctuation));
        }
        return this;
    }

    public Output strLiteral(String literal) {
        if (!isExcluded()) {
            generator.doWriteStrLiteral(checkToken(literal));
        }
        return this;
    }

    public Output intLiteral(String literal) {
        if (!isExcluded()) {
            generator.doWriteIntLiteral(checkToken(literal));
        }
        return this;
    }

    public Output floatLiteral(String literal) {
        if (!isExcluded()) {
            generator.doWriteFloatLiteral(checkToken(literal));
        }
        return this;
    }

    public Output preprocessor(String token) {
        if (!isExcluded()) {
            generator.doWritePreprocessor(checkToken(token));
        }
        return this;
    }

    public Output tokenSeq(String tokens) {
        if (!isExcluded()) {
            generator.doWriteTokenSeq(checkToken(tokens));
        }
        return this;
    }

    public Output newline() {
        if (!isExcluded()) {
            generator.doWriteNewline();
        }
        return this;
    }

    public Output whitespace() {
        if (!isExcluded()) {
            generator.doWriteWhitespace();
        }
        return this;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (container && !isExcluded()) {
            generator.onContainerEnd(entity);
        }
    }

    private static String checkToken(String token) {
        Objects.requireNonNull(token, "token");
        if (token.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("Newlines are written with newline(), not as token text");
        }
        return token;
    }
}
