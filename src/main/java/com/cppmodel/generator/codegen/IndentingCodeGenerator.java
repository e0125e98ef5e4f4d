package com.cppmodel.generator.codegen;

import java.util.Objects;

import com.cppmodel.generator.model.Entity;

/**
 * Base for backends that produce a single text buffer, implementing the
 * indentation rules of {@link CodeGenerator} and delegating the per-entity
 * choice to a {@link SynopsisPolicy}.
 */
public abstract class IndentingCodeGenerator implements CodeGenerator {
    private final StringBuilder buffer = new StringBuilder();
    private final int indentWidth;
    private final SynopsisPolicy policy;

    private int level;
    private int pendingLevel;
    private boolean lineEmpty = true;

    protected IndentingCodeGenerator(int indentWidth, SynopsisPolicy policy) {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indentWidth must not be negative");
        }
        this.indentWidth = indentWidth;
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public SynopsisOption onContainerBegin(Entity entity) {
        return policy.choose(entity);
    }

    @Override
    public SynopsisOption onLeaf(Entity entity) {
        return policy.choose(entity);
    }

    @Override
    public void doIndent() {
        pendingLevel++;
    }

    @Override
    public void doUnindent() {
        if (pendingLevel > 0) {
            pendingLevel--;
        }
        if (lineEmpty) {
            level = Math.min(level, pendingLevel);
        }
    }

    @Override
    public void doWriteTokenSeq(String tokens) {
        emit(escape(tokens));
    }

    @Override
    public void doWriteNewline() {
        buffer.append('\n');
        level = pendingLevel;
        lineEmpty = true;
    }

    /**
     * Appends already encoded text, preceded by the indentation if it starts a line.
     */
    protected void emit(String encoded) {
        if (encoded.isEmpty()) {
            return;
        }
        if (lineEmpty) {
            buffer.append(" ".repeat(level * indentWidth));
            lineEmpty = false;
        }
        buffer.append(encoded);
    }

    /**
     * Appends markup that takes no room on the line, such as an anchor.
     */
    protected void emitInvisible(String markup) {
        buffer.append(markup);
    }

    /**
     * Encodes token text for the target format.
     */
    protected abstract String escape(String text);

    public int getIndentLevel() {
        return level;
    }

    public SynopsisPolicy getPolicy() {
        return policy;
    }

    /**
     * Everything written so far.
     */
    public String getResult() {
        return buffer.toString();
    }
}
