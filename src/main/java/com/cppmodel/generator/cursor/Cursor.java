package com.cppmodel.generator.cursor;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A node of the parse tree as exposed by the traversal provider.
 *
 * The entity builder only ever sees the parse tree through this interface:
 * structural facts (kind, spelling, definition-ness, parents), the token
 * stream covering the node's extent, and a few semantic queries. Cursors
 * compare with {@link Object#equals(Object)}; two cursors are equal when
 * they denote the same parse-tree node.
 */
public interface Cursor {

    CursorKind getKind();

    /**
     * The unqualified spelling, possibly empty (anonymous namespaces and unions).
     */
    String getSpelling();

    /**
     * Stable identity handle minted by the parse frontend.
     */
    String getUsr();

    boolean isDefinition();

    /**
     * Tokens covering this cursor's source extent, in source order.
     */
    List<Token> getTokens();

    Optional<Cursor> getSemanticParent();

    Optional<Cursor> getLexicalParent();

    /**
     * For template cursors the kind of the templated declaration,
     * {@link CursorKind#NO_DECL_FOUND} otherwise.
     */
    CursorKind getTemplateCursorKind();

    /**
     * For specializations the template they specialize.
     */
    Optional<Cursor> getSpecializedTemplate();

    /**
     * Access of an access-specifier or base-specifier cursor,
     * {@link CursorAccess#INVALID} for any other cursor.
     */
    CursorAccess getAccess();

    boolean isVirtualBase();

    CursorType getType();

    /**
     * Result type of function-like cursors.
     */
    CursorType getResultType();

    /**
     * Underlying type of typedef and alias cursors.
     */
    CursorType getUnderlyingType();

    /**
     * Yields each immediate child exactly once, in source order. The callback
     * returns before the next child is visited.
     */
    void visitChildren(Consumer<Cursor> visitor);
}
