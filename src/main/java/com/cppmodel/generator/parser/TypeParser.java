package com.cppmodel.generator.parser;

import com.cppmodel.generator.cursor.Cursor;
import com.cppmodel.generator.cursor.CursorType;
import com.cppmodel.generator.model.CppType;

/**
 * Turns a provider type handle into a {@link CppType}.
 */
@FunctionalInterface
public interface TypeParser {

    /**
     * @param context the parse in progress
     * @param cur     the cursor the type belongs to
     * @param type    the type handle reported for {@code cur}
     */
    CppType parse(ParseContext context, Cursor cur, CursorType type);
}
