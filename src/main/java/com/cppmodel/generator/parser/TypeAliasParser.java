package com.cppmodel.generator.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppmodel.generator.cursor.Cursor;
import com.cppmodel.generator.cursor.CursorKind;
import com.cppmodel.generator.model.TypeAliasEntity;

/**
 * Builds {@link TypeAliasEntity}s from {@code typedef} and {@code using} declarations.
 */
public class TypeAliasParser {
    private static final Logger log = LoggerFactory.getLogger(TypeAliasParser.class);

    private final ParseContext context;

    public TypeAliasParser(ParseContext context) {
        this.context = context;
    }

    public TypeAliasEntity parse(Cursor cur) {
        boolean usingSyntax = cur.getKind() == CursorKind.TYPE_ALIAS_DECL;
        TypeAliasEntity.Builder builder = TypeAliasEntity.builder(cur.getSpelling(),
                context.parseType(cur, cur.getUnderlyingType()), usingSyntax);

        log.debug("Parsed {} '{}'", usingSyntax ? "alias" : "typedef", cur.getSpelling());
        return builder.finishDefinition(context.getIndex(), ParseContext.idOf(cur), null);
    }
}
