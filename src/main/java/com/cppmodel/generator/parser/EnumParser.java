package com.cppmodel.generator.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppmodel.generator.cursor.Cursor;
import com.cppmodel.generator.cursor.CursorKind;
import com.cppmodel.generator.model.EntityId;
import com.cppmodel.generator.model.EntityRef;
import com.cppmodel.generator.model.EnumEntity;
import com.cppmodel.generator.model.EnumValueEntity;

/**
 * Builds {@link EnumEntity}s and their enumerators.
 */
public class EnumParser {
    private static final Logger log = LoggerFactory.getLogger(EnumParser.class);

    private final ParseContext context;

    public EnumParser(ParseContext context) {
        this.context = context;
    }

    public EnumEntity parse(Cursor cur) {
        TokenStream stream = new TokenStream(cur.getTokens());
        stream.skipIf("enum");
        boolean scoped = stream.skipIf("class") || stream.skipIf("struct");
        stream.skipAttribute();

        EnumEntity.Builder builder = EnumEntity.builder(cur.getSpelling(), scoped);
        if (hasExplicitUnderlyingType(stream) && !cur.getUnderlyingType().isEmpty()) {
            builder.underlyingType(context.parseType(cur, cur.getUnderlyingType()));
        }

        if (cur.isDefinition()) {
            cur.visitChildren(child -> {
                if (child.getKind() == CursorKind.ENUM_CONSTANT_DECL) {
                    builder.value(parseValue(child));
                }
            });
        }

        EntityId id = ParseContext.idOf(cur);
        if (!cur.isDefinition()) {
            log.debug("Parsed enum declaration '{}'", cur.getSpelling());
            return builder.finishDeclaration(context.getIndex(), id);
        }
        EntityRef semanticParent = context.getScopeResolver().resolveSemanticParent(cur, false).orElse(null);
        log.debug("Parsed enum '{}' with {} value(s)", cur.getSpelling(), builder.get().getChildren().size());
        return builder.finishDefinition(context.getIndex(), id, semanticParent);
    }

    private EnumValueEntity parseValue(Cursor cur) {
        TokenStream stream = new TokenStream(cur.getTokens());
        String value = null;
        if (stream.skipIf(cur.getSpelling())) {
            stream.skipAttribute();
            if (stream.skipIf("=")) {
                value = stream.remainder();
            }
        }
        return EnumValueEntity.build(context.getIndex(), ParseContext.idOf(cur), cur.getSpelling(), value);
    }

    /**
     * Whether a {@code :} follows the (possibly qualified) name before the body.
     */
    private static boolean hasExplicitUnderlyingType(TokenStream stream) {
        while (!stream.done() && !stream.peekIs("{") && !stream.peekIs(";")) {
            if (stream.skipIf(":")) {
                return true;
            }
            stream.bump();
        }
        return false;
    }
}
