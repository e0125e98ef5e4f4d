package com.cppmodel.generator.parser;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppmodel.generator.cursor.Cursor;
import com.cppmodel.generator.cursor.CursorKind;
import com.cppmodel.generator.cursor.Token;
import com.cppmodel.generator.model.EntityId;
import com.cppmodel.generator.model.EntityRef;
import com.cppmodel.generator.model.VariableEntity;
import com.cppmodel.generator.model.VariableEntity.StorageSpecifier;

/**
 * Builds {@link VariableEntity}s from variables and data members.
 */
public class VariableParser {
    private static final Logger log = LoggerFactory.getLogger(VariableParser.class);

    private final ParseContext context;

    public VariableParser(ParseContext context) {
        this.context = context;
    }

    public VariableEntity parse(Cursor cur) {
        boolean field = cur.getKind() == CursorKind.FIELD_DECL;
        boolean member = field || cur.getSemanticParent().map(VariableParser::isClassCursor).orElse(false);

        VariableEntity.Builder builder = VariableEntity.builder(cur.getSpelling(),
                context.parseType(cur, cur.getType()), member);

        TokenStream stream = new TokenStream(cur.getTokens());
        int nameIndex = stream.seekName(ScopeResolver.nameTokens(cur.getSpelling()));
        if (nameIndex >= 0) {
            List<Token> prefix = stream.tokens().subList(0, nameIndex);
            prefix.forEach(token -> StorageSpecifier.fromSpelling(token.getSpelling()).ifPresent(builder::storage));
            String initializer = initializer(stream);
            if (initializer != null) {
                builder.defaultValue(initializer);
            }
        }

        EntityId id = ParseContext.idOf(cur);
        // data members are always definitions
        if (!field && !cur.isDefinition()) {
            log.debug("Parsed variable declaration '{}'", cur.getSpelling());
            return builder.finishDeclaration(context.getIndex(), id);
        }

        EntityRef semanticParent = context.getScopeResolver().resolveSemanticParent(cur, false).orElse(null);
        log.debug("Parsed variable '{}'", cur.getSpelling());
        return builder.finishDefinition(context.getIndex(), id, semanticParent);
    }

    /**
     * The initializer following the declarator name: {@code = value} or a
     * braced list. Bit-field widths and array bounds are skipped.
     */
    private static String initializer(TokenStream stream) {
        while (stream.peekIs("[")) {
            stream.skipBrackets();
        }
        if (stream.skipIf(":")) {
            stream.bump();
        }
        if (stream.skipIf("=")) {
            return stripSemicolon(stream.remainder());
        }
        if (stream.peekIs("{")) {
            return stripSemicolon(stream.remainder());
        }
        return null;
    }

    private static String stripSemicolon(String spelling) {
        return spelling.endsWith(";") ? spelling.substring(0, spelling.length() - 1) : spelling;
    }

    private static boolean isClassCursor(Cursor cur) {
        switch (cur.getKind()) {
            case CLASS_DECL:
            case STRUCT_DECL:
            case UNION_DECL:
            case CLASS_TEMPLATE:
            case CLASS_TEMPLATE_PARTIAL_SPECIALIZATION:
                return true;
            default:
                return false;
        }
    }
}
