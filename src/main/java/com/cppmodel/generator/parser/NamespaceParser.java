package com.cppmodel.generator.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppmodel.generator.cursor.Cursor;
import com.cppmodel.generator.model.NamespaceEntity;

/**
 * Builds {@link NamespaceEntity}s. A namespace is always a definition; a
 * reopened namespace is a separate entity sharing the identity of the first.
 */
public class NamespaceParser {
    private static final Logger log = LoggerFactory.getLogger(NamespaceParser.class);

    private final ParseContext context;

    public NamespaceParser(ParseContext context) {
        this.context = context;
    }

    public NamespaceEntity parse(Cursor cur) {
        TokenStream stream = new TokenStream(cur.getTokens());
        boolean inline = stream.skipIf("inline");

        NamespaceEntity.Builder builder = NamespaceEntity.builder(cur.getSpelling()).inlineNamespace(inline);
        cur.visitChildren(child -> {
            if (child.getKind().isDeclaration()) {
                context.parseEntity(child, cur).ifPresent(builder::addChild);
            }
        });

        log.debug("Parsed namespace '{}'", cur.getSpelling());
        return builder.finishDefinition(context.getIndex(), ParseContext.idOf(cur), null);
    }
}
