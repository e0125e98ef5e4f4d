package com.cppmodel.generator.parser;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppmodel.generator.cursor.Cursor;
import com.cppmodel.generator.cursor.SourceTokenizer;
import com.cppmodel.generator.cursor.Token;
import com.cppmodel.generator.model.EntityId;
import com.cppmodel.generator.model.EntityRef;

/**
 * Reconstructs the qualifying scope of out-of-line declarations.
 *
 * The provider only reports that a cursor's semantic parent differs from its
 * lexical parent; the scope as written has to be recovered from the
 * declarator's tokens. Segments ({@code identifier [<args>] ::}) are collected
 * until the entity's own name is reached; a token that is neither discards the
 * segments collected so far, so a qualified return type such as
 * {@code std::string A::name()} does not leak into the scope.
 */
public class ScopeResolver {
    private static final Logger log = LoggerFactory.getLogger(ScopeResolver.class);

    /**
     * The semantic parent reference of {@code cur}, if it is declared out of line.
     * Friend declarations never have one.
     */
    public Optional<EntityRef> resolveSemanticParent(Cursor cur, boolean friend) {
        if (friend) {
            return Optional.empty();
        }
        Optional<Cursor> semanticParent = cur.getSemanticParent();
        if (semanticParent.isEmpty() || semanticParent.equals(cur.getLexicalParent())) {
            return Optional.empty();
        }

        Optional<String> scope = resolveScope(cur.getTokens(), cur.getSpelling());
        scope.ifPresent(s -> log.debug("Out-of-line {} '{}' qualified by {}", cur.getKind(), cur.getSpelling(), s));
        return scope.map(s -> new EntityRef(EntityId.of(semanticParent.get().getUsr()), s));
    }

    /**
     * Scans {@code tokens} for the scope qualifying {@code spelling}.
     *
     * @return the scope segments joined with {@code ::}, empty if the name is
     *         not qualified or never appears
     */
    public Optional<String> resolveScope(List<Token> tokens, String spelling) {
        List<String> name = nameTokens(spelling);
        if (name.isEmpty()) {
            return Optional.empty();
        }

        TokenStream stream = new TokenStream(tokens);
        StringBuilder scope = new StringBuilder();
        boolean found = false;
        while (!stream.done()) {
            if (stream.skipName(name)) {
                found = true;
                break;
            }
            if (!stream.appendScope(scope)) {
                // the qualification has to directly precede the name
                scope.setLength(0);
                stream.bump();
            }
        }

        if (!found) {
            log.debug("Name '{}' not found in declarator tokens", spelling);
            return Optional.empty();
        }
        return scope.length() == 0 ? Optional.empty() : Optional.of(scope.toString());
    }

    /**
     * Strips a trailing template argument list, {@code Foo<int>} becomes {@code Foo}.
     */
    static String stripTemplateArguments(String spelling) {
        int pos = spelling.indexOf('<');
        // operator< and friends keep their spelling
        if (pos < 0 || spelling.startsWith("operator")) {
            return spelling;
        }
        return spelling.substring(0, pos);
    }

    /**
     * The tokens of an entity name with any template argument list removed.
     */
    static List<String> nameTokens(String spelling) {
        String name = stripTemplateArguments(spelling == null ? "" : spelling.trim());
        return SourceTokenizer.tokenize(name).stream()
                .map(Token::getSpelling)
                .collect(Collectors.toList());
    }
}
