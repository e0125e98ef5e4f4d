package com.cppmodel.generator.parser;

import java.util.List;
import java.util.Objects;

import com.cppmodel.generator.cursor.Token;
import com.cppmodel.generator.cursor.TokenKind;

/**
 * Cursor-local view over the tokens of a cursor's extent.
 *
 * Reading past the end yields an empty punctuation token, so lookahead
 * never throws.
 */
public class TokenStream {
    private static final Token END = Token.punctuation("");

    private final List<Token> tokens;
    private int pos;

    public TokenStream(List<Token> tokens) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
    }

    public boolean done() {
        return pos >= tokens.size();
    }

    public int position() {
        return pos;
    }

    public void reset(int position) {
        if (position < 0 || position > tokens.size()) {
            throw new IndexOutOfBoundsException("position " + position);
        }
        this.pos = position;
    }

    public Token peek() {
        return peek(0);
    }

    public Token peek(int offset) {
        int index = pos + offset;
        return index >= 0 && index < tokens.size() ? tokens.get(index) : END;
    }

    public boolean peekIs(String spelling) {
        return peek().getSpelling().equals(spelling);
    }

    public void bump() {
        if (!done()) {
            pos++;
        }
    }

    public Token get() {
        Token token = peek();
        bump();
        return token;
    }

    /**
     * Consumes the next token if it is spelled exactly {@code spelling}.
     */
    public boolean skipIf(String spelling) {
        if (!done() && peekIs(spelling)) {
            pos++;
            return true;
        }
        return false;
    }

    /**
     * Consumes the given spellings if the stream continues with exactly them.
     */
    public boolean skipIf(List<String> spellings) {
        if (spellings.isEmpty()) {
            return false;
        }
        for (int i = 0; i < spellings.size(); i++) {
            if (pos + i >= tokens.size() || !peek(i).getSpelling().equals(spellings.get(i))) {
                return false;
            }
        }
        pos += spellings.size();
        return true;
    }

    /**
     * Consumes {@code spelling}, which the provider guarantees to be next.
     *
     * @throws ProviderContractException if it is not
     */
    public void skip(String spelling) {
        if (!skipIf(spelling)) {
            throw new ProviderContractException("Expected '" + spelling + "' but found '" + peek().getSpelling()
                    + "'");
        }
    }

    /**
     * Skips a balanced bracket group starting at the current token, which must
     * be one of {@code ( [ { <}. Does nothing otherwise.
     *
     * @return whether a group was skipped
     */
    public boolean skipBrackets() {
        String open = peek().getSpelling();
        String close = closingBracket(open);
        if (close == null || done()) {
            return false;
        }
        int depth = 0;
        while (!done()) {
            String spelling = get().getSpelling();
            if (spelling.equals(open)) {
                depth++;
            } else if (spelling.equals(close)) {
                depth--;
                if (depth == 0) {
                    return true;
                }
            }
        }
        return true;
    }

    /**
     * Skips a sequence of attributes: {@code [[...]]}, {@code __attribute__((...))},
     * {@code __declspec(...)} and {@code alignas(...)}.
     *
     * @return whether anything was skipped
     */
    public boolean skipAttribute() {
        boolean skipped = false;
        while (!done()) {
            if (peekIs("[") && peek(1).getSpelling().equals("[")) {
                bump();
                skipBrackets();
                skipIf("]");
            } else if (peekIs("__attribute__") || peekIs("__declspec") || peekIs("alignas")) {
                bump();
                skipBrackets();
            } else {
                break;
            }
            skipped = true;
        }
        return skipped;
    }

    /**
     * Tries to consume one scope segment, an identifier with optional template
     * arguments followed by {@code ::}, and appends it to {@code scope}. The
     * stream is left untouched if no segment can be consumed.
     */
    public boolean appendScope(StringBuilder scope) {
        int start = pos;
        if (peek().getKind() != TokenKind.IDENTIFIER) {
            return false;
        }
        bump();
        if (peekIs("<")) {
            skipBrackets();
        }
        String segment = TokenSpelling.join(tokens.subList(start, pos));
        if (!skipIf("::")) {
            pos = start;
            return false;
        }
        if (scope.length() > 0) {
            scope.append("::");
        }
        scope.append(segment);
        return true;
    }

    /**
     * Consumes an entity name given as token spellings if it is next and does
     * not itself start a scope segment, as the class name does in
     * {@code Foo::Foo()}.
     */
    public boolean skipName(List<String> name) {
        int start = pos;
        if (!skipIf(name)) {
            return false;
        }
        int afterName = pos;
        if (peekIs("<")) {
            skipBrackets();
        }
        boolean scopeSegment = peekIs("::");
        pos = scopeSegment ? start : afterName;
        return !scopeSegment;
    }

    /**
     * Advances to just behind the first unqualified occurrence of {@code name}.
     * The position is left untouched if there is none.
     *
     * @return the index of the name's first token, or -1
     */
    public int seekName(List<String> name) {
        int start = pos;
        while (!done()) {
            int candidate = pos;
            if (skipName(name)) {
                return candidate;
            }
            bump();
        }
        pos = start;
        return -1;
    }

    /**
     * Spells the tokens from the current position up to the end.
     */
    public String remainder() {
        return TokenSpelling.join(tokens.subList(pos, tokens.size()));
    }

    /**
     * Spells the tokens from the current position up to, excluding, {@code end}.
     */
    public String spell(int end) {
        return TokenSpelling.join(tokens.subList(pos, Math.min(end, tokens.size())));
    }

    public List<Token> tokens() {
        return tokens;
    }

    private static String closingBracket(String open) {
        return switch (open) {
            case "(" -> ")";
            case "[" -> "]";
            case "{" -> "}";
            case "<" -> ">";
            default -> null;
        };
    }
}
