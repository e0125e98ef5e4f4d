package com.cppmodel.generator.parser;

import java.util.List;

import com.cppmodel.generator.cursor.Token;

/**
 * Spells token sequences back into source text with minimal whitespace.
 */
public final class TokenSpelling {

    private TokenSpelling() {
        // Utility class
    }

    /**
     * Joins tokens, inserting a single space between two word-like tokens,
     * after commas and between a closing {@code >} and a word.
     */
    public static String join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token previous = null;
        for (Token token : tokens) {
            if (previous != null && needsSpace(previous, token)) {
                sb.append(' ');
            }
            sb.append(token.getSpelling());
            previous = token;
        }
        return sb.toString();
    }

    /**
     * Whether {@code next} is separated from {@code previous} by a space.
     */
    public static boolean needsSpace(Token previous, Token next) {
        if (previous.isWordLike() && next.isWordLike()) {
            return true;
        }
        String spelling = previous.getSpelling();
        return spelling.equals(",") || (spelling.equals(">") && next.isWordLike());
    }
}
