package com.cppmodel.generator.cursor;

import lombok.Value;

/**
 * A single source token covered by a cursor's extent.
 */
@Value
public class Token {
    TokenKind kind;
    String spelling;

    public static Token punctuation(String spelling) {
        return new Token(TokenKind.PUNCTUATION, spelling);
    }

    public static Token keyword(String spelling) {
        return new Token(TokenKind.KEYWORD, spelling);
    }

    public static Token identifier(String spelling) {
        return new Token(TokenKind.IDENTIFIER, spelling);
    }

    public static Token literal(String spelling) {
        return new Token(TokenKind.LITERAL, spelling);
    }

    /**
     * Whether the token starts or ends with an identifier character,
     * i.e. needs a separating space next to another word-like token.
     */
    public boolean isWordLike() {
        return kind == TokenKind.KEYWORD || kind == TokenKind.IDENTIFIER || kind == TokenKind.LITERAL;
    }

    @Override
    public String toString() {
        return spelling;
    }
}
