package com.cppmodel.generator.cursor;

/**
 * Lexical class of a {@link Token}.
 */
public enum TokenKind {
    PUNCTUATION,
    KEYWORD,
    IDENTIFIER,
    LITERAL,
    COMMENT
}
