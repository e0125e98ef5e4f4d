package com.cppmodel.generator.cursor.recorded;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token of a recorded cursor dump.
 */
@Data
@AllArgsConstructor
public class CursorDumpToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;

    public enum TokenType {
        WORD,
        STRING,
        SOURCE,
        LBRACKET,
        RBRACKET,
        LBRACE,
        RBRACE,
        COMMA,
        EQUALS,
        EOF
    }
}
