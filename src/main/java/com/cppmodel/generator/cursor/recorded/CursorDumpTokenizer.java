package com.cppmodel.generator.cursor.recorded;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppmodel.generator.cursor.recorded.CursorDumpToken.TokenType;

/**
 * Tokenizer for recorded cursor dumps.
 *
 * Words run up to whitespace or a structural character, so identities such
 * as {@code c:@N@app@S@Widget#I#} need no quoting. {@code #} starts a
 * comment only at the beginning of a token. Source text between backticks is
 * taken verbatim and may span lines.
 */
public class CursorDumpTokenizer {
    private static final Logger log = LoggerFactory.getLogger(CursorDumpTokenizer.class);

    private static final String STRUCTURAL = "[]{},=\"`";

    private final String source;
    private final String fileName;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public CursorDumpTokenizer(String source, String fileName) {
        this.source = source != null ? source.replace("\r\n", "\n") : "";
        this.fileName = fileName;
    }

    /**
     * Tokenize the entire dump.
     *
     * @throws DumpParseException for unterminated strings and source blocks
     */
    public List<CursorDumpToken> tokenize() {
        List<CursorDumpToken> tokens = new ArrayList<>();

        while (pos < source.length()) {
            skipWhitespaceAndComments();

            if (pos >= source.length()) {
                break;
            }

            tokens.add(nextToken());
        }

        tokens.add(new CursorDumpToken(TokenType.EOF, "", line, column));
        log.debug("Tokenized {} into {} tokens", fileName, tokens.size());
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '#') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private CursorDumpToken nextToken() {
        int startLine = line;
        int startColumn = column;
        char c = source.charAt(pos);

        switch (c) {
            case '[':
                advance();
                return new CursorDumpToken(TokenType.LBRACKET, "[", startLine, startColumn);
            case ']':
                advance();
                return new CursorDumpToken(TokenType.RBRACKET, "]", startLine, startColumn);
            case '{':
                advance();
                return new CursorDumpToken(TokenType.LBRACE, "{", startLine, startColumn);
            case '}':
                advance();
                return new CursorDumpToken(TokenType.RBRACE, "}", startLine, startColumn);
            case ',':
                advance();
                return new CursorDumpToken(TokenType.COMMA, ",", startLine, startColumn);
            case '=':
                advance();
                return new CursorDumpToken(TokenType.EQUALS, "=", startLine, startColumn);
            case '"':
                return readString(startLine, startColumn);
            case '`':
                return readSource(startLine, startColumn);
            default:
                return readWord(startLine, startColumn);
        }
    }

    private CursorDumpToken readString(int startLine, int startColumn) {
        advance(); // Skip opening quote
        StringBuilder sb = new StringBuilder();

        while (pos < source.length() && source.charAt(pos) != '"') {
            char c = source.charAt(pos);
            if (c == '\n') {
                throw new DumpParseException("Unterminated string in " + fileName, startLine);
            }
            if (c == '\\' && pos + 1 < source.length()) {
                advance();
                c = source.charAt(pos);
            }
            sb.append(c);
            advance();
        }

        if (pos >= source.length()) {
            throw new DumpParseException("Unterminated string in " + fileName, startLine);
        }
        advance(); // Skip closing quote
        return new CursorDumpToken(TokenType.STRING, sb.toString(), startLine, startColumn);
    }

    private CursorDumpToken readSource(int startLine, int startColumn) {
        advance(); // Skip opening backtick
        int end = source.indexOf('`', pos);
        if (end < 0) {
            throw new DumpParseException("Unterminated source block in " + fileName, startLine);
        }

        String text = source.substring(pos, end);
        while (pos <= end) {
            advance();
        }
        return new CursorDumpToken(TokenType.SOURCE, text, startLine, startColumn);
    }

    private CursorDumpToken readWord(int startLine, int startColumn) {
        int start = pos;

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c) || STRUCTURAL.indexOf(c) >= 0) {
                break;
            }
            advance();
        }

        return new CursorDumpToken(TokenType.WORD, source.substring(start, pos), startLine, startColumn);
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }
}
