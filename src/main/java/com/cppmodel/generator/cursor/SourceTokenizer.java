package com.cppmodel.generator.cursor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits C++ source text into {@link Token}s the way the parse frontend
 * reports a cursor's extent: comments and preprocessor lines are dropped,
 * {@code >>} is reported as two {@code >} tokens so template argument lists
 * stay balanced.
 */
public class SourceTokenizer {

    private static final Set<String> KEYWORDS = Set.of(
            "alignas", "alignof", "auto", "bool", "break", "case", "catch", "char", "char8_t", "char16_t",
            "char32_t", "class", "const", "consteval", "constexpr", "constinit", "const_cast", "continue",
            "decltype", "default", "delete", "do", "double", "dynamic_cast", "else", "enum", "explicit",
            "export", "extern", "false", "final", "float", "for", "friend", "goto", "if", "inline", "int",
            "long", "mutable", "namespace", "new", "noexcept", "nullptr", "operator", "override", "private",
            "protected", "public", "register", "reinterpret_cast", "return", "short", "signed", "sizeof",
            "static", "static_assert", "static_cast", "struct", "switch", "template", "this", "thread_local",
            "throw", "true", "try", "typedef", "typeid", "typename", "union", "unsigned", "using", "virtual",
            "void", "volatile", "wchar_t", "while"
    );

    // longest first
    private static final List<String> PUNCTUATORS = List.of(
            "...", "<=>", "->*", "<<=",
            "::", "->", ".*", "++", "--", "<<", "<=", ">=", "==", "!=", "&&", "||",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "##"
    );

    private final String source;
    private int pos = 0;

    public SourceTokenizer(String source) {
        this.source = source != null ? source : "";
    }

    public static List<Token> tokenize(String source) {
        return new SourceTokenizer(source).tokenize();
    }

    public static boolean isKeyword(String spelling) {
        return KEYWORDS.contains(spelling);
    }

    /**
     * Tokenize the entire source text.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (pos < source.length()) {
            skipWhitespaceAndComments();

            if (pos >= source.length()) {
                break;
            }

            tokens.add(nextToken());
        }

        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (Character.isWhitespace(c)) {
                pos++;
            } else if (source.startsWith("//", pos) || (c == '#' && atLineStart())) {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (source.startsWith("/*", pos)) {
                int end = source.indexOf("*/", pos + 2);
                pos = end < 0 ? source.length() : end + 2;
            } else {
                break;
            }
        }
    }

    private boolean atLineStart() {
        for (int i = pos - 1; i >= 0; i--) {
            char c = source.charAt(i);
            if (c == '\n') {
                return true;
            }
            if (!Character.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }

    private Token nextToken() {
        char c = source.charAt(pos);

        if (c == '"' || c == '\'') {
            return readQuoted(pos, c);
        }

        if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length()
                && Character.isDigit(source.charAt(pos + 1)))) {
            return readNumber();
        }

        if (Character.isLetter(c) || c == '_') {
            return readIdentifierOrKeyword();
        }

        for (String punctuator : PUNCTUATORS) {
            if (source.startsWith(punctuator, pos)) {
                pos += punctuator.length();
                return Token.punctuation(punctuator);
            }
        }

        pos++;
        return Token.punctuation(String.valueOf(c));
    }

    private Token readQuoted(int start, char quote) {
        pos++; // Skip opening quote

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                pos += 2;
            } else if (c == quote) {
                pos++;
                skipSuffix();
                break;
            } else if (c == '\n') {
                break; // Unterminated literal
            } else {
                pos++;
            }
        }

        pos = Math.min(pos, source.length());
        return Token.literal(source.substring(start, pos));
    }

    private Token readNumber() {
        int start = pos;

        while (pos < source.length()) {
            char c = source.charAt(pos);
            boolean exponentSign = (c == '+' || c == '-') && pos > start && isExponentMarker(start, pos - 1);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '\'' || exponentSign) {
                pos++;
            } else {
                break;
            }
        }

        return Token.literal(source.substring(start, pos));
    }

    /**
     * User-defined literal suffix directly after a closing quote, {@code "text"s}.
     */
    private void skipSuffix() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_') {
                pos++;
            } else {
                break;
            }
        }
    }

    private boolean isExponentMarker(int start, int index) {
        char marker = source.charAt(index);
        boolean hex = source.regionMatches(true, start, "0x", 0, 2);
        return hex ? (marker == 'p' || marker == 'P') : (marker == 'e' || marker == 'E');
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_') {
                pos++;
            } else {
                break;
            }
        }

        String value = source.substring(start, pos);

        // Encoding prefixes of string and character literals, e.g. u8"text"
        if (pos < source.length() && (source.charAt(pos) == '"' || source.charAt(pos) == '\'')
                && Set.of("L", "u", "U", "u8", "R").contains(value)) {
            return readQuoted(start, source.charAt(pos));
        }

        return KEYWORDS.contains(value) ? Token.keyword(value) : Token.identifier(value);
    }
}
