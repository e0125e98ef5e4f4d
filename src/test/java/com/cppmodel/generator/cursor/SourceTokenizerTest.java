package com.cppmodel.generator.cursor;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SourceTokenizer.
 */
class SourceTokenizerTest {

    @Test
    void testClassifiesKeywordsIdentifiersAndPunctuation() {
        List<Token> tokens = SourceTokenizer.tokenize("virtual void A::draw() const;");

        assertThat(spellings(tokens)).containsExactly("virtual", "void", "A", "::", "draw", "(", ")", "const", ";");
        assertThat(tokens.get(0).getKind()).isEqualTo(TokenKind.KEYWORD);
        assertThat(tokens.get(2).getKind()).isEqualTo(TokenKind.IDENTIFIER);
        assertThat(tokens.get(3).getKind()).isEqualTo(TokenKind.PUNCTUATION);
    }

    @Test
    void testClosingTemplateBracketsAreSeparateTokens() {
        List<Token> tokens = SourceTokenizer.tokenize("std::vector<std::pair<int, int>> v");

        assertThat(spellings(tokens)).containsExactly(
                "std", "::", "vector", "<", "std", "::", "pair", "<", "int", ",", "int", ">", ">", "v");
    }

    @Test
    void testDropsCommentsAndPreprocessorLines() {
        String source = """
                #include <vector>
                int /* inline */ x; // trailing
                """;

        assertThat(spellings(SourceTokenizer.tokenize(source))).containsExactly("int", "x", ";");
    }

    @Test
    void testReadsLiterals() {
        List<Token> tokens = SourceTokenizer.tokenize("f(1.5e-3, 0x1p+4, u8\"text\", 'c', 1'000)");

        assertThat(tokens).filteredOn(t -> t.getKind() == TokenKind.LITERAL)
                .extracting(Token::getSpelling)
                .containsExactly("1.5e-3", "0x1p+4", "u8\"text\"", "'c'", "1'000");
    }

    @Test
    void testUserDefinedLiteralSuffixesBelongToTheLiteral() {
        List<Token> tokens = SourceTokenizer.tokenize("f(\"hello\"s, 123_km, 1.5_km, 'x'_c, u8\"a\"_u)");

        assertThat(tokens).filteredOn(t -> t.getKind() == TokenKind.LITERAL)
                .extracting(Token::getSpelling)
                .containsExactly("\"hello\"s", "123_km", "1.5_km", "'x'_c", "u8\"a\"_u");
        assertThat(tokens).filteredOn(t -> t.getKind() == TokenKind.IDENTIFIER)
                .extracting(Token::getSpelling)
                .containsExactly("f");
    }

    @Test
    void testLongestPunctuatorWins() {
        assertThat(spellings(SourceTokenizer.tokenize("a->b ... c<=>d"))).containsExactly(
                "a", "->", "b", "...", "c", "<=>", "d");
    }

    @ParameterizedTest
    @CsvSource({
            "class, KEYWORD",
            "constexpr, KEYWORD",
            "Widget, IDENTIFIER",
            "_value, IDENTIFIER",
            "42, LITERAL",
            "0x1F, LITERAL",
            "::, PUNCTUATION",
            "->*, PUNCTUATION"
    })
    void testSingleTokenKind(String spelling, TokenKind expected) {
        List<Token> tokens = SourceTokenizer.tokenize(spelling);

        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).getKind()).isEqualTo(expected);
        assertThat(tokens.get(0).getSpelling()).isEqualTo(spelling);
    }

    @Test
    void testEmptySourceHasNoTokens() {
        assertThat(SourceTokenizer.tokenize("")).isEmpty();
        assertThat(SourceTokenizer.tokenize(null)).isEmpty();
    }

    private static List<String> spellings(List<Token> tokens) {
        return tokens.stream().map(Token::getSpelling).collect(Collectors.toList());
    }
}
