package com.cppmodel.generator.parser;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.cppmodel.generator.cursor.SourceTokenizer;

import static org.assertj.core.api.Assertions.*;

class TokenStreamTest {

    private static TokenStream stream(String source) {
        return new TokenStream(SourceTokenizer.tokenize(source));
    }

    @Test
    void testReadingPastEndYieldsEmptyToken() {
        TokenStream tokens = stream("a");

        assertThat(tokens.get().getSpelling()).isEqualTo("a");
        assertThat(tokens.done()).isTrue();
        assertThat(tokens.peek().getSpelling()).isEmpty();
        assertThat(tokens.peek(5).getSpelling()).isEmpty();
        assertThat(tokens.skipIf("a")).isFalse();
    }

    @Test
    void testSkipIfSequenceIsAllOrNothing() {
        TokenStream tokens = stream("= default ;");

        assertThat(tokens.skipIf(List.of("=", "delete"))).isFalse();
        assertThat(tokens.position()).isZero();
        assertThat(tokens.skipIf(List.of("=", "default"))).isTrue();
        assertThat(tokens.peekIs(";")).isTrue();
    }

    @Test
    void testSkipViolatingContractThrows() {
        TokenStream tokens = stream("class A");

        assertThatThrownBy(() -> tokens.skip("struct"))
                .isInstanceOf(ProviderContractException.class)
                .hasMessageContaining("'struct'")
                .hasMessageContaining("'class'");
    }

    @Test
    void testSkipBracketsNested() {
        TokenStream tokens = stream("(a, (b), c) const");

        assertThat(tokens.skipBrackets()).isTrue();
        assertThat(tokens.peekIs("const")).isTrue();
        assertThat(tokens.skipBrackets()).isFalse();
    }

    @Test
    void testSkipAttributes() {
        TokenStream tokens = stream("[[nodiscard]] __attribute__((packed)) alignas(16) int value");

        assertThat(tokens.skipAttribute()).isTrue();
        assertThat(tokens.peekIs("int")).isTrue();
        assertThat(tokens.skipAttribute()).isFalse();
    }

    @Test
    void testAppendScopeWithTemplateArguments() {
        TokenStream tokens = stream("Outer<int>::Inner::value x");
        StringBuilder scope = new StringBuilder();

        assertThat(tokens.appendScope(scope)).isTrue();
        assertThat(tokens.appendScope(scope)).isTrue();
        assertThat(scope).hasToString("Outer<int>::Inner");

        int before = tokens.position();
        assertThat(tokens.appendScope(scope)).isFalse();
        assertThat(tokens.position()).isEqualTo(before);
        assertThat(tokens.peekIs("value")).isTrue();
    }

    @Test
    void testSkipNameRejectsScopeSegment() {
        TokenStream tokens = stream("Foo :: Foo ( )");

        assertThat(tokens.skipName(List.of("Foo"))).isFalse();
        assertThat(tokens.position()).isZero();

        assertThat(tokens.seekName(List.of("Foo"))).isEqualTo(2);
        assertThat(tokens.peekIs("(")).isTrue();
    }

    @Test
    void testSeekNameMissingLeavesPosition() {
        TokenStream tokens = stream("int bar ( )");
        tokens.bump();

        assertThat(tokens.seekName(List.of("foo"))).isEqualTo(-1);
        assertThat(tokens.position()).isEqualTo(1);
    }

    @Test
    void testOperatorNameIsMatchedAsTokens() {
        TokenStream tokens = stream("bool operator == (const A &) const");

        assertThat(tokens.seekName(List.of("operator", "=="))).isEqualTo(1);
        assertThat(tokens.peekIs("(")).isTrue();
    }

    @Test
    void testRemainderSpelling() {
        TokenStream tokens = stream("std::map<int, std::string> values");

        assertThat(tokens.remainder()).isEqualTo("std::map<int, std::string> values");
    }
}
