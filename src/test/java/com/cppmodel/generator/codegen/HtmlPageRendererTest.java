package com.cppmodel.generator.codegen;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class HtmlPageRendererTest {

    @Test
    void testTitleIsEscapedAndBodyIsNot() throws IOException {
        String page = new HtmlPageRenderer().render("a<b", "<span class=\"kw\">int</span>");

        assertThat(page).startsWith("<!DOCTYPE html>");
        assertThat(page).contains("<title>a&lt;b</title>");
        assertThat(page).contains("<h1>a&lt;b</h1>");
        assertThat(page).contains("<pre><code><span class=\"kw\">int</span></code></pre>");
    }
}
