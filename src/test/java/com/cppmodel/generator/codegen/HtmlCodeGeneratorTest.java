package com.cppmodel.generator.codegen;

import org.junit.jupiter.api.Test;

import com.cppmodel.generator.cursor.recorded.CursorDumpParser;
import com.cppmodel.generator.cursor.recorded.RecordedTranslationUnit;
import com.cppmodel.generator.diagnostics.ToolDiagnostics;
import com.cppmodel.generator.model.EntityId;
import com.cppmodel.generator.model.EntityIndex;
import com.cppmodel.generator.model.FileEntity;
import com.cppmodel.generator.parser.ParseResult;
import com.cppmodel.generator.parser.TranslationUnitParser;

import static com.cppmodel.generator.codegen.CodegenFixtures.*;
import static org.assertj.core.api.Assertions.*;

class HtmlCodeGeneratorTest {

    private static String renderHtml(String dump, SynopsisPolicy policy) {
        ParseResult result = parse(dump, "test.cursors");
        return renderHtml(result.getFile(), result.getIndex(), policy);
    }

    private static String renderHtml(FileEntity file, EntityIndex index, SynopsisPolicy policy) {
        HtmlCodeGenerator generator = new HtmlCodeGenerator(4, policy, index);
        CodeGeneration.generate(generator, file);
        return generator.getResult();
    }

    private static FileEntity parseInto(TranslationUnitParser parser, String dump, String fileName) {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        RecordedTranslationUnit unit = CursorDumpParser.read(dump, fileName, diagnostics);
        assertThat(diagnostics.getErrors()).isEmpty();
        return parser.parse(unit.getName(), unit.getRoot()).getFile();
    }

    @Test
    void testTokensAreHighlightedAndEscaped() {
        String dump = """
            class_template "Box" [definition] `template <typename T> class Box { T value; };` {
                template_type_parameter "T" `typename T`
                field_decl "value" [type=T] `T value`
            }
            """;

        String html = renderHtml(dump, SynopsisPolicy.definitions());

        assertThat(html).contains("<span class=\"kw\">template</span><span class=\"pn\">&lt;</span>");
        assertThat(html).contains("<span class=\"kw\">typename</span> <span class=\"id\">T</span>");
        assertThat(html).contains("<span class=\"pn\">&gt;</span>\n");
        assertThat(html).doesNotContain("<span class=\"pn\"><</span>");
    }

    @Test
    void testReferencesLinkToAnchors() {
        String dump = """
            struct_decl "Base" [id=c:@S@Base, definition] `struct Base {};`
            class_decl "Widget" [id=c:@S@Widget, definition] `class Widget : public Base {};` {
                cxx_base_specifier "Base" [access=public, type_decl=c:@S@Base] `public Base`
            }
            """;

        String html = renderHtml(dump, SynopsisPolicy.definitions());

        assertThat(html).contains("<a id=\"c:_40_S_40_Base\"></a>");
        assertThat(html).contains("<a id=\"c:_40_S_40_Widget\"></a>");
        assertThat(html).contains("<a class=\"ref\" href=\"#c:_40_S_40_Base\">Base</a>");
    }

    @Test
    void testLiteralClasses() {
        String dump = """
            var_decl "ratio" [type=double, definition] `double ratio = 1.5`
            var_decl "count" [type=int, definition] `int count = 0x10`
            var_decl "name" [type="const char *", definition] `const char* name = "a&b"`
            """;

        String html = renderHtml(dump, SynopsisPolicy.definitions());

        assertThat(html).contains("<span class=\"num\">1.5</span>");
        assertThat(html).contains("<span class=\"num\">0x10</span>");
        assertThat(html).contains("<span class=\"str\">&quot;a&amp;b&quot;</span>");
    }

    @Test
    void testUserDefinedLiteralClasses() {
        String dump = """
            var_decl "greeting" [type="std::string", definition] `std::string greeting = "hello"s`
            var_decl "distance" [type=long, definition] `long distance = 123_km`
            var_decl "span" [type=double, definition] `double span = 1.5_km`
            """;

        String html = renderHtml(dump, SynopsisPolicy.definitions());

        assertThat(html).contains("<span class=\"str\">&quot;hello&quot;s</span>");
        assertThat(html).contains("<span class=\"num\">123_km</span>");
        assertThat(html).contains("<span class=\"num\">1.5_km</span>");
    }

    @Test
    void testUnresolvedReferenceIsPlainIdentifier() {
        String dump = """
            function_decl "use" [id=c:@F@use#, result=void] `void use(std::string s)` {
                parm_decl "s" [type="std::string", type_decl=c:@N@std@S@string] `std::string s`
            }
            """;

        String html = renderHtml(dump, SynopsisPolicy.definitions());

        assertThat(html).contains("<span class=\"id\">std::string</span> <span class=\"id\">s</span>");
        assertThat(html).doesNotContain("href=");
    }

    @Test
    void testReferenceToOtherUnitLinksToItsPage() {
        EntityIndex index = new EntityIndex();
        TranslationUnitParser parser = new TranslationUnitParser(index);
        FileEntity widget = parseInto(parser, """
            class_decl "Widget" [id=c:@S@Widget, definition] `class Widget {};`
            """, "widget.cursors");
        FileEntity main = parseInto(parser, """
            function_decl "use" [id=c:@F@use#, result=void, definition] `void use(Widget w) {}` {
                parm_decl "w" [type=Widget, type_decl=c:@S@Widget] `Widget w`
            }
            """, "main.cursors");
        index.seal();

        String mainHtml = renderHtml(main, index, SynopsisPolicy.definitions());
        String widgetHtml = renderHtml(widget, index, SynopsisPolicy.definitions());

        assertThat(mainHtml).contains("<a class=\"ref\" href=\"widget.html#c:_40_S_40_Widget\">Widget</a>");
        assertThat(widgetHtml).contains("<a id=\"c:_40_S_40_Widget\"></a>");
        assertThat(HtmlCodeGenerator.pageName(widget)).isEqualTo("widget.html");
    }

    @Test
    void testReferenceToExcludedTargetIsNotLinked() {
        String dump = """
            class_decl "Outer" [id=c:@S@Outer, definition] `class Outer { struct Hidden {}; public: void take(Hidden h); };` {
                struct_decl "Hidden" [id=c:@S@Outer@S@Hidden, definition] `struct Hidden {}`
                cxx_access_specifier [access=public] `public:`
                cxx_method "take" [id=c:@S@Outer@F@take#, result=void] `void take(Hidden h)` {
                    parm_decl "h" [type="Outer::Hidden", type_decl=c:@S@Outer@S@Hidden] `Hidden h`
                }
            }
            """;

        String linked = renderHtml(dump, SynopsisPolicy.definitions());
        String excluded = renderHtml(dump, SynopsisPolicy.builder().excludePrivate(true).build());
        String declarations = renderHtml(dump, SynopsisPolicy.builder().mode(SynopsisMode.DECLARATION).build());

        assertThat(linked).contains("href=\"#c:_40_S_40_Outer_40_S_40_Hidden\"");
        assertThat(excluded).doesNotContain("href=");
        assertThat(excluded).contains("<span class=\"id\">Outer::Hidden</span>");
        assertThat(declarations).doesNotContain("href=");
    }

    @Test
    void testAnchorWrittenOncePerIdentity() {
        String dump = """
            namespace "app" [id=c:@N@app] `namespace app { int a; }` {
                var_decl "a" [type=int, definition] `int a`
            }
            namespace "app" [id=c:@N@app] `namespace app { int b; }` {
                var_decl "b" [type=int, definition] `int b`
            }
            """;

        String html = renderHtml(dump, SynopsisPolicy.definitions());

        String anchor = "<a id=\"c:_40_N_40_app\"></a>";
        assertThat(html.indexOf(anchor)).isGreaterThanOrEqualTo(0);
        assertThat(html.indexOf(anchor)).isEqualTo(html.lastIndexOf(anchor));
    }

    @Test
    void testExcludedEntitiesHaveNoAnchor() {
        String dump = """
            class_decl "Vault" [id=c:@S@Vault, definition] `class Vault { int secret; };` {
                field_decl "secret" [id=c:@S@Vault@FI@secret, type=int] `int secret`
            }
            """;

        String html = renderHtml(dump, SynopsisPolicy.builder().excludePrivate(true).build());

        assertThat(html).contains("<a id=\"c:_40_S_40_Vault\"></a>");
        assertThat(html).doesNotContain("secret");
    }

    @Test
    void testAnchorName() {
        assertThat(HtmlCodeGenerator.anchorName(EntityId.of("c:@S@Widget#I#")))
                .isEqualTo("c:_40_S_40_Widget_23_I_23_");
        assertThat(HtmlCodeGenerator.anchorName(EntityId.of("file:unit-1.x"))).isEqualTo("file:unit-1.x");
    }

    @Test
    void testEscapeHtml() {
        assertThat(HtmlCodeGenerator.escapeHtml("<a href='x'>&\"")).isEqualTo("&lt;a href=&#39;x&#39;&gt;&amp;&quot;");
    }
}
