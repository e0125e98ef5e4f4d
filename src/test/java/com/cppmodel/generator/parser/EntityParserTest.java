package com.cppmodel.generator.parser;

import org.junit.jupiter.api.Test;

import com.cppmodel.generator.cursor.recorded.CursorDumpParser;
import com.cppmodel.generator.cursor.recorded.RecordedTranslationUnit;
import com.cppmodel.generator.diagnostics.ToolDiagnostics;
import com.cppmodel.generator.model.ClassEntity;
import com.cppmodel.generator.model.Entity;
import com.cppmodel.generator.model.EntityIndex;
import com.cppmodel.generator.model.FileEntity;

import static com.cppmodel.generator.parser.ParserFixtures.*;
import static org.assertj.core.api.Assertions.*;

class EntityParserTest {

    @Test
    void testNonEntityCursorsAreSkipped() {
        String dump = """
            unexposed_decl `extern "C" {}`
            type_ref "Widget" `Widget`
            compound_stmt `{}`
            struct_decl "Kept" [definition] `struct Kept {};`
            friend_decl `friend class Nobody;`
            """;

        ParseResult result = parse(dump);

        assertThat(result.getFile().getChildren()).extracting(Entity::getName).containsExactly("Kept");
    }

    @Test
    void testFileEntityIsNamedAfterUnit() {
        ParseResult result = parse("""
            struct_decl "A" [definition] `struct A {};`
            """);
        FileEntity file = result.getFile();

        assertThat(file.getName()).isEqualTo("test");
        assertThat(file.treeSize()).isEqualTo(2);
        assertThat(result.getIndex().lookupFile("test")).containsSame(file);
        assertThat(result.getIndex().isSealed()).isTrue();
    }

    @Test
    void testUnitsShareIndex() {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        RecordedTranslationUnit header = CursorDumpParser.read("""
            class_decl "Widget" [id=c:@S@Widget] `class Widget`
            """, "header.cursors", diagnostics);
        RecordedTranslationUnit source = CursorDumpParser.read("""
            class_decl "Widget" [id=c:@S@Widget, definition] `class Widget {};`
            """, "source.cursors", diagnostics);

        EntityIndex index = new EntityIndex();
        TranslationUnitParser parser = new TranslationUnitParser(index);
        parser.parse(header.getName(), header.getRoot());
        ParseResult result = parser.parse(source.getName(), source.getRoot());
        index.seal();

        ClassEntity definition = (ClassEntity) result.getFile().getChildren().get(0);
        assertThat(index.lookupDefinition(definition.getId())).containsSame(definition);
        assertThat(index.lookupFile("header")).isPresent();
        assertThat(index.lookupFile("source")).isPresent();
    }

    @Test
    void testRootMustBeTranslationUnit() {
        RecordedTranslationUnit unit = CursorDumpParser.read("""
            translation_unit "x.cpp" {
                struct_decl "A" [definition] `struct A {};`
            }
            """, "x.cursors", new ToolDiagnostics());

        assertThatThrownBy(() -> TranslationUnitParser.parseStandalone("x", unit.getRoot().getChildren().get(0)))
                .isInstanceOf(ProviderContractException.class)
                .hasMessageContaining("translation unit");
    }
}
