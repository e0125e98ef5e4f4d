package com.cppmodel.generator.codegen;

import org.junit.jupiter.api.Test;

import com.cppmodel.generator.model.ClassEntity;
import com.cppmodel.generator.model.FileEntity;

import static com.cppmodel.generator.codegen.CodegenFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Rendering of each entity kind through the plain text backend.
 */
class EntityCodeWriterTest {

    private static final String WIDGET = """
        class_decl "Widget" [id=c:@S@Widget, definition] `class Widget : public Base { public: Widget(); private: int size_; };` {
            cxx_base_specifier "Base" [access=public, type_decl=c:@S@Base] `public Base`
            cxx_access_specifier [access=public] `public:`
            constructor "Widget" `Widget()`
            cxx_access_specifier [access=private] `private:`
            field_decl "size_" [type=int] `int size_`
        }
        """;

    @Test
    void testStructWithFields() {
        FileEntity file = file("""
            struct_decl "Point" [definition] `struct Point { int x; int y = 0; };` {
                field_decl "x" [type=int] `int x`
                field_decl "y" [type=int] `int y = 0`
            }
            """);

        assertThat(TextCodeGenerator.render(file)).isEqualTo("struct Point\n{\n    int x;\n    int y = 0;\n};\n");
    }

    @Test
    void testClassWithBaseAndAccessLabels() {
        String expected = """
            class Widget : public Base
            {
            public:
                Widget();
            private:
                int size_;
            };
            """;

        assertThat(TextCodeGenerator.render(file(WIDGET))).isEqualTo(expected);
    }

    @Test
    void testExcludePrivateMembers() {
        SynopsisPolicy policy = SynopsisPolicy.builder().excludePrivate(true).build();

        assertThat(render(file(WIDGET), policy))
                .isEqualTo("class Widget : public Base\n{\npublic:\n    Widget();\n};\n");
    }

    @Test
    void testDeclarationMode() {
        SynopsisPolicy policy = SynopsisPolicy.builder().mode(SynopsisMode.DECLARATION).build();

        assertThat(render(file(WIDGET), policy)).isEqualTo("class Widget;\n");
    }

    @Test
    void testNamespaceWithFunction() {
        FileEntity file = file("""
            namespace "ns" [id=c:@N@ns] `namespace ns { void f() {} }` {
                function_decl "f" [id=c:@N@ns@F@f#, result=void, definition] `void f() {}`
            }
            """);

        assertThat(TextCodeGenerator.render(file)).isEqualTo("namespace ns\n{\n    void f() {}\n}\n");
    }

    @Test
    void testEmptyAndInlineNamespaces() {
        FileEntity file = file("""
            namespace "detail" `namespace detail {}`
            namespace "v1" `inline namespace v1 {}`
            """);

        assertThat(TextCodeGenerator.render(file)).isEqualTo("namespace detail {}\ninline namespace v1 {}\n");
    }

    @Test
    void testNamespaceInDeclarationModeKeepsContents() {
        FileEntity file = file("""
            namespace "ns" `namespace ns { void f() {} }` {
                function_decl "f" [result=void, definition] `void f() {}`
            }
            """);
        SynopsisPolicy policy = SynopsisPolicy.builder().mode(SynopsisMode.DECLARATION).build();

        assertThat(render(file, policy)).isEqualTo("namespace ns\n{\n    void f();\n}\n");
    }

    @Test
    void testClassTemplate() {
        FileEntity file = file("""
            class_template "Box" [definition] `template <typename T> class Box { T value; };` {
                template_type_parameter "T" `typename T`
                field_decl "value" [type=T] `T value`
            }
            """);

        assertThat(TextCodeGenerator.render(file)).isEqualTo("template<typename T>\nclass Box\n{\n    T value;\n};\n");
    }

    @Test
    void testOutOfLineDefinitionIsQualified() {
        FileEntity file = file("""
            namespace "A" [id=c:@N@A] `namespace A { struct B { void foo(int); }; }` {
                struct_decl "B" [id=c:@N@A@S@B, definition] `struct B { void foo(int); }` {
                    cxx_method "foo" [id=c:@N@A@S@B@F@foo#I#, result=void] `void foo(int)` {
                        parm_decl [type=int] `int`
                    }
                }
            }
            cxx_method "foo" [id=c:@N@A@S@B@F@foo#I#, semantic_parent=c:@N@A@S@B, result=void, definition] `void A::B::foo(int) {}` {
                parm_decl [type=int] `int`
            }
            """);

        assertThat(TextCodeGenerator.render(file.getChildren().get(1))).isEqualTo("void A::B::foo(int) {}\n");
    }

    @Test
    void testScopedEnum() {
        FileEntity file = file("""
            enum_decl "Color" [underlying="unsigned char", definition] `enum class Color : unsigned char { Red, Green = 2 }` {
                enum_constant_decl "Red" `Red`
                enum_constant_decl "Green" `Green = 2`
            }
            """);

        assertThat(TextCodeGenerator.render(file))
                .isEqualTo("enum class Color : unsigned char\n{\n    Red,\n    Green = 2,\n};\n");
    }

    @Test
    void testAliases() {
        FileEntity file = file("""
            type_alias_decl "Size" [underlying="unsigned long"] `using Size = unsigned long`
            typedef_decl "Byte" [underlying="unsigned char"] `typedef unsigned char Byte`
            """);

        assertThat(TextCodeGenerator.render(file.getChildren().get(0))).isEqualTo("using Size = unsigned long;\n");
        assertThat(TextCodeGenerator.render(file.getChildren().get(1))).isEqualTo("typedef unsigned char Byte;\n");
    }

    @Test
    void testFunctionSpecifiersAndBodies() {
        FileEntity file = file("""
            class_decl "Shape" [definition] `class Shape { public: virtual void draw() const = 0; Shape(const Shape&) = delete; };` {
                cxx_access_specifier [access=public] `public:`
                cxx_method "draw" [result=void] `virtual void draw() const = 0`
                constructor "Shape" `Shape(const Shape& other) = delete` {
                    parm_decl "other" [type="const Shape &"] `const Shape& other`
                }
            }
            """);
        ClassEntity shape = (ClassEntity) file.getChildren().get(0);

        assertThat(TextCodeGenerator.render(shape.getChildren().get(1))).isEqualTo("virtual void draw() const = 0;\n");
        assertThat(TextCodeGenerator.render(shape.getChildren().get(2)))
                .isEqualTo("Shape(const Shape& other) = delete;\n");
    }

    @Test
    void testVariadicAndDefaultArguments() {
        FileEntity file = file("""
            function_decl "printf" [result=int] `int printf(const char* format, ...)` {
                parm_decl "format" [type="const char *"] `const char* format`
            }
            function_decl "scale" [result=int] `int scale(int factor = 42)` {
                parm_decl "factor" [type=int] `int factor = 42`
            }
            """);

        assertThat(TextCodeGenerator.render(file)).isEqualTo("int printf(const char* format, ...);\nint scale(int factor = 42);\n");
    }

    @Test
    void testVariableInitializers() {
        FileEntity file = file("""
            var_decl "limit" [type=int, definition] `static constexpr int limit = 10`
            var_decl "x" [type=int, definition] `int x{5}`
            var_decl "name" [type="const char *", definition] `const char* name = "box"`
            """);

        assertThat(TextCodeGenerator.render(file))
                .isEqualTo("static constexpr int limit = 10;\nint x{5};\nconst char* name = \"box\";\n");
    }

    @Test
    void testUserDefinedLiteralsStayWhole() {
        FileEntity file = file("""
            var_decl "greeting" [type="std::string", definition] `std::string greeting = "hello"s`
            var_decl "distance" [type=long, definition] `long distance = 123_km`
            """);

        assertThat(TextCodeGenerator.render(file))
                .isEqualTo("std::string greeting = \"hello\"s;\nlong distance = 123_km;\n");
    }

    @Test
    void testOutOfLineMemberOfClassTemplate() {
        FileEntity file = file("""
            class_template "Box" [id=c:@ST>1#T@Box, definition] `template <typename T> class Box { void put(T value); };` {
                template_type_parameter "T" `typename T`
                cxx_method "put" [id=c:@ST>1#T@Box@F@put#t0.0#, result=void] `void put(T value)` {
                    parm_decl "value" [type=T] `T value`
                }
            }
            cxx_method "put" [id=c:@ST>1#T@Box@F@put#t0.0#, semantic_parent=c:@ST>1#T@Box, result=void, definition] `template <typename T> void Box<T>::put(T value) {}` {
                parm_decl "value" [type=T] `T value`
            }
            cxx_method "put" [id=c:@S@Box>#I@F@put#I#, semantic_parent=c:@ST>1#T@Box, result=void, definition] `template <> void Box<int>::put(int value) {}` {
                parm_decl "value" [type=int] `int value`
            }
            """);

        assertThat(TextCodeGenerator.render(file.getChildren().get(1)))
                .isEqualTo("template<typename T>\nvoid Box<T>::put(T value) {}\n");
        assertThat(TextCodeGenerator.render(file.getChildren().get(2)))
                .isEqualTo("template<>\nvoid Box<int>::put(int value) {}\n");
    }

    @Test
    void testFriendDeclaration() {
        FileEntity file = file("""
            class_decl "Host" [definition] `class Host { friend class Guest; };` {
                friend_decl `friend class Guest;` {
                    class_decl "Guest" `class Guest`
                }
            }
            """);

        assertThat(TextCodeGenerator.render(file)).isEqualTo("class Host\n{\n    friend class Guest;\n};\n");
    }

    @Test
    void testRenderingIsRepeatable() {
        FileEntity file = file(WIDGET);

        assertThat(TextCodeGenerator.render(file)).isEqualTo(TextCodeGenerator.render(file));
    }
}
