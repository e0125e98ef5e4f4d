package com.cppmodel.generator.parser;

import org.junit.jupiter.api.Test;

import com.cppmodel.generator.model.ClassEntity;
import com.cppmodel.generator.model.CppTypeKind;
import com.cppmodel.generator.model.Entity;
import com.cppmodel.generator.model.EntityId;
import com.cppmodel.generator.model.EntityRef;
import com.cppmodel.generator.model.FunctionBodyKind;
import com.cppmodel.generator.model.FunctionEntity;
import com.cppmodel.generator.model.FunctionKind;
import com.cppmodel.generator.model.FunctionParameterEntity;
import com.cppmodel.generator.model.FunctionSpecifier;
import com.cppmodel.generator.model.TemplateParameter;
import com.cppmodel.generator.model.TemplateParameterKind;

import static com.cppmodel.generator.parser.ParserFixtures.*;
import static org.assertj.core.api.Assertions.*;

class FunctionParserTest {

    private static FunctionEntity member(String dump, int index) {
        ClassEntity owner = first(dump, ClassEntity.class);
        Entity entity = owner.getChildren().get(index);
        assertThat(entity).isInstanceOf(FunctionEntity.class);
        return (FunctionEntity) entity;
    }

    @Test
    void testPureVirtualConstMember() {
        String dump = """
            class_decl "Shape" [definition] `class Shape { public: virtual void draw() const = 0; };` {
                cxx_access_specifier [access=public] `public:`
                cxx_method "draw" [result=void] `virtual void draw() const = 0`
            }
            """;

        FunctionEntity draw = member(dump, 1);

        assertThat(draw.getFunctionKind()).isEqualTo(FunctionKind.MEMBER);
        assertThat(draw.getSpecifiers()).containsExactlyInAnyOrder(FunctionSpecifier.VIRTUAL, FunctionSpecifier.CONST);
        assertThat(draw.getBodyKind()).isEqualTo(FunctionBodyKind.PURE_VIRTUAL);
        assertThat(draw.getReturnType()).hasValueSatisfying(type -> {
            assertThat(type.getKind()).isEqualTo(CppTypeKind.BUILTIN);
            assertThat(type.getSpelling()).isEqualTo("void");
        });
        assertThat(draw.isDefinition()).isFalse();
    }

    @Test
    void testSpecialMembers() {
        String dump = """
            struct_decl "Widget" [definition] `struct Widget { Widget() = default; Widget(const Widget&) = delete; virtual ~Widget() noexcept; };` {
                constructor "Widget" `Widget() = default`
                constructor "Widget" `Widget(const Widget& other) = delete` {
                    parm_decl "other" [type="const Widget &"] `const Widget& other`
                }
                destructor "~Widget" [result=void] `virtual ~Widget() noexcept`
            }
            """;

        FunctionEntity ctor = member(dump, 0);
        FunctionEntity copy = member(dump, 1);
        FunctionEntity dtor = member(dump, 2);

        assertThat(ctor.getFunctionKind()).isEqualTo(FunctionKind.CONSTRUCTOR);
        assertThat(ctor.getReturnType()).isEmpty();
        assertThat(ctor.getBodyKind()).isEqualTo(FunctionBodyKind.DEFAULTED);

        assertThat(copy.getBodyKind()).isEqualTo(FunctionBodyKind.DELETED);
        assertThat(copy.getParameters()).extracting(FunctionParameterEntity::getName).containsExactly("other");

        assertThat(dtor.getFunctionKind()).isEqualTo(FunctionKind.DESTRUCTOR);
        assertThat(dtor.getReturnType()).isEmpty();
        assertThat(dtor.getSpecifiers()).containsExactlyInAnyOrder(FunctionSpecifier.VIRTUAL,
                FunctionSpecifier.NOEXCEPT);
        assertThat(dtor.getBodyKind()).isEqualTo(FunctionBodyKind.DECLARATION);
    }

    @Test
    void testCVariadicFunction() {
        String dump = """
            function_decl "printf" [result=int] `int printf(const char* format, ...)` {
                parm_decl "format" [type="const char *"] `const char* format`
            }
            """;

        FunctionEntity printf = first(dump, FunctionEntity.class);

        assertThat(printf.getFunctionKind()).isEqualTo(FunctionKind.FREE);
        assertThat(printf.isVariadic()).isTrue();
        assertThat(printf.getParameters()).singleElement().satisfies(format -> {
            assertThat(format.getName()).isEqualTo("format");
            assertThat(format.getType().getSpelling()).isEqualTo("const char *");
            assertThat(format.getDefaultValue()).isEmpty();
        });
    }

    @Test
    void testParameterPackIsNotCVariadic() {
        String dump = """
            function_template "log" [id=c:@FT@>1#pTlog#p0#, definition] `template <typename... Ts> void log(Ts... args) {}` {
                template_type_parameter "Ts" `typename... Ts`
                parm_decl "args" [type="Ts..."] `Ts... args`
            }
            """;

        ParseResult result = parse(dump);
        FunctionEntity log = (FunctionEntity) result.getFile().getChildren().get(0);

        assertThat(log.isVariadic()).isFalse();
        assertThat(log.isTemplate()).isTrue();
        assertThat(log.getTemplateParameters()).singleElement().satisfies(parameter -> {
            assertThat(parameter.isVariadic()).isTrue();
            assertThat(parameter.getSpelling()).isEqualTo("typename... Ts");
        });
        assertThat(log.getBodyKind()).isEqualTo(FunctionBodyKind.DEFINITION);
        assertThat(result.getIndex().contains(EntityId.of("c:@FT@>1#pTlog#p0#"))).isFalse();
    }

    @Test
    void testOverrideFromAttributeAndTokens() {
        String dump = """
            class_decl "Task" [definition] `class Task : public Runnable { void run() noexcept override; };` {
                cxx_base_specifier "Runnable" [access=public] `public Runnable`
                cxx_method "run" [result=void] `void run() noexcept override` {
                    cxx_override_attr `override`
                }
            }
            """;

        FunctionEntity run = member(dump, 0);

        assertThat(run.getSpecifiers()).containsExactlyInAnyOrder(FunctionSpecifier.NOEXCEPT,
                FunctionSpecifier.OVERRIDE);
    }

    @Test
    void testParameterDefaultValue() {
        String dump = """
            function_decl "scale" [result=int] `int scale(int value, int factor = 42)` {
                parm_decl "value" [type=int] `int value`
                parm_decl "factor" [type=int] `int factor = 42`
            }
            """;

        FunctionEntity scale = first(dump, FunctionEntity.class);

        assertThat(scale.getParameters()).extracting(FunctionParameterEntity::getName)
                .containsExactly("value", "factor");
        assertThat(scale.getParameters().get(0).getDefaultValue()).isEmpty();
        assertThat(scale.getParameters().get(1).getDefaultValue()).contains("42");
        assertThat(scale.getParameters().get(1).getParent()).containsSame(scale);
        assertThat(scale.getChildren()).isEmpty();
    }

    @Test
    void testDefinitionIsRegistered() {
        String dump = """
            function_decl "answer" [id=c:@F@answer#, result=int, definition] `static constexpr int answer() { return 42; }` {
                compound_stmt `{ return 42; }`
            }
            """;

        ParseResult result = parse(dump);
        FunctionEntity answer = (FunctionEntity) result.getFile().getChildren().get(0);

        assertThat(answer.isDefinition()).isTrue();
        assertThat(answer.getBodyKind()).isEqualTo(FunctionBodyKind.DEFINITION);
        assertThat(answer.getSpecifiers()).containsExactlyInAnyOrder(FunctionSpecifier.STATIC,
                FunctionSpecifier.CONSTEXPR);
        assertThat(result.getIndex().lookupDefinition(EntityId.of("c:@F@answer#"))).containsSame(answer);
    }

    @Test
    void testTrailingReturnType() {
        String dump = """
            function_decl "make" [result=auto, definition] `auto make() -> std::unique_ptr<Widget> { return {}; }`
            """;

        FunctionEntity make = first(dump, FunctionEntity.class);

        assertThat(make.getBodyKind()).isEqualTo(FunctionBodyKind.DEFINITION);
        assertThat(make.getReturnType()).map(type -> type.getSpelling()).contains("auto");
    }

    @Test
    void testFriendFunctionIsDeclaration() {
        String dump = """
            class_decl "A" [definition] `class A { friend bool operator==(const A& a, const A& b) { return true; } };` {
                friend_decl `friend bool operator==(const A& a, const A& b) { return true; }` {
                    function_decl "operator==" [result=bool, definition] `friend bool operator==(const A& a, const A& b) { return true; }` {
                        parm_decl "a" [type="const A &"] `const A& a`
                        parm_decl "b" [type="const A &"] `const A& b`
                    }
                }
            }
            """;

        FunctionEntity equals = member(dump, 0);

        assertThat(equals.getName()).isEqualTo("operator==");
        assertThat(equals.isFriend()).isTrue();
        assertThat(equals.isDefinition()).isFalse();
        assertThat(equals.getBodyKind()).isEqualTo(FunctionBodyKind.DECLARATION);
        assertThat(equals.getSemanticParent()).isEmpty();
        assertThat(equals.getParameters()).hasSize(2);
    }

    @Test
    void testQualifiedFriendFunctionHasNoSemanticParent() {
        String dump = """
            namespace "ns" [id=c:@N@ns] `namespace ns { void helper(); }` {
                function_decl "helper" [id=c:@N@ns@F@helper#, result=void] `void helper()`
            }
            class_decl "Host" [id=c:@S@Host, definition] `class Host { friend void ns::helper(); };` {
                friend_decl `friend void ns::helper();` {
                    function_decl "helper" [id=c:@N@ns@F@helper#, semantic_parent=c:@N@ns, result=void] `void ns::helper()`
                }
            }
            """;

        ClassEntity host = (ClassEntity) parse(dump).getFile().getChildren().get(1);
        FunctionEntity helper = (FunctionEntity) host.getChildren().get(0);

        assertThat(helper.isFriend()).isTrue();
        assertThat(helper.getSemanticParent()).isEmpty();
    }

    @Test
    void testOutOfLineMemberOfClassTemplateKeepsEnclosingHeader() {
        String dump = """
            class_template "Box" [id=c:@ST>1#T@Box, definition] `template <typename T> class Box { void put(T value); };` {
                template_type_parameter "T" `typename T`
                cxx_method "put" [id=c:@ST>1#T@Box@F@put#t0.0#, result=void] `void put(T value)` {
                    parm_decl "value" [type=T] `T value`
                }
            }
            cxx_method "put" [id=c:@ST>1#T@Box@F@put#t0.0#, semantic_parent=c:@ST>1#T@Box, result=void, definition] `template <typename T> void Box<T>::put(T value) {}` {
                parm_decl "value" [type=T] `T value`
            }
            """;

        FunctionEntity put = (FunctionEntity) parse(dump).getFile().getChildren().get(1);

        assertThat(put.getSemanticParent()).map(EntityRef::getName).contains("Box<T>");
        assertThat(put.getEnclosingTemplateParameters()).hasSize(1);
        TemplateParameter parameter = put.getEnclosingTemplateParameters().get(0).get(0);
        assertThat(parameter.getKind()).isEqualTo(TemplateParameterKind.TYPE);
        assertThat(parameter.getName()).isEqualTo("T");
        assertThat(parameter.getSpelling()).isEqualTo("typename T");
    }

    @Test
    void testEnclosingHeaderFromSemanticParentTemplate() {
        String dump = """
            class_template "Box" [id=c:@ST>1#T@Box, definition] `template <typename T, int N = 4> class Box { void clear(); };` {
                template_type_parameter "T" `typename T`
                non_type_template_parameter "N" [type=int] `int N = 4`
                cxx_method "clear" [id=c:@ST>2#T#NI@Box@F@clear#, result=void] `void clear()`
            }
            cxx_method "clear" [id=c:@ST>2#T#NI@Box@F@clear#, semantic_parent=c:@ST>1#T@Box, result=void, definition] `void Box<T, N>::clear() {}`
            """;

        FunctionEntity clear = (FunctionEntity) parse(dump).getFile().getChildren().get(1);

        assertThat(clear.getEnclosingTemplateParameters()).singleElement()
                .satisfies(parameters -> assertThat(parameters)
                        .extracting(TemplateParameter::getName)
                        .containsExactly("T", "N"));
    }

    @Test
    void testMemberDefinedInClassHasNoEnclosingHeader() {
        String dump = """
            class_decl "A" [id=c:@S@A, definition] `class A { void f() {} };` {
                cxx_method "f" [id=c:@S@A@F@f#, result=void, definition] `void f() {}`
            }
            """;

        assertThat(member(dump, 0).getEnclosingTemplateParameters()).isEmpty();
    }
}
