package com.cppmodel.generator.codegen;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import com.cppmodel.generator.cursor.SourceTokenizer;
import com.cppmodel.generator.cursor.Token;
import com.cppmodel.generator.model.AccessSpecifierEntity;
import com.cppmodel.generator.model.BaseClassEntity;
import com.cppmodel.generator.model.ClassEntity;
import com.cppmodel.generator.model.CppType;
import com.cppmodel.generator.model.Entity;
import com.cppmodel.generator.model.EntityKind;
import com.cppmodel.generator.model.EntityVisitor;
import com.cppmodel.generator.model.EnumEntity;
import com.cppmodel.generator.model.EnumValueEntity;
import com.cppmodel.generator.model.FileEntity;
import com.cppmodel.generator.model.FunctionBodyKind;
import com.cppmodel.generator.model.FunctionEntity;
import com.cppmodel.generator.model.FunctionKind;
import com.cppmodel.generator.model.FunctionParameterEntity;
import com.cppmodel.generator.model.FunctionSpecifier;
import com.cppmodel.generator.model.NamespaceEntity;
import com.cppmodel.generator.model.TemplateParameter;
import com.cppmodel.generator.model.TypeAliasEntity;
import com.cppmodel.generator.model.VariableEntity;
import com.cppmodel.generator.parser.TokenSpelling;

/**
 * Renders entities as C++ source through an {@link Output} per entity.
 *
 * Each visit returns whether anything was written, so the caller knows
 * whether to separate the entity from its successor. Writers never end with
 * a newline; separating entities is up to the caller.
 */
public class EntityCodeWriter implements EntityVisitor<Boolean> {
    // decimal with a point or an exponent, or hexadecimal with a binary exponent; any suffix
    private static final Pattern FLOAT_LITERAL = Pattern.compile(
            "(\\d[\\d']*)?\\.\\d[\\d']*([eE][+-]?\\d+)?\\w*|\\d[\\d']*\\.([eE][+-]?\\d+)?\\w*"
                    + "|\\d[\\d']*[eE][+-]?\\d+\\w*|0[xX][\\da-fA-F'.]*[pP][+-]?\\d+\\w*");

    private final CodeGenerator generator;

    public EntityCodeWriter(CodeGenerator generator) {
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    /**
     * Renders {@code entity} and, depending on the backend's choice, its children.
     *
     * @return whether the entity was rendered at all
     */
    public boolean write(Entity entity) {
        return entity.accept(this);
    }

    /**
     * Entities with renderable children are rendered as containers.
     */
    public static boolean isContainer(Entity entity) {
        EntityKind kind = entity.getKind();
        boolean containerKind = kind == EntityKind.FILE || kind == EntityKind.NAMESPACE
                || kind == EntityKind.CLASS || kind == EntityKind.ENUM;
        return containerKind && !entity.getChildren().isEmpty();
    }

    @Override
    public Boolean visit(FileEntity file) {
        try (Output out = open(file)) {
            if (out.isExcluded()) {
                return false;
            }
            if (out.generateDefinition()) {
                writeMembers(out, file.getChildren());
            }
            return true;
        }
    }

    @Override
    public Boolean visit(NamespaceEntity namespace) {
        try (Output out = open(namespace)) {
            if (out.isExcluded()) {
                return false;
            }
            if (namespace.isInlineNamespace()) {
                out.keyword("inline").whitespace();
            }
            out.keyword("namespace");
            if (!namespace.isAnonymous()) {
                out.whitespace().identifier(namespace.getName());
            }

            if (!out.generateDefinition() || namespace.getChildren().isEmpty()) {
                out.whitespace().punctuation("{").punctuation("}");
                return true;
            }
            out.newline().punctuation("{").indent().newline();
            writeMembers(out, namespace.getChildren());
            out.unindent().punctuation("}");
            return true;
        }
    }

    @Override
    public Boolean visit(ClassEntity classEntity) {
        try (Output out = open(classEntity)) {
            if (out.isExcluded()) {
                return false;
            }
            writeTemplateHeader(out, classEntity);
            if (classEntity.isFriend()) {
                out.keyword("friend").whitespace();
            }
            out.keyword(classEntity.getClassKind().getKeyword());
            if (!classEntity.isAnonymous()) {
                out.whitespace();
                writeQualifiedName(out, classEntity);
            }

            if (!out.generateDefinition() || !classEntity.isDefinition()) {
                out.punctuation(";");
                return true;
            }

            if (classEntity.isFinalClass()) {
                out.whitespace().keyword("final");
            }
            List<BaseClassEntity> bases = classEntity.getBases();
            for (int i = 0; i < bases.size(); i++) {
                out.whitespace().punctuation(i == 0 ? ":" : ",").whitespace();
                writeBase(out, bases.get(i));
            }

            out.newline().punctuation("{").indent().newline();
            writeMembers(out, classEntity.getChildren());
            out.unindent().punctuation("}").punctuation(";");
            return true;
        }
    }

    @Override
    public Boolean visit(BaseClassEntity baseClass) {
        try (Output out = open(baseClass)) {
            if (out.isExcluded()) {
                return false;
            }
            writeBase(out, baseClass);
            return true;
        }
    }

    @Override
    public Boolean visit(AccessSpecifierEntity accessSpecifier) {
        try (Output out = open(accessSpecifier)) {
            if (out.isExcluded()) {
                return false;
            }
            out.unindent()
                    .keyword(accessSpecifier.getAccess().getSpelling())
                    .punctuation(":")
                    .indent();
            return true;
        }
    }

    @Override
    public Boolean visit(FunctionEntity function) {
        try (Output out = open(function)) {
            if (out.isExcluded()) {
                return false;
            }
            for (List<TemplateParameter> enclosing : function.getEnclosingTemplateParameters()) {
                writeTemplateHeader(out, enclosing);
            }
            writeTemplateHeader(out, function);
            if (function.isFriend()) {
                out.keyword("friend").whitespace();
            }
            for (FunctionSpecifier specifier : function.getSpecifiers()) {
                if (specifier.isPrefix()) {
                    out.keyword(specifier.getSpelling()).whitespace();
                }
            }
            if (function.getFunctionKind() != FunctionKind.CONSTRUCTOR
                    && function.getFunctionKind() != FunctionKind.DESTRUCTOR) {
                function.getReturnType().ifPresent(type -> {
                    writeType(out, type);
                    out.whitespace();
                });
            }
            writeQualifiedName(out, function);

            out.punctuation("(");
            List<FunctionParameterEntity> parameters = function.getParameters();
            for (int i = 0; i < parameters.size(); i++) {
                if (i > 0) {
                    out.punctuation(",").whitespace();
                }
                writeParameter(out, parameters.get(i));
            }
            if (function.isVariadic()) {
                if (!parameters.isEmpty()) {
                    out.punctuation(",").whitespace();
                }
                out.punctuation("...");
            }
            out.punctuation(")");

            for (FunctionSpecifier specifier : function.getSpecifiers()) {
                if (!specifier.isPrefix()) {
                    out.whitespace().keyword(specifier.getSpelling());
                }
            }
            writeFunctionBody(out, function.getBodyKind());
            return true;
        }
    }

    @Override
    public Boolean visit(FunctionParameterEntity parameter) {
        try (Output out = open(parameter)) {
            if (out.isExcluded()) {
                return false;
            }
            writeParameter(out, parameter);
            return true;
        }
    }

    @Override
    public Boolean visit(VariableEntity variable) {
        try (Output out = open(variable)) {
            if (out.isExcluded()) {
                return false;
            }
            for (VariableEntity.StorageSpecifier storage : variable.getStorage()) {
                out.keyword(storage.getSpelling()).whitespace();
            }
            writeType(out, variable.getType());
            out.whitespace();
            writeQualifiedName(out, variable);
            variable.getDefaultValue().ifPresent(value -> writeInitializer(out, value));
            out.punctuation(";");
            return true;
        }
    }

    @Override
    public Boolean visit(EnumEntity enumEntity) {
        try (Output out = open(enumEntity)) {
            if (out.isExcluded()) {
                return false;
            }
            out.keyword("enum");
            if (enumEntity.isScoped()) {
                out.whitespace().keyword("class");
            }
            if (!enumEntity.isAnonymous()) {
                out.whitespace();
                writeQualifiedName(out, enumEntity);
            }
            enumEntity.getUnderlyingType().ifPresent(type -> {
                out.whitespace().punctuation(":").whitespace();
                writeType(out, type);
            });

            if (!out.generateDefinition() || !enumEntity.isDefinition()) {
                out.punctuation(";");
                return true;
            }
            out.newline().punctuation("{").indent().newline();
            for (Entity value : enumEntity.getChildren()) {
                if (write(value)) {
                    out.punctuation(",").newline();
                }
            }
            out.unindent().punctuation("}").punctuation(";");
            return true;
        }
    }

    @Override
    public Boolean visit(EnumValueEntity enumValue) {
        try (Output out = open(enumValue)) {
            if (out.isExcluded()) {
                return false;
            }
            out.identifier(enumValue.getName());
            enumValue.getValue().ifPresent(value -> {
                out.whitespace().punctuation("=").whitespace();
                writeTokens(out, value);
            });
            return true;
        }
    }

    @Override
    public Boolean visit(TypeAliasEntity typeAlias) {
        try (Output out = open(typeAlias)) {
            if (out.isExcluded()) {
                return false;
            }
            writeTemplateHeader(out, typeAlias);
            if (typeAlias.isUsingSyntax()) {
                out.keyword("using").whitespace().identifier(typeAlias.getName())
                        .whitespace().punctuation("=").whitespace();
                writeType(out, typeAlias.getTarget());
            } else {
                out.keyword("typedef").whitespace();
                writeType(out, typeAlias.getTarget());
                out.whitespace().identifier(typeAlias.getName());
            }
            out.punctuation(";");
            return true;
        }
    }

    private Output open(Entity entity) {
        return new Output(generator, entity, isContainer(entity));
    }

    /**
     * Each rendered member is followed by one newline.
     */
    private void writeMembers(Output out, List<Entity> members) {
        for (Entity member : members) {
            if (write(member)) {
                out.newline();
            }
        }
    }

    private void writeTemplateHeader(Output out, Entity entity) {
        if (entity.isTemplate() || !entity.getTemplateParameters().isEmpty()) {
            writeTemplateHeader(out, entity.getTemplateParameters());
        }
    }

    private void writeTemplateHeader(Output out, List<TemplateParameter> parameters) {
        out.keyword("template").punctuation("<");
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                out.punctuation(",").whitespace();
            }
            TemplateParameter parameter = parameters.get(i);
            writeTokens(out, parameter.getSpelling());
            parameter.getDefaultValue().ifPresent(value -> {
                out.whitespace().punctuation("=").whitespace();
                writeTokens(out, value);
            });
        }
        out.punctuation(">").newline();
    }

    /**
     * The name, qualified by the semantic parent's scope for out-of-line entities.
     */
    private void writeQualifiedName(Output out, Entity entity) {
        entity.getSemanticParent().ifPresent(scope -> out.reference(scope.getIds(), scope.getName()).punctuation("::"));
        out.identifier(entity.getName());
    }

    private void writeBase(Output out, BaseClassEntity base) {
        if (base.isVirtual()) {
            out.keyword("virtual").whitespace();
        }
        out.keyword(base.getAccess().getSpelling()).whitespace();
        CppType type = base.getType();
        if (type.getReference().isPresent()) {
            out.reference(type.getReference().get().getIds(), base.getName());
        } else {
            writeTokens(out, base.getName());
        }
    }

    private void writeParameter(Output out, FunctionParameterEntity parameter) {
        writeType(out, parameter.getType());
        if (!parameter.isAnonymous()) {
            out.whitespace().identifier(parameter.getName());
        }
        parameter.getDefaultValue().ifPresent(value -> {
            out.whitespace().punctuation("=").whitespace();
            writeTokens(out, value);
        });
    }

    private void writeFunctionBody(Output out, FunctionBodyKind bodyKind) {
        switch (bodyKind) {
            case PURE_VIRTUAL:
                out.whitespace().punctuation("=").whitespace().intLiteral("0").punctuation(";");
                break;
            case DEFAULTED:
                out.whitespace().punctuation("=").whitespace().keyword("default").punctuation(";");
                break;
            case DELETED:
                out.whitespace().punctuation("=").whitespace().keyword("delete").punctuation(";");
                break;
            case DEFINITION:
                if (out.generateDefinition()) {
                    out.whitespace().punctuation("{").punctuation("}");
                } else {
                    out.punctuation(";");
                }
                break;
            default:
                out.punctuation(";");
                break;
        }
    }

    private void writeInitializer(Output out, String value) {
        if (value.startsWith("{")) {
            writeTokens(out, value);
        } else {
            out.whitespace().punctuation("=").whitespace();
            writeTokens(out, value);
        }
    }

    private void writeType(Output out, CppType type) {
        if (type.getReference().isPresent()) {
            out.reference(type.getReference().get().getIds(), type.getSpelling());
        } else {
            writeTokens(out, type.getSpelling());
        }
    }

    /**
     * Writes source text token by token, each through the write operation
     * of its class.
     */
    private static void writeTokens(Output out, String text) {
        Token previous = null;
        for (Token token : SourceTokenizer.tokenize(text)) {
            if (previous != null && TokenSpelling.needsSpace(previous, token)) {
                out.whitespace();
            }
            writeToken(out, token);
            previous = token;
        }
    }

    private static void writeToken(Output out, Token token) {
        String spelling = token.getSpelling();
        switch (token.getKind()) {
            case KEYWORD:
                out.keyword(spelling);
                break;
            case IDENTIFIER:
                out.identifier(spelling);
                break;
            case LITERAL:
                writeLiteral(out, spelling);
                break;
            default:
                out.punctuation(spelling);
                break;
        }
    }

    private static void writeLiteral(Output out, String spelling) {
        char first = spelling.charAt(0);
        if (!Character.isDigit(first) && first != '.') {
            out.strLiteral(spelling);
        } else if (FLOAT_LITERAL.matcher(spelling).matches()) {
            out.floatLiteral(spelling);
        } else {
            out.intLiteral(spelling);
        }
    }
}
