package com.cppmodel.generator.parser;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppmodel.generator.cursor.Cursor;
import com.cppmodel.generator.cursor.CursorKind;
import com.cppmodel.generator.cursor.Token;
import com.cppmodel.generator.model.EntityId;
import com.cppmodel.generator.model.EntityRef;
import com.cppmodel.generator.model.FunctionBodyKind;
import com.cppmodel.generator.model.FunctionEntity;
import com.cppmodel.generator.model.FunctionKind;
import com.cppmodel.generator.model.FunctionParameterEntity;
import com.cppmodel.generator.model.FunctionSpecifier;
import com.cppmodel.generator.model.TemplateParameter;

/**
 * Builds {@link FunctionEntity}s from free functions, member functions,
 * constructors, destructors and function templates.
 *
 * Parameters come from the parameter cursors; specifiers and the body kind
 * are read from the declarator tokens around the parameter list, since the
 * provider has no query for them.
 */
public class FunctionParser {
    private static final Logger log = LoggerFactory.getLogger(FunctionParser.class);

    private final ParseContext context;

    public FunctionParser(ParseContext context) {
        this.context = context;
    }

    public FunctionEntity parse(Cursor cur, Cursor parentCur, List<TemplateParameter> templateParameters) {
        FunctionKind functionKind = functionKindOf(cur);
        boolean templated = ClassParser.isTemplated(cur);
        boolean friend = parentCur != null && parentCur.getKind() == CursorKind.FRIEND_DECL;

        FunctionEntity.Builder builder = FunctionEntity.builder(cur.getSpelling(), functionKind);
        templateParameters.forEach(builder::templateParameter);
        if (friend) {
            builder.friend();
        }
        if (functionKind != FunctionKind.CONSTRUCTOR && functionKind != FunctionKind.DESTRUCTOR
                && !cur.getResultType().isEmpty()) {
            builder.returnType(context.parseType(cur, cur.getResultType()));
        }

        cur.visitChildren(child -> {
            switch (child.getKind()) {
                case PARM_DECL:
                    builder.parameter(parseParameter(child));
                    break;
                case CXX_OVERRIDE_ATTR:
                    builder.specifier(FunctionSpecifier.OVERRIDE);
                    break;
                case CXX_FINAL_ATTR:
                    builder.specifier(FunctionSpecifier.FINAL);
                    break;
                default:
                    break;
            }
        });
        parseDeclarator(builder, cur);

        EntityId id = ParseContext.idOf(cur);
        boolean definition = cur.isDefinition() && !friend;
        if (!definition) {
            log.debug("Parsed function declaration '{}'", cur.getSpelling());
            return templated ? builder.finishTemplateDeclaration(id) : builder.finishDeclaration(context.getIndex(), id);
        }

        EntityRef semanticParent = context.getScopeResolver().resolveSemanticParent(cur, friend).orElse(null);
        if (semanticParent != null) {
            enclosingTemplates(cur, templated).forEach(builder::enclosingTemplate);
        }
        log.debug("Parsed function definition '{}'", cur.getSpelling());
        return templated
                ? builder.finishTemplateDefinition(id, semanticParent)
                : builder.finishDefinition(context.getIndex(), id, semanticParent);
    }

    /**
     * Template headers of the class templates an out-of-line member is
     * defined in. They lead the member's own tokens; without them the
     * parameters of a semantic parent class template are used.
     */
    private List<List<TemplateParameter>> enclosingTemplates(Cursor cur, boolean templated) {
        TemplateParameterParser parameterParser = new TemplateParameterParser();
        List<List<TemplateParameter>> headers = parameterParser.parseHeaders(cur.getTokens());
        if (!headers.isEmpty()) {
            // the last header of a member template is its own
            return templated ? headers.subList(0, headers.size() - 1) : headers;
        }
        return cur.getSemanticParent()
                .filter(parent -> parent.getKind() == CursorKind.CLASS_TEMPLATE
                        || parent.getKind() == CursorKind.CLASS_TEMPLATE_PARTIAL_SPECIALIZATION)
                .map(parent -> List.of(parameterParser.parse(parent)))
                .orElse(List.of());
    }

    private FunctionParameterEntity parseParameter(Cursor paramCur) {
        TokenStream stream = new TokenStream(paramCur.getTokens());
        String defaultValue = null;
        if (!paramCur.getSpelling().isEmpty() && stream.seekName(ScopeResolver.nameTokens(paramCur.getSpelling())) >= 0) {
            while (!stream.done() && !stream.peekIs("=")) {
                stream.bump();
            }
            if (stream.skipIf("=")) {
                defaultValue = stream.remainder();
            }
        }
        return FunctionParameterEntity.build(context.getIndex(), ParseContext.idOf(paramCur), paramCur.getSpelling(),
                context.parseType(paramCur, paramCur.getType()), defaultValue);
    }

    /**
     * Reads prefix specifiers before the name and suffix specifiers and the
     * body after the parameter list.
     */
    private void parseDeclarator(FunctionEntity.Builder builder, Cursor cur) {
        TokenStream stream = new TokenStream(cur.getTokens());
        int nameIndex = stream.seekName(ScopeResolver.nameTokens(cur.getSpelling()));
        if (nameIndex < 0) {
            log.debug("Name of '{}' not found in its tokens, specifiers not read", cur.getSpelling());
            if (cur.isDefinition()) {
                builder.bodyKind(FunctionBodyKind.DEFINITION);
            }
            return;
        }

        for (int i = 0; i < nameIndex; i++) {
            FunctionSpecifier.fromSpelling(stream.tokens().get(i).getSpelling())
                    .filter(FunctionSpecifier::isPrefix)
                    .ifPresent(builder::specifier);
        }

        if (stream.peekIs("<")) {
            stream.skipBrackets();
        }
        if (stream.peekIs("(")) {
            int open = stream.position();
            stream.skipBrackets();
            int close = stream.position() - 1;
            if (close > open + 1 && stream.tokens().get(close - 1).getSpelling().equals("...")
                    && isCVariadic(stream.tokens().subList(open + 1, close - 1))) {
                builder.variadic();
            }
        }

        parseSuffix(builder, stream);
        if (cur.isDefinition() && builder.get().getBodyKind() == FunctionBodyKind.DECLARATION) {
            builder.bodyKind(FunctionBodyKind.DEFINITION);
        }
    }

    /**
     * {@code f(int, ...)} and {@code f(...)} are C variadic, {@code f(Ts... ts)} is not.
     */
    private static boolean isCVariadic(List<Token> before) {
        return before.isEmpty() || before.get(before.size() - 1).getSpelling().equals(",");
    }

    private void parseSuffix(FunctionEntity.Builder builder, TokenStream stream) {
        while (!stream.done()) {
            if (stream.skipAttribute()) {
                continue;
            }
            String spelling = stream.get().getSpelling();
            switch (spelling) {
                case "const":
                    builder.specifier(FunctionSpecifier.CONST);
                    break;
                case "noexcept":
                    builder.specifier(FunctionSpecifier.NOEXCEPT);
                    stream.skipBrackets();
                    break;
                case "throw":
                    stream.skipBrackets();
                    break;
                case "override":
                    builder.specifier(FunctionSpecifier.OVERRIDE);
                    break;
                case "final":
                    builder.specifier(FunctionSpecifier.FINAL);
                    break;
                case "->":
                    skipTrailingReturnType(stream);
                    break;
                case "=":
                    builder.bodyKind(bodyKindOf(stream.get().getSpelling()));
                    return;
                case "{":
                case ":":
                case "try":
                    builder.bodyKind(FunctionBodyKind.DEFINITION);
                    return;
                case ";":
                    return;
                default:
                    break;
            }
        }
    }

    private static void skipTrailingReturnType(TokenStream stream) {
        while (!stream.done() && !stream.peekIs("{") && !stream.peekIs("=") && !stream.peekIs(";")
                && !stream.peekIs("override") && !stream.peekIs("final")) {
            if (!stream.skipBrackets()) {
                stream.bump();
            }
        }
    }

    private static FunctionBodyKind bodyKindOf(String spelling) {
        switch (spelling) {
            case "0":
                return FunctionBodyKind.PURE_VIRTUAL;
            case "default":
                return FunctionBodyKind.DEFAULTED;
            case "delete":
                return FunctionBodyKind.DELETED;
            default:
                log.debug("Unexpected function body '= {}'", spelling);
                return FunctionBodyKind.DEFINITION;
        }
    }

    private static FunctionKind functionKindOf(Cursor cur) {
        CursorKind kind = cur.getKind() == CursorKind.FUNCTION_TEMPLATE ? cur.getTemplateCursorKind() : cur.getKind();
        switch (kind) {
            case CXX_METHOD:
                return FunctionKind.MEMBER;
            case CONSTRUCTOR:
                return FunctionKind.CONSTRUCTOR;
            case DESTRUCTOR:
                return FunctionKind.DESTRUCTOR;
            case FUNCTION_DECL:
                return FunctionKind.FREE;
            default:
                throw new ProviderContractException("Cursor '" + cur.getSpelling() + "' of kind " + cur.getKind()
                        + " is not a function");
        }
    }
}
