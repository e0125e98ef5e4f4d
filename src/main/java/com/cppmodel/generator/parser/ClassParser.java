package com.cppmodel.generator.parser;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppmodel.generator.cursor.Cursor;
import com.cppmodel.generator.cursor.CursorAccess;
import com.cppmodel.generator.cursor.CursorKind;
import com.cppmodel.generator.model.AccessSpecifierKind;
import com.cppmodel.generator.model.ClassEntity;
import com.cppmodel.generator.model.ClassKind;
import com.cppmodel.generator.model.CppType;
import com.cppmodel.generator.model.EntityId;
import com.cppmodel.generator.model.EntityRef;
import com.cppmodel.generator.model.TemplateParameter;

/**
 * Builds {@link ClassEntity}s from class, struct and union cursors, including
 * class templates and their partial specializations.
 *
 * Children of a definition are visited in source order: access specifiers
 * switch the current access, base specifiers are collected in declaration
 * order, a {@code final} attribute marks the class, and every other
 * declaration is parsed as a member. Template parameters, function parameters,
 * expressions and references the provider yields as siblings are skipped.
 */
public class ClassParser {
    private static final Logger log = LoggerFactory.getLogger(ClassParser.class);

    private final ParseContext context;

    public ClassParser(ParseContext context) {
        this.context = context;
    }

    /**
     * @param cur                the class cursor
     * @param parentCur          the cursor being visited when {@code cur} was reached, may be {@code null}
     * @param templateParameters parameters collected from a template cursor, empty otherwise
     * @throws ProviderContractException if the cursor is not a class, struct or union,
     *                                   or a child violates the provider contract
     */
    public ClassEntity parse(Cursor cur, Cursor parentCur, List<TemplateParameter> templateParameters) {
        ClassKind classKind = classKindOf(cur);
        boolean templated = isTemplated(cur);
        boolean friend = parentCur != null && parentCur.getKind() == CursorKind.FRIEND_DECL;

        ClassEntity.Builder builder = ClassEntity.builder(cur.getSpelling(), classKind);
        templateParameters.forEach(builder::templateParameter);
        if (friend) {
            builder.friend();
        }

        boolean definition = cur.isDefinition() && !friend;
        if (definition) {
            cur.visitChildren(child -> parseChild(builder, cur, child));
        }

        EntityId id = ParseContext.idOf(cur);
        if (!definition) {
            log.debug("Parsed {} declaration '{}'", classKind.getKeyword(), cur.getSpelling());
            return templated ? builder.finishTemplateDeclaration(id) : builder.finishDeclaration(context.getIndex(), id);
        }

        EntityRef semanticParent = context.getScopeResolver().resolveSemanticParent(cur, friend).orElse(null);
        log.debug("Parsed {} definition '{}'", classKind.getKeyword(), cur.getSpelling());
        return templated
                ? builder.finishTemplateDefinition(id, semanticParent)
                : builder.finishDefinition(context.getIndex(), id, semanticParent);
    }

    static boolean isTemplated(Cursor cur) {
        return cur.getTemplateCursorKind() != CursorKind.NO_DECL_FOUND || cur.getSpecializedTemplate().isPresent();
    }

    private void parseChild(ClassEntity.Builder builder, Cursor classCur, Cursor child) {
        CursorKind kind = child.getKind();
        switch (kind) {
            case CXX_ACCESS_SPECIFIER:
                builder.accessSpecifier(accessOf(child));
                return;
            case CXX_BASE_SPECIFIER:
                parseBase(builder, child);
                return;
            case CXX_FINAL_ATTR:
                builder.finalClass();
                return;
            case UNEXPOSED_ATTR:
                log.debug("Unexposed attribute in '{}' not kept", classCur.getSpelling());
                return;
            case PARM_DECL:
                return;
            default:
                break;
        }
        if (kind.isTemplateParameter() || kind.isExpression() || kind.isReference() || kind.isAttribute()) {
            return;
        }

        context.parseEntity(child, classCur).ifPresent(builder::addChild);
    }

    private void parseBase(ClassEntity.Builder builder, Cursor baseCur) {
        TokenStream stream = new TokenStream(baseCur.getTokens());
        stream.skipAttribute();
        // virtual and the access keyword may come in either order
        for (int i = 0; i < 2; i++) {
            if (baseCur.isVirtualBase()) {
                stream.skipIf("virtual");
            }
            if (stream.skipIf("public") || stream.skipIf("protected")) {
                continue;
            }
            stream.skipIf("private");
        }

        String name = stream.remainder();
        CppType type = context.parseType(baseCur, baseCur.getType());
        AccessSpecifierKind access = baseCur.getAccess() == CursorAccess.INVALID
                ? builder.getCurrentAccess()
                : accessOf(baseCur);
        builder.baseClass(name, type, access, baseCur.isVirtualBase());
    }

    private static AccessSpecifierKind accessOf(Cursor cur) {
        switch (cur.getAccess()) {
            case PUBLIC:
                return AccessSpecifierKind.PUBLIC;
            case PROTECTED:
                return AccessSpecifierKind.PROTECTED;
            case PRIVATE:
                return AccessSpecifierKind.PRIVATE;
            default:
                throw new ProviderContractException("Cursor " + cur.getKind() + " '" + cur.getSpelling()
                        + "' has no valid access");
        }
    }

    private static ClassKind classKindOf(Cursor cur) {
        CursorKind kind = cur.getKind();
        if (kind == CursorKind.CLASS_TEMPLATE || kind == CursorKind.CLASS_TEMPLATE_PARTIAL_SPECIALIZATION) {
            kind = cur.getTemplateCursorKind();
        }
        switch (kind) {
            case CLASS_DECL:
                return ClassKind.CLASS;
            case STRUCT_DECL:
                return ClassKind.STRUCT;
            case UNION_DECL:
                return ClassKind.UNION;
            default:
                throw new ProviderContractException("Cursor '" + cur.getSpelling() + "' of kind " + cur.getKind()
                        + " is not a class, struct or union");
        }
    }
}
