package com.cppmodel.generator.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppmodel.generator.cursor.Cursor;
import com.cppmodel.generator.cursor.CursorKind;
import com.cppmodel.generator.model.Entity;
import com.cppmodel.generator.model.TemplateParameter;

/**
 * Dispatches a cursor to the parser for its kind.
 *
 * Cursors that do not describe an entity of the model are skipped; the
 * provider yields plenty of those (references, expressions, statements).
 */
public class EntityParser {
    private static final Logger log = LoggerFactory.getLogger(EntityParser.class);

    private final ClassParser classParser;
    private final NamespaceParser namespaceParser;
    private final FunctionParser functionParser;
    private final VariableParser variableParser;
    private final EnumParser enumParser;
    private final TypeAliasParser typeAliasParser;
    private final TemplateParameterParser templateParameterParser = new TemplateParameterParser();

    public EntityParser(ParseContext context) {
        this.classParser = new ClassParser(context);
        this.namespaceParser = new NamespaceParser(context);
        this.functionParser = new FunctionParser(context);
        this.variableParser = new VariableParser(context);
        this.enumParser = new EnumParser(context);
        this.typeAliasParser = new TypeAliasParser(context);
    }

    /**
     * @param cur       the cursor to parse
     * @param parentCur the cursor whose children are being visited, {@code null} at the root
     */
    public Optional<Entity> parse(Cursor cur, Cursor parentCur) {
        switch (cur.getKind()) {
            case NAMESPACE:
                return Optional.of(namespaceParser.parse(cur));

            case CLASS_DECL:
            case STRUCT_DECL:
            case UNION_DECL:
                return Optional.of(classParser.parse(cur, parentCur, List.of()));

            case CLASS_TEMPLATE:
            case CLASS_TEMPLATE_PARTIAL_SPECIALIZATION:
                return Optional.of(classParser.parse(cur, parentCur, templateParameterParser.parse(cur)));

            case FUNCTION_DECL:
            case CXX_METHOD:
            case CONSTRUCTOR:
            case DESTRUCTOR:
                return Optional.of(functionParser.parse(cur, parentCur, templateParametersOf(cur)));

            case FUNCTION_TEMPLATE:
                return Optional.of(functionParser.parse(cur, parentCur, templateParameterParser.parse(cur)));

            case VAR_DECL:
            case FIELD_DECL:
                return Optional.of(variableParser.parse(cur));

            case ENUM_DECL:
                return Optional.of(enumParser.parse(cur));

            case TYPEDEF_DECL:
            case TYPE_ALIAS_DECL:
                return Optional.of(typeAliasParser.parse(cur));

            case FRIEND_DECL:
                return parseFriend(cur);

            default:
                log.debug("Skipping {} cursor '{}'", cur.getKind(), cur.getSpelling());
                return Optional.empty();
        }
    }

    /**
     * A friend cursor wraps the befriended declaration; it is parsed with the
     * friend cursor as its parent so the entity is marked accordingly.
     */
    private Optional<Entity> parseFriend(Cursor friendCur) {
        List<Entity> befriended = new ArrayList<>();
        friendCur.visitChildren(child -> {
            if (befriended.isEmpty() && child.getKind().isDeclaration()) {
                parse(child, friendCur).ifPresent(befriended::add);
            }
        });
        if (befriended.isEmpty()) {
            log.debug("Friend declaration without a declaration child skipped");
            return Optional.empty();
        }
        return Optional.of(befriended.get(0));
    }

    /**
     * Explicit specializations of function templates carry template
     * parameter children too, even though the cursor is a plain function.
     */
    private List<TemplateParameter> templateParametersOf(Cursor cur) {
        if (cur.getSpecializedTemplate().isEmpty()) {
            return List.of();
        }
        return templateParameterParser.parse(cur);
    }
}
