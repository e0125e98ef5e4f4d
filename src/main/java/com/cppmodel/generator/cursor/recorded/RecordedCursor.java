package com.cppmodel.generator.cursor.recorded;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import com.cppmodel.generator.cursor.Cursor;
import com.cppmodel.generator.cursor.CursorAccess;
import com.cppmodel.generator.cursor.CursorKind;
import com.cppmodel.generator.cursor.CursorType;
import com.cppmodel.generator.cursor.SourceTokenizer;
import com.cppmodel.generator.cursor.Token;

/**
 * A cursor read from a recorded dump.
 *
 * Cursors are compared by identity, like the provider's node handles. The
 * semantic parent is the lexical parent unless the entry names another one
 * with {@code semantic_parent}.
 */
public class RecordedCursor implements Cursor {

    static final String ID = "id";
    static final String TYPE = "type";
    static final String TYPE_DECL = "type_decl";
    static final String RESULT = "result";
    static final String UNDERLYING = "underlying";
    static final String ACCESS = "access";
    static final String SEMANTIC_PARENT = "semantic_parent";
    static final String TEMPLATE_KIND = "template_kind";
    static final String SPECIALIZED = "specialized";

    static final String DEFINITION = "definition";
    static final String VIRTUAL_BASE = "virtual_base";

    static final Set<String> ATTRIBUTES = Set.of(ID, TYPE, TYPE_DECL, RESULT, UNDERLYING, ACCESS, SEMANTIC_PARENT,
            TEMPLATE_KIND, SPECIALIZED);
    static final Set<String> FLAGS = Set.of(DEFINITION, VIRTUAL_BASE);

    private final RecordedTranslationUnit unit;
    private final CursorKind kind;
    private final String spelling;
    private final Map<String, String> attributes;
    private final Set<String> flags;
    private final String source;
    private final int line;

    private RecordedCursor lexicalParent;
    private final List<RecordedCursor> children = new ArrayList<>();
    private List<Token> tokens;

    RecordedCursor(RecordedTranslationUnit unit, CursorKind kind, String spelling, Map<String, String> attributes,
                   Set<String> flags, String source, int line) {
        this.unit = unit;
        this.kind = kind;
        this.spelling = spelling != null ? spelling : "";
        this.attributes = Map.copyOf(attributes);
        this.flags = Set.copyOf(flags);
        this.source = source != null ? source : "";
        this.line = line;
    }

    void addChild(RecordedCursor child) {
        child.lexicalParent = this;
        children.add(child);
    }

    public List<RecordedCursor> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getLine() {
        return line;
    }

    public String getSource() {
        return source;
    }

    @Override
    public CursorKind getKind() {
        return kind;
    }

    @Override
    public String getSpelling() {
        return spelling;
    }

    /**
     * The recorded {@code id}, or one derived from the entry's position.
     */
    @Override
    public String getUsr() {
        String id = attributes.get(ID);
        return id != null ? id : "c:" + unit.getName() + "@" + line + ":" + kind.getDumpName() + ":" + spelling;
    }

    @Override
    public boolean isDefinition() {
        return flags.contains(DEFINITION);
    }

    @Override
    public List<Token> getTokens() {
        if (tokens == null) {
            tokens = SourceTokenizer.tokenize(source);
        }
        return tokens;
    }

    @Override
    public Optional<Cursor> getSemanticParent() {
        String id = attributes.get(SEMANTIC_PARENT);
        if (id != null) {
            return Optional.of(unit.resolve(id));
        }
        return getLexicalParent();
    }

    @Override
    public Optional<Cursor> getLexicalParent() {
        return Optional.ofNullable(lexicalParent);
    }

    @Override
    public CursorKind getTemplateCursorKind() {
        String templateKind = attributes.get(TEMPLATE_KIND);
        if (templateKind != null) {
            return CursorKind.fromDumpName(templateKind).orElse(CursorKind.NO_DECL_FOUND);
        }
        switch (kind) {
            case CLASS_TEMPLATE:
            case CLASS_TEMPLATE_PARTIAL_SPECIALIZATION:
                return CursorKind.CLASS_DECL;
            case FUNCTION_TEMPLATE:
                return CursorKind.FUNCTION_DECL;
            default:
                return CursorKind.NO_DECL_FOUND;
        }
    }

    @Override
    public Optional<Cursor> getSpecializedTemplate() {
        String id = attributes.get(SPECIALIZED);
        return id != null ? Optional.of(unit.resolve(id)) : Optional.empty();
    }

    @Override
    public CursorAccess getAccess() {
        String access = attributes.get(ACCESS);
        if (access == null) {
            return CursorAccess.INVALID;
        }
        switch (access) {
            case "public":
                return CursorAccess.PUBLIC;
            case "protected":
                return CursorAccess.PROTECTED;
            case "private":
                return CursorAccess.PRIVATE;
            default:
                return CursorAccess.INVALID;
        }
    }

    @Override
    public boolean isVirtualBase() {
        return flags.contains(VIRTUAL_BASE);
    }

    /**
     * The recorded {@code type}; base specifiers and type references default
     * to their own spelling, as the provider spells them by their type.
     */
    @Override
    public CursorType getType() {
        String type = attributes.get(TYPE);
        if (type == null && (kind == CursorKind.CXX_BASE_SPECIFIER || kind == CursorKind.TYPE_REF)) {
            type = spelling;
        }
        return new CursorType(type != null ? type : "", attributes.get(TYPE_DECL));
    }

    @Override
    public CursorType getResultType() {
        return CursorType.of(attributes.getOrDefault(RESULT, ""));
    }

    @Override
    public CursorType getUnderlyingType() {
        return CursorType.of(attributes.getOrDefault(UNDERLYING, ""));
    }

    @Override
    public void visitChildren(Consumer<Cursor> visitor) {
        for (RecordedCursor child : children) {
            visitor.accept(child);
        }
    }

    @Override
    public String toString() {
        return kind.getDumpName() + " '" + spelling + "' (line " + line + ")";
    }
}
