package com.cppmodel.generator.cursor.recorded;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppmodel.generator.cursor.CursorKind;
import com.cppmodel.generator.cursor.recorded.CursorDumpToken.TokenType;
import com.cppmodel.generator.diagnostics.ToolDiagnostics;

/**
 * Parser for recorded cursor dumps.
 * Converts tokens into a tree of {@link RecordedCursor}s.
 *
 * <pre>
 * entry := kind ["spelling"] ['[' attr {',' attr} ']'] ['`' source '`'] ['{' {entry} '}']
 * attr  := name ['=' value]
 * </pre>
 *
 * A dump holds one {@code translation_unit} entry, or a list of top-level
 * entries that are wrapped into one. A malformed entry is reported to the
 * diagnostics and skipped; parsing resumes at the next entry starting on a
 * new line at the same nesting level.
 */
public class CursorDumpParser {
    private static final Logger log = LoggerFactory.getLogger(CursorDumpParser.class);

    private final List<CursorDumpToken> tokens;
    private final String fileName;
    private final RecordedTranslationUnit unit;
    private int pos = 0;

    public CursorDumpParser(List<CursorDumpToken> tokens, String fileName) {
        this.tokens = tokens;
        this.fileName = fileName;
        this.unit = new RecordedTranslationUnit(unitName(fileName));
    }

    /**
     * Tokenizes and parses a whole dump.
     *
     * @throws DumpParseException if the dump cannot even be tokenized
     */
    public static RecordedTranslationUnit read(String content, String fileName, ToolDiagnostics diagnostics) {
        List<CursorDumpToken> tokens = new CursorDumpTokenizer(content, fileName).tokenize();
        return new CursorDumpParser(tokens, fileName).parse(diagnostics);
    }

    public RecordedTranslationUnit parse(ToolDiagnostics diagnostics) {
        List<RecordedCursor> topLevel = new ArrayList<>();
        parseEntries(topLevel, diagnostics);

        if (check(TokenType.RBRACE)) {
            diagnostics.error(fileName, "Unbalanced '}' at line " + peek().getLine());
        }

        RecordedCursor root;
        if (topLevel.size() == 1 && topLevel.get(0).getKind() == CursorKind.TRANSLATION_UNIT) {
            root = topLevel.get(0);
        } else {
            root = new RecordedCursor(unit, CursorKind.TRANSLATION_UNIT, unit.getName(), Map.of(), Set.of(), "", 1);
            topLevel.forEach(root::addChild);
        }
        unit.setRoot(root);

        log.debug("Parsed {} with {} identified cursors", fileName, unit.size());
        return unit;
    }

    private void parseEntries(List<RecordedCursor> into, ToolDiagnostics diagnostics) {
        while (!isAtEnd() && !check(TokenType.RBRACE)) {
            int startLine = peek().getLine();
            try {
                into.add(parseEntry(diagnostics));
            } catch (DumpParseException e) {
                diagnostics.error(fileName, e.getMessage());
                log.warn("Skipping malformed entry in {}: {}", fileName, e.getMessage());
                skipToNextEntry(startLine);
            }
        }
    }

    private RecordedCursor parseEntry(ToolDiagnostics diagnostics) {
        CursorDumpToken kindToken = expect(TokenType.WORD);
        CursorKind kind = CursorKind.fromDumpName(kindToken.getValue())
                .orElseThrow(() -> new DumpParseException("Unknown cursor kind '" + kindToken.getValue() + "'",
                        kindToken.getLine()));

        String spelling = "";
        if (check(TokenType.STRING)) {
            spelling = advance().getValue();
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        Set<String> flags = new HashSet<>();
        if (check(TokenType.LBRACKET)) {
            parseAttributes(attributes, flags, diagnostics);
        }

        String source = "";
        if (check(TokenType.SOURCE)) {
            source = advance().getValue();
        }

        RecordedCursor cursor = new RecordedCursor(unit, kind, spelling, attributes, flags, source,
                kindToken.getLine());
        String id = attributes.get(RecordedCursor.ID);
        if (id != null) {
            unit.register(id, cursor);
        }

        if (check(TokenType.LBRACE)) {
            advance();
            List<RecordedCursor> children = new ArrayList<>();
            parseEntries(children, diagnostics);
            expect(TokenType.RBRACE);
            children.forEach(cursor::addChild);
        }

        log.debug("Parsed {} at line {}", kind.getDumpName(), kindToken.getLine());
        return cursor;
    }

    private void parseAttributes(Map<String, String> attributes, Set<String> flags, ToolDiagnostics diagnostics) {
        expect(TokenType.LBRACKET);

        while (!check(TokenType.RBRACKET)) {
            CursorDumpToken name = expect(TokenType.WORD);

            if (check(TokenType.EQUALS)) {
                advance();
                CursorDumpToken value = check(TokenType.STRING) ? advance() : expect(TokenType.WORD);
                if (!RecordedCursor.ATTRIBUTES.contains(name.getValue())) {
                    diagnostics.warning(fileName, "Unknown attribute '" + name.getValue() + "' at line "
                            + name.getLine());
                }
                validateAttribute(name, value);
                attributes.put(name.getValue(), value.getValue());
            } else {
                if (!RecordedCursor.FLAGS.contains(name.getValue())) {
                    diagnostics.warning(fileName, "Unknown flag '" + name.getValue() + "' at line " + name.getLine());
                }
                flags.add(name.getValue());
            }

            if (!check(TokenType.RBRACKET)) {
                expect(TokenType.COMMA);
            }
        }

        expect(TokenType.RBRACKET);
    }

    private void validateAttribute(CursorDumpToken name, CursorDumpToken value) {
        if (name.getValue().equals(RecordedCursor.TEMPLATE_KIND)
                && CursorKind.fromDumpName(value.getValue()).isEmpty()) {
            throw new DumpParseException("Unknown template kind '" + value.getValue() + "'", value.getLine());
        }
    }

    private void skipToNextEntry(int errorLine) {
        int depth = 0;
        while (!isAtEnd()) {
            CursorDumpToken token = peek();
            if (token.getType() == TokenType.LBRACE) {
                depth++;
            } else if (token.getType() == TokenType.RBRACE) {
                if (depth == 0) {
                    // closes the enclosing block
                    return;
                }
                depth--;
            } else if (depth == 0 && token.getType() == TokenType.WORD && token.getLine() > errorLine
                    && !check(TokenType.EQUALS, 1)) {
                return;
            }
            advance();
        }
    }

    private static String unitName(String fileName) {
        String name = fileName;
        int lastSlash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (lastSlash >= 0) {
            name = name.substring(lastSlash + 1);
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private CursorDumpToken peek() {
        return tokens.get(pos);
    }

    private CursorDumpToken previous() {
        return tokens.get(pos - 1);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().getType() == type;
    }

    private boolean check(TokenType type, int offset) {
        int index = pos + offset;
        return index < tokens.size() && tokens.get(index).getType() == type;
    }

    private CursorDumpToken advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }

    private CursorDumpToken expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw new DumpParseException("Expected " + type + " but found " + peek().getType()
                + (peek().getValue().isEmpty() ? "" : " '" + peek().getValue() + "'"), peek().getLine());
    }
}
