package com.cppmodel.generator.parser;

import java.util.List;
import java.util.Set;

import com.cppmodel.generator.cursor.Cursor;
import com.cppmodel.generator.cursor.CursorType;
import com.cppmodel.generator.cursor.SourceTokenizer;
import com.cppmodel.generator.cursor.Token;
import com.cppmodel.generator.cursor.TokenKind;
import com.cppmodel.generator.model.CppType;
import com.cppmodel.generator.model.EntityId;
import com.cppmodel.generator.model.EntityRef;

/**
 * Classifies a type by its spelling alone.
 *
 * Types backed by a declaration become references to it, spellings made only
 * of fundamental type keywords, cv-qualifiers and declarator punctuation are
 * builtin, anything else is kept unexposed.
 */
public class SpellingTypeParser implements TypeParser {

    private static final Set<String> BUILTIN_WORDS = Set.of(
            "void", "bool", "char", "char8_t", "char16_t", "char32_t", "wchar_t", "short", "int", "long",
            "signed", "unsigned", "float", "double", "auto", "const", "volatile"
    );

    private static final Set<String> DECLARATOR_PUNCTUATION = Set.of("*", "&", "&&", "[", "]");

    @Override
    public CppType parse(ParseContext context, Cursor cur, CursorType type) {
        if (type == null || type.isEmpty()) {
            return CppType.unexposed("");
        }
        String spelling = type.getSpelling().trim();

        if (type.getDeclaration().isPresent()) {
            return CppType.userDefined(new EntityRef(EntityId.of(type.getDeclaration().get()), spelling));
        }
        return isBuiltin(spelling) ? CppType.builtin(spelling) : CppType.unexposed(spelling);
    }

    static boolean isBuiltin(String spelling) {
        List<Token> tokens = SourceTokenizer.tokenize(spelling);
        if (tokens.isEmpty()) {
            return false;
        }
        boolean sawType = false;
        for (Token token : tokens) {
            String value = token.getSpelling();
            if (BUILTIN_WORDS.contains(value)) {
                sawType |= !value.equals("const") && !value.equals("volatile");
            } else if (!DECLARATOR_PUNCTUATION.contains(value) && !isArrayBound(token)) {
                return false;
            }
        }
        return sawType;
    }

    private static boolean isArrayBound(Token token) {
        return token.getKind() == TokenKind.LITERAL
                && Character.isDigit(token.getSpelling().charAt(0));
    }
}
