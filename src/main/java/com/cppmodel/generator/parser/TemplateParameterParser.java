package com.cppmodel.generator.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppmodel.generator.cursor.Cursor;
import com.cppmodel.generator.cursor.Token;
import com.cppmodel.generator.cursor.TokenKind;
import com.cppmodel.generator.model.TemplateParameter;
import com.cppmodel.generator.model.TemplateParameterKind;

/**
 * Collects the template parameters of a templated cursor from its
 * template-parameter children, in declaration order, or from the
 * {@code template <...>} headers spelled in front of a declaration.
 */
public class TemplateParameterParser {
    private static final Logger log = LoggerFactory.getLogger(TemplateParameterParser.class);

    public List<TemplateParameter> parse(Cursor templateCur) {
        List<TemplateParameter> parameters = new ArrayList<>();
        templateCur.visitChildren(child -> {
            switch (child.getKind()) {
                case TEMPLATE_TYPE_PARAMETER:
                    parameters.add(parseTypeParameter(child));
                    break;
                case NON_TYPE_TEMPLATE_PARAMETER:
                    parameters.add(parseNonTypeParameter(child));
                    break;
                case TEMPLATE_TEMPLATE_PARAMETER:
                    parameters.add(parseTemplateTemplateParameter(child));
                    break;
                default:
                    break;
            }
        });
        log.debug("Collected {} template parameter(s) of '{}'", parameters.size(), templateCur.getSpelling());
        return parameters;
    }

    private TemplateParameter parseTypeParameter(Cursor cur) {
        TokenStream stream = new TokenStream(cur.getTokens());
        String keyword = stream.skipIf("class") ? "class" : "typename";
        stream.skipIf("typename");
        boolean variadic = stream.skipIf("...");

        String spelling = keyword + (variadic ? "..." : "") + (cur.getSpelling().isEmpty() ? "" : " " + cur.getSpelling());
        return new TemplateParameter(TemplateParameterKind.TYPE, cur.getSpelling(), spelling,
                defaultValue(stream), variadic);
    }

    private TemplateParameter parseNonTypeParameter(Cursor cur) {
        TokenStream stream = new TokenStream(cur.getTokens());
        int nameIndex = stream.seekName(ScopeResolver.nameTokens(cur.getSpelling()));
        boolean variadic = nameIndex > 0 && stream.tokens().get(nameIndex - 1).getSpelling().equals("...");

        String type = cur.getType().isEmpty() ? "" : cur.getType().getSpelling();
        String spelling = type + (variadic ? "..." : "") + (cur.getSpelling().isEmpty() ? "" : " " + cur.getSpelling());
        return new TemplateParameter(TemplateParameterKind.NON_TYPE, cur.getSpelling(), spelling,
                nameIndex < 0 ? null : defaultValue(stream), variadic);
    }

    private TemplateParameter parseTemplateTemplateParameter(Cursor cur) {
        TokenStream stream = new TokenStream(cur.getTokens());
        int nameIndex = stream.seekName(ScopeResolver.nameTokens(cur.getSpelling()));
        int end = nameIndex < 0 ? stream.tokens().size() : nameIndex;
        boolean variadic = end > 0 && stream.tokens().get(end - 1).getSpelling().equals("...");

        String head = TokenSpelling.join(stream.tokens().subList(0, end));
        String spelling = head + (cur.getSpelling().isEmpty() ? "" : " " + cur.getSpelling());
        return new TemplateParameter(TemplateParameterKind.TEMPLATE, cur.getSpelling(), spelling,
                nameIndex < 0 ? null : defaultValue(stream), variadic);
    }

    /**
     * The default following the parameter name, {@code = value}.
     */
    private static String defaultValue(TokenStream stream) {
        while (!stream.done() && !stream.peekIs("=")) {
            stream.bump();
        }
        if (!stream.skipIf("=")) {
            return null;
        }
        String value = stream.remainder();
        return value.isEmpty() ? null : value;
    }

    /**
     * Reads the {@code template <...>} headers a declaration starts with,
     * outermost first. {@code template <>} gives an empty list.
     */
    public List<List<TemplateParameter>> parseHeaders(List<Token> tokens) {
        List<List<TemplateParameter>> headers = new ArrayList<>();
        int pos = 0;
        while (pos + 1 < tokens.size() && tokens.get(pos).getSpelling().equals("template")
                && tokens.get(pos + 1).getSpelling().equals("<")) {
            int close = topLevelIndexOf(tokens, ">", pos + 2, tokens.size());
            if (close < 0) {
                log.debug("Unbalanced template header in '{}'", TokenSpelling.join(tokens));
                break;
            }
            headers.add(parseHeader(tokens.subList(pos + 2, close)));
            pos = close + 1;
        }
        return headers;
    }

    private static List<TemplateParameter> parseHeader(List<Token> tokens) {
        List<TemplateParameter> parameters = new ArrayList<>();
        int start = 0;
        while (start < tokens.size()) {
            int comma = topLevelIndexOf(tokens, ",", start, tokens.size());
            int end = comma < 0 ? tokens.size() : comma;
            parameters.add(parameterOf(tokens.subList(start, end)));
            start = end + 1;
        }
        return parameters;
    }

    private static TemplateParameter parameterOf(List<Token> tokens) {
        int equals = topLevelIndexOf(tokens, "=", 0, tokens.size());
        List<Token> declaration = equals < 0 ? tokens : tokens.subList(0, equals);
        String defaultValue = equals < 0 ? "" : TokenSpelling.join(tokens.subList(equals + 1, tokens.size()));

        String first = declaration.isEmpty() ? "" : declaration.get(0).getSpelling();
        TemplateParameterKind kind;
        if (first.equals("template")) {
            kind = TemplateParameterKind.TEMPLATE;
        } else if (first.equals("typename") || first.equals("class")) {
            kind = TemplateParameterKind.TYPE;
        } else {
            kind = TemplateParameterKind.NON_TYPE;
        }

        Token last = declaration.isEmpty() ? null : declaration.get(declaration.size() - 1);
        String name = last != null && declaration.size() > 1 && last.getKind() == TokenKind.IDENTIFIER
                ? last.getSpelling()
                : "";
        boolean variadic = declaration.stream().anyMatch(token -> token.getSpelling().equals("..."));

        return new TemplateParameter(kind, name, TokenSpelling.join(declaration),
                defaultValue.isEmpty() ? null : defaultValue, variadic);
    }

    /**
     * Index of the first {@code spelling} in {@code [from, to)} outside any
     * bracket pair. Angle brackets only nest outside parentheses, so
     * {@code (1 > 2)} does not close a template argument list.
     */
    private static int topLevelIndexOf(List<Token> tokens, String spelling, int from, int to) {
        int nesting = 0;
        int angles = 0;
        for (int i = from; i < to; i++) {
            String current = tokens.get(i).getSpelling();
            if (nesting == 0 && angles == 0 && current.equals(spelling)) {
                return i;
            }
            switch (current) {
                case "(":
                case "[":
                case "{":
                    nesting++;
                    break;
                case ")":
                case "]":
                case "}":
                    nesting--;
                    break;
                case "<":
                    if (nesting == 0) {
                        angles++;
                    }
                    break;
                case ">":
                    if (nesting == 0) {
                        angles--;
                    }
                    break;
                default:
                    break;
            }
        }
        return -1;
    }
}
