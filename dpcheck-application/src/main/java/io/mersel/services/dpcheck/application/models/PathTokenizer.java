package io.mersel.services.dpcheck.application.models;

import java.util.ArrayList;
import java.util.List;

/**
 * JSONPath alt kümesi için sözcük çözümleyici.
 * <p>
 * Desteklenen biçimler: {@code $}, {@code .name}, {@code ['name']}, {@code ['a','b']},
 * {@code [0]}, {@code .*}, {@code [*]}, {@code ..}, birleşim {@code |} ve kesişim {@code &}.
 * Kesişim burada yalnızca token olarak tanınır; reddi {@link PathPattern}'e aittir.
 * Sözdizimi hataları {@link IllegalArgumentException} ile bildirilir.
 */
final class PathTokenizer {

    private PathTokenizer() {}

    enum Kind { ROOT, NAME, INDEX, WILDCARD, RECURSIVE, UNION, INTERSECTION }

    record Token(Kind kind, List<String> names, int index, int position) {

        static Token of(Kind kind, int position) {
            return new Token(kind, List.of(), -1, position);
        }

        static Token name(List<String> names, int position) {
            return new Token(Kind.NAME, List.copyOf(names), -1, position);
        }

        static Token index(int index, int position) {
            return new Token(Kind.INDEX, List.of(), index, position);
        }
    }

    static List<Token> tokenize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Yol ifadesi boş olamaz");
        }
        String s = expression;
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '$' && isSegmentStart(tokens)) {
                tokens.add(Token.of(Kind.ROOT, i));
                i++;
            } else if (c == '|') {
                tokens.add(Token.of(Kind.UNION, i));
                i++;
            } else if (c == '&') {
                tokens.add(Token.of(Kind.INTERSECTION, i));
                i++;
            } else if (c == '.') {
                if (i + 1 < s.length() && s.charAt(i + 1) == '.') {
                    tokens.add(Token.of(Kind.RECURSIVE, i));
                    i += 2;
                    // "..name" ve "..*" kısaltmaları; "..[" ise sonraki turda işlenir
                    if (i < s.length() && s.charAt(i) != '[') {
                        i = readDotSelector(s, i, tokens, expression);
                    }
                } else {
                    i = readDotSelector(s, i + 1, tokens, expression);
                }
            } else if (c == '[') {
                i = readBracket(s, i, tokens, expression);
            } else if (isNameChar(c) && isSegmentStart(tokens)) {
                // "$" olmadan başlayan göreli ifade: ilk ad
                int end = readName(s, i);
                tokens.add(Token.name(List.of(s.substring(i, end)), i));
                i = end;
            } else {
                throw syntaxError(expression, i, "beklenmeyen karakter '" + c + "'");
            }
        }
        return tokens;
    }

    private static boolean isSegmentStart(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return true;
        }
        Kind last = tokens.get(tokens.size() - 1).kind();
        return last == Kind.UNION || last == Kind.INTERSECTION;
    }

    private static int readDotSelector(String s, int i, List<Token> tokens, String expression) {
        if (i >= s.length()) {
            throw syntaxError(expression, i, "'.' sonrasında seçici bekleniyor");
        }
        if (s.charAt(i) == '*') {
            tokens.add(Token.of(Kind.WILDCARD, i));
            return i + 1;
        }
        int end = readName(s, i);
        if (end == i) {
            throw syntaxError(expression, i, "'.' sonrasında ad bekleniyor");
        }
        tokens.add(Token.name(List.of(s.substring(i, end)), i));
        return end;
    }

    private static int readName(String s, int start) {
        int i = start;
        while (i < s.length() && isNameChar(s.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isNameChar(char c) {
        return !Character.isWhitespace(c) && ".[]|&'\"*,".indexOf(c) < 0;
    }

    private static int readBracket(String s, int open, List<Token> tokens, String expression) {
        int i = skipSpaces(s, open + 1);
        if (i >= s.length()) {
            throw syntaxError(expression, open, "kapanmamış '['");
        }
        char c = s.charAt(i);
        if (c == '*') {
            i = expect(s, skipSpaces(s, i + 1), ']', expression);
            tokens.add(Token.of(Kind.WILDCARD, open));
            return i;
        }
        if (Character.isDigit(c)) {
            int end = i;
            while (end < s.length() && Character.isDigit(s.charAt(end))) {
                end++;
            }
            int index;
            try {
                index = Integer.parseInt(s.substring(i, end));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Geçersiz yol ifadesi '" + expression + "' (konum " + i + "): indis çok büyük", e);
            }
            i = expect(s, skipSpaces(s, end), ']', expression);
            tokens.add(Token.index(index, open));
            return i;
        }
        if (c == '\'' || c == '"') {
            List<String> names = new ArrayList<>();
            while (true) {
                char quote = s.charAt(i);
                if (quote != '\'' && quote != '"') {
                    throw syntaxError(expression, i, "tırnaklı ad bekleniyor");
                }
                StringBuilder name = new StringBuilder();
                i++;
                while (i < s.length() && s.charAt(i) != quote) {
                    if (s.charAt(i) == '\\' && i + 1 < s.length()) {
                        i++;
                    }
                    name.append(s.charAt(i));
                    i++;
                }
                if (i >= s.length()) {
                    throw syntaxError(expression, i, "kapanmamış tırnak");
                }
                names.add(name.toString());
                i = skipSpaces(s, i + 1);
                if (i < s.length() && s.charAt(i) == ',') {
                    i = skipSpaces(s, i + 1);
                    if (i >= s.length()) {
                        throw syntaxError(expression, i, "kapanmamış '['");
                    }
                    continue;
                }
                i = expect(s, i, ']', expression);
                tokens.add(Token.name(names, open));
                return i;
            }
        }
        throw syntaxError(expression, i, "'[' içinde '*', indis veya tırnaklı ad bekleniyor");
    }

    private static int skipSpaces(String s, int i) {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int expect(String s, int i, char expected, String expression) {
        if (i >= s.length() || s.charAt(i) != expected) {
            throw syntaxError(expression, i, "'" + expected + "' bekleniyor");
        }
        return i + 1;
    }

    private static IllegalArgumentException syntaxError(String expression, int position, String detail) {
        return new IllegalArgumentException(
                "Geçersiz yol ifadesi '" + expression + "' (konum " + position + "): " + detail);
    }
}
