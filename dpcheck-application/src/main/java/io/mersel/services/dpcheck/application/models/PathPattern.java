package io.mersel.services.dpcheck.application.models;

import com.fasterxml.jackson.databind.JsonNode;
import io.mersel.services.dpcheck.application.interfaces.ConfigException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derlenmiş yol deseni: bir veya daha fazla alternatifin birleşimi.
 * <p>
 * Her alternatif bir segment eşleyici dizisidir: sabit ad/indis, tek segmentlik joker
 * ({@code *}) veya sıfır ya da daha fazla segmenti karşılayan özyinelemeli joker ({@code ..}).
 * {@code ['a','b']} biçimindeki çoklu ad seçicileri alternatiflere açılır.
 * <p>
 * Kesişim operatörü ({@code &}) ve sözdizimi hataları derleme anında
 * {@link ConfigException} ile reddedilir. {@code $} ile başlamayan ifadeler köke göre yorumlanır.
 */
public final class PathPattern {

    /**
     * Tek bir segment eşleyici.
     *
     * @param type  Eşleyici türü
     * @param name  {@code NAME} için özellik adı
     * @param index {@code INDEX} için dizi indisi
     */
    public record Segment(Type type, String name, int index) {

        public enum Type { NAME, INDEX, WILDCARD, RECURSIVE }

        static Segment name(String name) {
            return new Segment(Type.NAME, name, -1);
        }

        static Segment index(int index) {
            return new Segment(Type.INDEX, null, index);
        }

        static Segment wildcard() {
            return new Segment(Type.WILDCARD, null, -1);
        }

        static Segment recursive() {
            return new Segment(Type.RECURSIVE, null, -1);
        }

        /** Tek bir somut segmenti kabul ediyor mu (özyinelemeli joker için anlamsız). */
        boolean accepts(Object segment) {
            return switch (type) {
                case NAME -> name.equals(segment);
                case INDEX -> segment instanceof Integer i && i == index;
                case WILDCARD -> true;
                case RECURSIVE -> false;
            };
        }

        @Override
        public String toString() {
            return switch (type) {
                case NAME -> DescriptorPath.renderSegment(name);
                case INDEX -> "[" + index + "]";
                case WILDCARD -> "[*]";
                case RECURSIVE -> "..";
            };
        }
    }

    /**
     * Descriptor üzerinde seçilen somut konum.
     */
    public record Match(DescriptorPath path, JsonNode node) {}

    private final String expression;
    private final List<List<Segment>> alternatives;

    private PathPattern(String expression, List<List<Segment>> alternatives) {
        this.expression = expression;
        this.alternatives = alternatives;
    }

    /**
     * İfadeyi derler.
     *
     * @throws ConfigException sözdizimi hatası veya kesişim operatörü
     */
    public static PathPattern compile(String expression) {
        List<PathTokenizer.Token> tokens = tokenize(expression);
        List<List<Segment>> alternatives = new ArrayList<>();
        for (List<PathTokenizer.Token> part : splitUnion(tokens, expression)) {
            alternatives.addAll(expand(toSegments(part, expression)));
        }
        return new PathPattern(expression, List.copyOf(alternatives));
    }

    /** Hazır segment listelerinden desen oluşturur (alternatifler zaten açılmış olmalı). */
    public static PathPattern of(String expression, List<List<Segment>> alternatives) {
        List<List<Segment>> copy = new ArrayList<>();
        for (List<Segment> alternative : alternatives) {
            copy.add(List.copyOf(alternative));
        }
        return new PathPattern(expression, List.copyOf(copy));
    }

    static List<PathTokenizer.Token> tokenize(String expression) {
        List<PathTokenizer.Token> tokens;
        try {
            tokens = PathTokenizer.tokenize(expression);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), e);
        }
        for (PathTokenizer.Token token : tokens) {
            if (token.kind() == PathTokenizer.Kind.INTERSECTION) {
                throw new ConfigException("Yol ifadesinde kesişim operatörü (&) desteklenmiyor: '" + expression + "'");
            }
        }
        return tokens;
    }

    static List<List<PathTokenizer.Token>> splitUnion(List<PathTokenizer.Token> tokens, String expression) {
        List<List<PathTokenizer.Token>> parts = new ArrayList<>();
        List<PathTokenizer.Token> current = new ArrayList<>();
        for (PathTokenizer.Token token : tokens) {
            if (token.kind() == PathTokenizer.Kind.UNION) {
                parts.add(requireNonEmpty(current, expression));
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }
        parts.add(requireNonEmpty(current, expression));
        return parts;
    }

    private static List<PathTokenizer.Token> requireNonEmpty(List<PathTokenizer.Token> part, String expression) {
        if (part.isEmpty()) {
            throw new ConfigException("Birleşim operatörünün (|) iki yanında da yol olmalı: '" + expression + "'");
        }
        return part;
    }

    /**
     * Bir alternatifin token'larını segment seçeneklerine çevirir. Çoklu ad seçicisi
     * birden fazla seçenek içerir; diğerleri tek seçeneklidir.
     */
    static List<List<Segment>> toSegments(List<PathTokenizer.Token> part, String expression) {
        List<List<Segment>> choices = new ArrayList<>();
        for (int i = 0; i < part.size(); i++) {
            PathTokenizer.Token token = part.get(i);
            switch (token.kind()) {
                case ROOT -> {
                    if (i != 0) {
                        throw new ConfigException("'$' yalnızca yolun başında olabilir: '" + expression + "'");
                    }
                }
                case NAME -> {
                    List<Segment> names = new ArrayList<>();
                    for (String name : token.names()) {
                        names.add(Segment.name(name));
                    }
                    choices.add(names);
                }
                case INDEX -> choices.add(List.of(Segment.index(token.index())));
                case WILDCARD -> choices.add(List.of(Segment.wildcard()));
                case RECURSIVE -> {
                    if (i == part.size() - 1) {
                        throw new ConfigException("'..' sonrasında seçici bekleniyor: '" + expression + "'");
                    }
                    if (part.get(i + 1).kind() == PathTokenizer.Kind.RECURSIVE) {
                        throw new ConfigException("Art arda '..' kullanılamaz: '" + expression + "'");
                    }
                    choices.add(List.of(Segment.recursive()));
                }
                default -> throw new ConfigException("Beklenmeyen operatör: '" + expression + "'");
            }
        }
        return choices;
    }

    static List<List<Segment>> expand(List<List<Segment>> choices) {
        List<List<Segment>> result = new ArrayList<>();
        result.add(List.of());
        for (List<Segment> options : choices) {
            List<List<Segment>> next = new ArrayList<>();
            for (List<Segment> prefix : result) {
                for (Segment option : options) {
                    List<Segment> extended = new ArrayList<>(prefix);
                    extended.add(option);
                    next.add(List.copyOf(extended));
                }
            }
            result = next;
        }
        return result;
    }

    public String expression() {
        return expression;
    }

    public List<List<Segment>> alternatives() {
        return alternatives;
    }

    /**
     * Yolun herhangi bir alternatifle yapısal olarak eşleşip eşleşmediği.
     * Descriptor'a bakılmaz.
     */
    public boolean matches(DescriptorPath path) {
        for (List<Segment> alternative : alternatives) {
            if (matchFrom(alternative, 0, path.segments(), 0)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchFrom(List<Segment> pattern, int pi, List<Object> path, int si) {
        if (pi == pattern.size()) {
            return si == path.size();
        }
        Segment segment = pattern.get(pi);
        if (segment.type() == Segment.Type.RECURSIVE) {
            for (int k = si; k <= path.size(); k++) {
                if (matchFrom(pattern, pi + 1, path, k)) {
                    return true;
                }
            }
            return false;
        }
        return si < path.size()
                && segment.accepts(path.get(si))
                && matchFrom(pattern, pi + 1, path, si + 1);
    }

    /**
     * Descriptor içinde desenle eşleşen tüm somut konumları yol sırasına göre döner.
     */
    public List<Match> select(JsonNode root) {
        Map<DescriptorPath, JsonNode> found = new TreeMap<>();
        if (root != null) {
            for (List<Segment> alternative : alternatives) {
                collect(alternative, 0, root, DescriptorPath.root(), found);
            }
        }
        List<Match> matches = new ArrayList<>(found.size());
        for (var entry : found.entrySet()) {
            matches.add(new Match(entry.getKey(), entry.getValue()));
        }
        return matches;
    }

    private static void collect(List<Segment> pattern, int pi, JsonNode node, DescriptorPath path,
                                Map<DescriptorPath, JsonNode> out) {
        if (pi == pattern.size()) {
            out.putIfAbsent(path, node);
            return;
        }
        Segment segment = pattern.get(pi);
        switch (segment.type()) {
            case RECURSIVE -> {
                collect(pattern, pi + 1, node, path, out);
                forEachChild(node, path, (childPath, child) -> collect(pattern, pi, child, childPath, out));
            }
            case WILDCARD -> forEachChild(node, path,
                    (childPath, child) -> collect(pattern, pi + 1, child, childPath, out));
            case NAME -> {
                if (node.isObject() && node.has(segment.name())) {
                    collect(pattern, pi + 1, node.get(segment.name()), path.child(segment.name()), out);
                }
            }
            case INDEX -> {
                if (node.isArray() && segment.index() < node.size()) {
                    collect(pattern, pi + 1, node.get(segment.index()), path.index(segment.index()), out);
                }
            }
        }
    }

    private interface ChildVisitor {
        void visit(DescriptorPath path, JsonNode child);
    }

    private static void forEachChild(JsonNode node, DescriptorPath path, ChildVisitor visitor) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                visitor.visit(path.child(field.getKey()), field.getValue());
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                visitor.visit(path.index(i), node.get(i));
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PathPattern other && alternatives.equals(other.alternatives);
    }

    @Override
    public int hashCode() {
        return alternatives.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
