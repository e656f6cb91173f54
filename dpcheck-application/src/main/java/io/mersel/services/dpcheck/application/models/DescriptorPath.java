package io.mersel.services.dpcheck.application.models;

import com.fasterxml.jackson.core.JsonPointer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Descriptor içindeki bir konum: özellik adları ({@link String}) ve dizi indislerinden
 * ({@link Integer}) oluşan sıralı segment listesi.
 * <p>
 * Metin gösterimi {@code $.resources[0].schema.primaryKey} biçimindedir; düz tanımlayıcı
 * olmayan adlar {@code $['odd key']} olarak yazılır. İki yol, segment dizileri eşitse eşittir.
 * <p>
 * Sıralama segment segment yapılır: adlar sözlük sırasıyla, indisler sayısal olarak
 * karşılaştırılır; aynı konumda ad, indisten önce gelir; önek olan yol önce sıralanır.
 *
 * @param segments Segment listesi (her eleman {@code String} veya {@code Integer})
 */
public record DescriptorPath(List<Object> segments) implements Comparable<DescriptorPath> {

    private static final DescriptorPath ROOT = new DescriptorPath(List.of());
    private static final Pattern PLAIN_NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$-]*");

    public DescriptorPath {
        if (segments == null) {
            segments = List.of();
        }
        for (Object segment : segments) {
            if (!(segment instanceof String) && !(segment instanceof Integer)) {
                throw new IllegalArgumentException("Geçersiz yol segmenti: " + segment);
            }
            if (segment instanceof Integer index && index < 0) {
                throw new IllegalArgumentException("Negatif dizi indisi: " + index);
            }
        }
        segments = Collections.unmodifiableList(new ArrayList<>(segments));
    }

    public static DescriptorPath root() {
        return ROOT;
    }

    public static DescriptorPath of(Object... segments) {
        return new DescriptorPath(List.of(segments));
    }

    /**
     * {@link #toString()} gösterimini geri okur. Joker veya birleşim içeren ifadeler kabul edilmez.
     *
     * @throws IllegalArgumentException somut bir yol değilse
     */
    public static DescriptorPath parse(String text) {
        List<PathTokenizer.Token> tokens = PathTokenizer.tokenize(text);
        List<Object> segments = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            PathTokenizer.Token token = tokens.get(i);
            switch (token.kind()) {
                case ROOT -> {
                    if (i != 0) {
                        throw new IllegalArgumentException("'$' yalnızca başta olabilir: " + text);
                    }
                }
                case NAME -> {
                    if (token.names().size() != 1) {
                        throw new IllegalArgumentException("Somut yol birden fazla ad içeremez: " + text);
                    }
                    segments.add(token.names().get(0));
                }
                case INDEX -> segments.add(token.index());
                default -> throw new IllegalArgumentException("Somut yol joker veya operatör içeremez: " + text);
            }
        }
        return new DescriptorPath(segments);
    }

    public DescriptorPath child(String name) {
        return append(name);
    }

    public DescriptorPath index(int index) {
        return append(index);
    }

    private DescriptorPath append(Object segment) {
        List<Object> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new DescriptorPath(next);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int size() {
        return segments.size();
    }

    public Object segment(int i) {
        return segments.get(i);
    }

    /** Son segment; kök için {@code null}. */
    public Object last() {
        return segments.isEmpty() ? null : segments.get(segments.size() - 1);
    }

    /** Üst konum; kökün üstü yine köktür. */
    public DescriptorPath parent() {
        return segments.isEmpty() ? this : new DescriptorPath(segments.subList(0, segments.size() - 1));
    }

    /** Sondan {@code count} segment kırpılmış yol. */
    public DescriptorPath trim(int count) {
        if (count <= 0) {
            return this;
        }
        if (count >= segments.size()) {
            return ROOT;
        }
        return new DescriptorPath(segments.subList(0, segments.size() - count));
    }

    public boolean startsWith(DescriptorPath prefix) {
        return prefix.segments.size() <= segments.size()
                && segments.subList(0, prefix.segments.size()).equals(prefix.segments);
    }

    /** Jackson {@link JsonPointer} karşılığı ({@code JsonNode.at} ile okumak için). */
    public JsonPointer toJsonPointer() {
        JsonPointer pointer = JsonPointer.empty();
        for (Object segment : segments) {
            pointer = segment instanceof Integer index
                    ? pointer.appendIndex(index)
                    : pointer.appendProperty((String) segment);
        }
        return pointer;
    }

    @Override
    public int compareTo(DescriptorPath other) {
        int common = Math.min(segments.size(), other.segments.size());
        for (int i = 0; i < common; i++) {
            int cmp = compareSegments(segments.get(i), other.segments.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(segments.size(), other.segments.size());
    }

    private static int compareSegments(Object a, Object b) {
        if (a instanceof Integer ia && b instanceof Integer ib) {
            return Integer.compare(ia, ib);
        }
        if (a instanceof String sa && b instanceof String sb) {
            return sa.compareTo(sb);
        }
        return a instanceof String ? -1 : 1;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("$");
        for (Object segment : segments) {
            appendSegment(sb, segment);
        }
        return sb.toString();
    }

    /** Tek bir segmentin gösterimi ({@code .name}, {@code [0]} veya {@code ['odd key']}). */
    public static String renderSegment(Object segment) {
        StringBuilder sb = new StringBuilder();
        appendSegment(sb, segment);
        return sb.toString();
    }

    private static void appendSegment(StringBuilder sb, Object segment) {
        if (segment instanceof Integer index) {
            sb.append('[').append(index).append(']');
        } else {
            String name = (String) segment;
            if (PLAIN_NAME.matcher(name).matches()) {
                sb.append('.').append(name);
            } else {
                sb.append("['").append(name.replace("\\", "\\\\").replace("'", "\\'")).append("']");
            }
        }
    }
}
