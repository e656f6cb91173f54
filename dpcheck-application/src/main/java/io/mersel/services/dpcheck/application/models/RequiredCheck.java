package io.mersel.services.dpcheck.application.models;

import io.mersel.services.dpcheck.application.interfaces.ConfigException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.StringJoiner;

/**
 * Zorunlu alan kuralı.
 * <p>
 * İfade, {@code |} ile ayrılmış alternatif zorunlu kümelerden oluşur. Her alternatif
 * bir üst konum deseni ve o konumda bulunması gereken adlardır:
 * <ul>
 *   <li>{@code $.description}: kökte {@code description}</li>
 *   <li>{@code $.resources[*].title}: her kaynakta {@code title}</li>
 *   <li>{@code $['licenses','sources']}: kökte ikisi birden</li>
 *   <li>{@code $.resources[*].path | $.resources[*].data}: her kaynakta en az biri</li>
 * </ul>
 * İfade bir ad seçicisiyle bitmelidir. Sondaki {@code ..}, joker veya indis,
 * {@code $..name} biçimi, kesişim operatörü ve sözdizimi hataları {@link ConfigException}
 * ile reddedilir. Yalnızca {@code $} içeren alternatif hiçbir şey üretmez.
 *
 * @param jsonpath Zorunlu alan ifadesi
 * @param message  Bulgu mesajı ({@code null} ise varsayılan mesaj üretilir)
 */
public record RequiredCheck(String jsonpath, String message) {

    public RequiredCheck {
        if (jsonpath == null || jsonpath.isBlank()) {
            throw new ConfigException("Zorunlu alan ifadesi boş olamaz");
        }
        message = message == null || message.isBlank() ? null : message;
        parse(jsonpath);
    }

    public RequiredCheck(String jsonpath) {
        this(jsonpath, null);
    }

    /**
     * Tek bir zorunlu küme.
     *
     * @param parent Alanların aranacağı üst konum deseni
     * @param fields Üst konumda birlikte bulunması gereken adlar (bildirim sırasıyla)
     */
    public record Alternative(PathPattern parent, List<String> fields) {

        /** Örn. {@code {title}} veya {@code {licenses, sources}}. */
        public String describe() {
            StringJoiner joiner = new StringJoiner(", ", "{", "}");
            fields.forEach(joiner::add);
            return joiner.toString();
        }
    }

    public List<Alternative> alternatives() {
        return parse(jsonpath);
    }

    private static List<Alternative> parse(String jsonpath) {
        List<PathTokenizer.Token> tokens = PathPattern.tokenize(jsonpath);
        List<Alternative> alternatives = new ArrayList<>();
        for (List<PathTokenizer.Token> part : PathPattern.splitUnion(tokens, jsonpath)) {
            if (part.size() == 1 && part.get(0).kind() == PathTokenizer.Kind.ROOT) {
                continue;
            }
            PathTokenizer.Token last = part.get(part.size() - 1);
            if (last.kind() != PathTokenizer.Kind.NAME) {
                throw new ConfigException(
                        "Zorunlu alan ifadesi bir ad seçicisiyle bitmeli ('..', joker veya indisle değil): '"
                                + jsonpath + "'");
            }
            if (part.size() >= 2 && part.get(part.size() - 2).kind() == PathTokenizer.Kind.RECURSIVE) {
                throw new ConfigException(
                        "Zorunlu alan ifadesi '..name' biçiminde bitemez, üst konum belirtilmeli: '"
                                + jsonpath + "'");
            }
            List<PathTokenizer.Token> parentTokens = part.subList(0, part.size() - 1);
            List<List<PathPattern.Segment>> parentAlternatives =
                    PathPattern.expand(PathPattern.toSegments(parentTokens, jsonpath));
            PathPattern parent = PathPattern.of(render(parentAlternatives), parentAlternatives);
            alternatives.add(new Alternative(parent, List.copyOf(new LinkedHashSet<>(last.names()))));
        }
        return List.copyOf(alternatives);
    }

    private static String render(List<List<PathPattern.Segment>> alternatives) {
        StringJoiner union = new StringJoiner(" | ");
        for (List<PathPattern.Segment> alternative : alternatives) {
            StringBuilder sb = new StringBuilder("$");
            alternative.forEach(sb::append);
            union.add(sb.toString());
        }
        return union.toString();
    }
}
