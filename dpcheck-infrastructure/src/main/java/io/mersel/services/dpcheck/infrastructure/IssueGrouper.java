package io.mersel.services.dpcheck.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import io.mersel.services.dpcheck.application.models.CheckKind;
import io.mersel.services.dpcheck.application.models.DescriptorPath;
import io.mersel.services.dpcheck.application.models.Issue;
import io.mersel.services.dpcheck.application.models.SchemaViolation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Ham şema ihlallerini anlamlı bulgulara dönüştürür, tekilleştirir ve sıralar.
 * <p>
 * Ayrıştırıcı şemalar ({@code anyOf}/{@code oneOf}) her dal için ayrı hata üretir: geçersiz
 * bir lisans veya tanınmayan bir alan tipi onlarca ham ihlale dönüşür. Gruplama anahtarı,
 * şema yolundaki en dıştaki bileşik işaret ile bu yapının descriptor'daki konumudur.
 * Her grup aşağıdaki tabloyla, ilk eşleşen satıra göre tek bir bulguya indirgenir:
 * <ol>
 *   <li>Lisans biçimli konum ({@code ...licenses[n]}) → {@code LicenseViolation}</li>
 *   <li>Tüm üyeler yapının kendisinde {@code required} → alternatifleri sayan {@code RequiredViolation};
 *       her dalda eksik olan alan ayrıca kendi konumunda raporlanır</li>
 *   <li>Dal hatası olmayan {@code oneOf} (birden fazla dal geçerli) → tek {@code oneOf} bulgusu</li>
 *   <li>Biçim ayrımı: yapıyla tip uyuşmazlığı olan dallar ve ayırıcı alanı tutmayan dallar elenir,
 *       kalanlardan en az hatalı dalın üyeleri bir iç seviyede yeniden gruplanır</li>
 *   <li>Tüm üyeler aynı konumda {@code enum}/{@code const} → izinli değerlerin birleşimiyle {@code EnumViolation}</li>
 *   <li>Diğer durumlar → üye mesajlarını özetleyen tek standart ihlal</li>
 * </ol>
 * Ayırıcı alan, yapının doğrudan alt alanlarından en az iki dalda {@code enum}/{@code const}
 * ile düşen ve en çok dalda düşenidir (alan tanımındaki {@code type} gibi). Tek dalda düşen
 * bir değer kümesi ({@code fieldsMatch}, {@code format}) dalı elemez, iç seviyede
 * {@code EnumViolation} olarak raporlanır.
 */
final class IssueGrouper {

    private IssueGrouper() {}

    private static final Set<String> COMPOUND_MARKERS = Set.of("anyOf", "oneOf");
    private static final Set<String> VALUE_KEYWORDS = Set.of("enum", "const");
    private static final String REQUIRED = "required";

    /** Ardından bir ad veya indis gelen, descriptor'da ilerlemeyen şema anahtar kelimeleri. */
    private static final Set<String> NAMED_CONTAINERS = Set.of(
            "definitions", "$defs", "dependencies", "dependentSchemas", "allOf", "anyOf", "oneOf");

    private static final Comparator<Issue> FINAL_ORDER = Comparator
            .comparing(Issue::path)
            .thenComparing(Issue::message)
            .thenComparing(issue -> issue.source().category())
            .thenComparing(issue -> issue.source().name());

    private record GroupKey(List<Object> evaluationPrefix, DescriptorPath construct) {}

    // ── Gruplama ────────────────────────────────────────────────────

    /**
     * Ham ihlalleri bulgulara dönüştürür.
     *
     * @param violations     Doğrulayıcı çıktısı
     * @param descriptor     Hatalı değerleri mesaja eklemek için okunur
     * @param recommendation Öneri şemasından mı geliyor ({@code StandardRecommendation} üretir)
     */
    static List<Issue> collapse(List<SchemaViolation> violations, JsonNode descriptor, boolean recommendation) {
        return collapse(violations, 0, descriptor, recommendation);
    }

    private static List<Issue> collapse(List<SchemaViolation> violations, int from,
                                        JsonNode descriptor, boolean recommendation) {
        List<Issue> issues = new ArrayList<>();
        Map<GroupKey, List<SchemaViolation>> groups = new LinkedHashMap<>();
        Map<GroupKey, Integer> markers = new LinkedHashMap<>();

        for (SchemaViolation violation : violations) {
            int marker = markerIndex(violation.evaluationPath(), from);
            if (marker < 0) {
                issues.add(leaf(violation, descriptor, recommendation));
                continue;
            }
            var key = new GroupKey(
                    violation.evaluationPath().segments().subList(0, marker + 1),
                    constructPath(violation, marker));
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(violation);
            markers.put(key, marker);
        }

        for (var entry : groups.entrySet()) {
            issues.addAll(summarize(entry.getKey().construct(), markers.get(entry.getKey()),
                    entry.getValue(), descriptor, recommendation));
        }
        return issues;
    }

    private static List<Issue> summarize(DescriptorPath construct, int marker, List<SchemaViolation> members,
                                         JsonNode descriptor, boolean recommendation) {
        String keyword = (String) members.get(0).evaluationPath().segment(marker);
        List<SchemaViolation> children = members.stream()
                .filter(v -> v.evaluationPath().size() - 1 > marker)
                .toList();

        // 1. Lisans
        if (isLicenseShaped(construct)) {
            return List.of(licenseIssue(construct, children, recommendation));
        }

        // 2. Zorunlu alan alternatifleri
        if (!children.isEmpty() && children.stream().allMatch(
                v -> REQUIRED.equals(v.keyword()) && v.instancePath().equals(construct))) {
            return requiredAlternativesIssues(construct, marker, children, recommendation);
        }

        // 3. Dal hatası olmayan bileşik
        if (children.isEmpty()) {
            String message = "oneOf".equals(keyword)
                    ? "must match exactly one of the allowed shapes, but matches more than one"
                    : "does not match any of the allowed shapes";
            return List.of(new Issue(construct, message, kind(keyword, recommendation)));
        }

        // 4. Biçim ayrımı
        Map<Integer, List<SchemaViolation>> branches = new TreeMap<>();
        for (SchemaViolation child : children) {
            branches.computeIfAbsent(branchIndex(child, marker), k -> new ArrayList<>()).add(child);
        }
        Map<Integer, List<SchemaViolation>> compatible = new TreeMap<>();
        branches.forEach((index, branch) -> {
            if (!isMismatched(branch, construct, marker)) {
                compatible.put(index, branch);
            }
        });
        String tag = discriminator(compatible.values(), construct, marker);
        if (tag != null) {
            compatible.values().removeIf(branch -> childValueFailures(branch, construct, marker).contains(tag));
        }
        List<SchemaViolation> best = null;
        for (List<SchemaViolation> branch : compatible.values()) {
            if (best == null || branch.size() < best.size()) {
                best = branch;
            }
        }
        if (best != null) {
            return collapse(best, marker + 2, descriptor, recommendation);
        }

        // 5. Değer kümesi
        DescriptorPath valuePath = children.get(0).instancePath();
        if (children.stream().allMatch(v -> VALUE_KEYWORDS.contains(v.keyword()) && v.instancePath().equals(valuePath))) {
            Set<String> allowed = new TreeSet<>();
            children.forEach(v -> allowed.addAll(v.allowedValues()));
            return List.of(enumIssue(valuePath, allowed, descriptor, recommendation));
        }

        // 6. Özet
        Set<String> messages = new TreeSet<>();
        children.forEach(v -> messages.add(v.message()));
        return List.of(new Issue(
                construct,
                "does not match any of the allowed shapes: " + String.join("; ", messages),
                kind(keyword, recommendation),
                Map.of("branches", branches.size())));
    }

    // ── Tablo satırları ─────────────────────────────────────────────

    private static Issue licenseIssue(DescriptorPath construct, List<SchemaViolation> children, boolean recommendation) {
        Set<String> alternatives = new TreeSet<>();
        Set<String> otherMessages = new TreeSet<>();
        for (SchemaViolation child : children) {
            if (REQUIRED.equals(child.keyword()) && child.property() != null) {
                alternatives.add(child.property());
            } else {
                otherMessages.add(child.message());
            }
        }
        String message;
        if (otherMessages.isEmpty() && !alternatives.isEmpty()) {
            message = "license must have at least " + orList(alternatives);
        } else if (otherMessages.isEmpty()) {
            message = "license does not match any of the allowed shapes";
        } else {
            message = "invalid license: " + String.join("; ", otherMessages);
        }
        Map<String, Object> context = Map.of("alternatives", List.copyOf(alternatives));
        CheckKind kind = recommendation ? CheckKind.standardRecommendation(CheckKind.LICENSE) : CheckKind.licenseViolation();
        return new Issue(construct, message, kind, context);
    }

    private static List<Issue> requiredAlternativesIssues(DescriptorPath construct, int marker,
                                                          List<SchemaViolation> children, boolean recommendation) {
        Map<Integer, Set<String>> byBranch = new TreeMap<>();
        for (SchemaViolation child : children) {
            if (child.property() != null) {
                byBranch.computeIfAbsent(branchIndex(child, marker), k -> new TreeSet<>()).add(child.property());
            }
        }
        List<Issue> issues = new ArrayList<>();
        if (byBranch.isEmpty()) {
            return issues;
        }
        // Her dalda eksik olan alan alternatif değildir: {name, data} / {name, path}
        Set<String> common = new TreeSet<>(byBranch.values().iterator().next());
        byBranch.values().forEach(common::retainAll);
        for (String property : common) {
            issues.add(requiredIssue(construct, property, recommendation));
        }

        // Her dal kendi eksik alan kümesi; "'path' or 'data'" biçiminde
        Set<String> alternatives = new LinkedHashSet<>();
        for (Set<String> fields : byBranch.values()) {
            Set<String> remaining = new TreeSet<>(fields);
            remaining.removeAll(common);
            if (remaining.isEmpty()) {
                return issues;
            }
            alternatives.add(remaining.stream().map(f -> "'" + f + "'").collect(Collectors.joining(" and ")));
        }
        List<String> sorted = new ArrayList<>(alternatives);
        sorted.sort(null);
        String message = sorted.size() == 1
                ? sorted.get(0) + " is required"
                : "at least one of " + String.join(" or ", sorted) + " is required";
        CheckKind kind = recommendation ? CheckKind.standardRecommendation(REQUIRED) : CheckKind.requiredViolation();
        issues.add(new Issue(construct, message, kind, Map.of("alternatives", sorted)));
        return issues;
    }

    private static Issue requiredIssue(DescriptorPath parent, String property, boolean recommendation) {
        CheckKind kind = recommendation ? CheckKind.standardRecommendation(REQUIRED) : CheckKind.requiredViolation();
        return new Issue(parent.child(property), "'" + property + "' is a required property", kind);
    }

    private static Issue enumIssue(DescriptorPath path, Set<String> allowed, JsonNode descriptor, boolean recommendation) {
        String quoted = allowed.stream().map(v -> "'" + v + "'").collect(Collectors.joining(", "));
        String actual = valueAt(descriptor, path);
        String message = actual != null
                ? "'" + actual + "' is not one of the allowed values: " + quoted
                : "value is not one of the allowed values: " + quoted;
        CheckKind kind = recommendation ? CheckKind.standardRecommendation(CheckKind.ENUM) : CheckKind.enumViolation();
        return new Issue(path, message, kind, Map.of("allowedValues", List.copyOf(allowed)));
    }

    /**
     * Bileşik yapı dışında kalan tek ihlal.
     * {@code required} ihlalinin konumu eksik alanın kendisidir.
     */
    private static Issue leaf(SchemaViolation violation, JsonNode descriptor, boolean recommendation) {
        String keyword = violation.keyword();
        if (REQUIRED.equals(keyword) && violation.property() != null) {
            return requiredIssue(violation.instancePath(), violation.property(), recommendation);
        }
        if (VALUE_KEYWORDS.contains(keyword) && !violation.allowedValues().isEmpty()) {
            return enumIssue(violation.instancePath(), new TreeSet<>(violation.allowedValues()), descriptor, recommendation);
        }
        return new Issue(violation.instancePath(), violation.message(), kind(keyword, recommendation));
    }

    private static CheckKind kind(String keyword, boolean recommendation) {
        return recommendation ? CheckKind.standardRecommendation(keyword) : CheckKind.standardViolation(keyword);
    }

    // ── Şema yolu çözümleme ─────────────────────────────────────────

    /**
     * {@code from} konumundan itibaren ilk {@code anyOf}/{@code oneOf} işaretinin indisi, yoksa -1.
     * {@code properties/oneOf} gibi özellik adları işaret sayılmaz.
     */
    static int markerIndex(DescriptorPath evaluationPath, int from) {
        List<Object> segments = evaluationPath.segments();
        int i = 0;
        while (i < segments.size()) {
            Object segment = segments.get(i);
            if (!(segment instanceof String name)) {
                i++;
                continue;
            }
            if (i >= from && COMPOUND_MARKERS.contains(name)) {
                return i;
            }
            i += stepWidth(segments, i);
        }
        return -1;
    }

    /**
     * Yapının descriptor'daki konumu: ihlalin konumundan, işaretten sonra descriptor'da
     * ilerleyen şema adımları kadar segment kırpılır.
     */
    static DescriptorPath constructPath(SchemaViolation violation, int marker) {
        List<Object> segments = violation.evaluationPath().segments();
        int last = segments.size() - 1;
        if (marker >= last) {
            return violation.instancePath();
        }
        int descending = 0;
        int i = marker + 2;
        while (i < last) {
            Object segment = segments.get(i);
            int width = segment instanceof String ? stepWidth(segments, i) : 1;
            if (segment instanceof String name) {
                switch (name) {
                    case "properties", "patternProperties", "prefixItems" -> descending++;
                    case "additionalProperties", "items", "additionalItems", "contains", "unevaluatedItems",
                         "unevaluatedProperties" -> {
                        descending++;
                        // tuple biçimli items: ardından dal indisi gelir
                        if (i + 1 < last && isIndex(segments.get(i + 1))) {
                            width = 2;
                        }
                    }
                    default -> {
                        // $ref, if/then/else, not, allOf... descriptor'da ilerlemez
                    }
                }
            }
            i += width;
        }
        if (descending > violation.instancePath().size()) {
            return violation.instancePath();
        }
        return violation.instancePath().trim(descending);
    }

    private static int stepWidth(List<Object> segments, int i) {
        String name = (String) segments.get(i);
        boolean named = NAMED_CONTAINERS.contains(name)
                || "properties".equals(name) || "patternProperties".equals(name) || "prefixItems".equals(name);
        return named && i + 1 < segments.size() - 1 ? 2 : 1;
    }

    private static int branchIndex(SchemaViolation violation, int marker) {
        Object segment = violation.evaluationPath().segment(marker + 1);
        if (segment instanceof Integer index) {
            return index;
        }
        return isIndex(segment) ? Integer.parseInt(segment.toString()) : -1;
    }

    private static boolean isIndex(Object segment) {
        return segment instanceof Integer || (segment instanceof String s && !s.isEmpty() && s.chars().allMatch(Character::isDigit));
    }

    /**
     * Dal, yapının biçimini hiç karşılamıyor mu: yapının kendisinde tip veya değer kümesi
     * uyuşmazlığı (iç bileşik dışında).
     */
    private static boolean isMismatched(List<SchemaViolation> branch, DescriptorPath construct, int marker) {
        for (SchemaViolation violation : branch) {
            if (!violation.instancePath().equals(construct)) {
                continue;
            }
            if ("type".equals(violation.keyword())) {
                return true;
            }
            if (VALUE_KEYWORDS.contains(violation.keyword()) && markerIndex(violation.evaluationPath(), marker + 2) < 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Dalların ayırıcı alanı: en az iki dalda değer kümesiyle düşen doğrudan alt alanlardan
     * en çok dalda düşeni. Eşitlikte ada göre ilki; yoksa {@code null}.
     */
    static String discriminator(Collection<List<SchemaViolation>> branches, DescriptorPath construct, int marker) {
        Map<String, Integer> counts = new TreeMap<>();
        for (List<SchemaViolation> branch : branches) {
            childValueFailures(branch, construct, marker).forEach(name -> counts.merge(name, 1, Integer::sum));
        }
        String tag = null;
        int max = 1;
        for (var entry : counts.entrySet()) {
            if (entry.getValue() > max) {
                tag = entry.getKey();
                max = entry.getValue();
            }
        }
        return tag;
    }

    /** Dalda {@code enum}/{@code const} ile düşen, yapının doğrudan alt alanlarının adları. */
    private static Set<String> childValueFailures(List<SchemaViolation> branch, DescriptorPath construct, int marker) {
        Set<String> names = new TreeSet<>();
        for (SchemaViolation violation : branch) {
            DescriptorPath instance = violation.instancePath();
            if (VALUE_KEYWORDS.contains(violation.keyword())
                    && instance.size() == construct.size() + 1
                    && instance.parent().equals(construct)
                    && markerIndex(violation.evaluationPath(), marker + 2) < 0) {
                names.add(String.valueOf(instance.last()));
            }
        }
        return names;
    }

    static boolean isLicenseShaped(DescriptorPath path) {
        return path.size() >= 2
                && path.last() instanceof Integer
                && "licenses".equals(path.segment(path.size() - 2));
    }

    private static String orList(Set<String> names) {
        StringJoiner joiner = new StringJoiner(" or ");
        names.forEach(name -> joiner.add("a '" + name + "'"));
        return joiner.toString();
    }

    private static String valueAt(JsonNode descriptor, DescriptorPath path) {
        if (descriptor == null) {
            return null;
        }
        JsonNode node = descriptor.at(path.toJsonPointer());
        if (node.isMissingNode() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    // ── Tekilleştirme ve sıralama ───────────────────────────────────

    /**
     * {@code (path, message)} çiftine göre tekilleştirir ve {@code (path, message)} sırasına
     * dizer. Aynı çift için hangi bulgunun kalacağı kaynak türüne göre sabittir, yani
     * kuralların çalışma sırası sonucu değiştirmez.
     */
    static List<Issue> dedupAndSort(List<Issue> issues) {
        List<Issue> ordered = new ArrayList<>(issues);
        ordered.sort(FINAL_ORDER);
        Map<Issue.Key, Issue> unique = new LinkedHashMap<>();
        for (Issue issue : ordered) {
            unique.putIfAbsent(issue.key(), issue);
        }
        return List.copyOf(unique.values());
    }
}
