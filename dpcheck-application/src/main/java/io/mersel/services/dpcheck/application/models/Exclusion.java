package io.mersel.services.dpcheck.application.models;

import io.mersel.services.dpcheck.application.enums.ExclusionScope;

/**
 * Bulguları sonuçtan çıkaran hariç tutma kuralı.
 * <p>
 * Hedef yol deseni ve/veya bulgu türü ile tanımlanır; ikisi birlikte verilirse her ikisi de
 * eşleşmelidir. Yol eşleşmesi bulgunun konumuyla birebirdir, önek eşleşmesi yapılmaz.
 * Hiçbir koşul taşımayan kural hiçbir şeyi hariç tutmaz.
 *
 * @param target Hedef yol deseni ({@code null} ise tüm konumlar)
 * @param type   Bulgu türü, örn. {@code required}, {@code pattern} ({@code null} ise tüm türler)
 * @param scope  {@code WHOLE} veya yalnızca zorunlu alan ihlalleri için {@code REQUIRED_ONLY}
 */
public record Exclusion(PathPattern target, String type, ExclusionScope scope) {

    public Exclusion {
        scope = scope == null ? ExclusionScope.WHOLE : scope;
        type = type == null || type.isBlank() ? null : type.trim();
    }

    /** Verilen yoldaki tüm bulguları hariç tutar. */
    public static Exclusion of(String jsonpath) {
        return new Exclusion(PathPattern.compile(jsonpath), null, ExclusionScope.WHOLE);
    }

    /** Verilen yoldaki yalnızca zorunlu alan ihlallerini hariç tutar. */
    public static Exclusion requiredOnly(String jsonpath) {
        return new Exclusion(PathPattern.compile(jsonpath), null, ExclusionScope.REQUIRED_ONLY);
    }

    /** Verilen türdeki bulguları her konumda hariç tutar. */
    public static Exclusion ofType(String type) {
        return new Exclusion(null, type, ExclusionScope.WHOLE);
    }

    public boolean excludes(Issue issue) {
        if (target == null && type == null) {
            return false;
        }
        if (scope == ExclusionScope.REQUIRED_ONLY && !issue.isRequiredViolation()) {
            return false;
        }
        boolean pathMatches = target == null || target.matches(issue.path());
        boolean typeMatches = type == null || type.equals(issue.type());
        return pathMatches && typeMatches;
    }
}
