package io.mersel.services.dpcheck.application.models;

import java.util.Set;

/**
 * Bir bulgunun kaynağı.
 * <p>
 * Kapalı bir kategori kümesi ve kategoriye göre anlamı değişen bir ad taşır:
 * standart ihlalleri için başarısız olan şema anahtar kelimesi ({@code required},
 * {@code type}, {@code pattern} ...), özel kontroller için kontrolün adı.
 *
 * @param category Bulgu kategorisi
 * @param name     Anahtar kelime veya kontrol adı; {@link Issue#type()} olarak görünür
 */
public record CheckKind(Category category, String name) {

    public enum Category {
        STANDARD_VIOLATION,
        STANDARD_RECOMMENDATION,
        REQUIRED_VIOLATION,
        PRIMARY_KEY_VIOLATION,
        FOREIGN_KEY_VIOLATION,
        ENUM_VIOLATION,
        LICENSE_VIOLATION,
        CUSTOM_VIOLATION,
        CHECK_EXECUTION_FAILURE
    }

    public static final String REQUIRED = "required";
    public static final String PRIMARY_KEY = "primary-key";
    public static final String FOREIGN_KEY = "foreign-key";
    public static final String ENUM = "enum";
    public static final String LICENSE = "license";

    /** Yerleşik kurallara ve standart anahtar kelimelerine ayrılmış adlar; özel kontroller kullanamaz. */
    public static final Set<String> RESERVED_NAMES = Set.of(
            REQUIRED, PRIMARY_KEY, FOREIGN_KEY, ENUM, LICENSE,
            "type", "pattern", "format", "const", "oneOf", "anyOf", "allOf",
            "minItems", "minProperties", "additionalProperties", "check-execution-failure");

    public CheckKind {
        if (category == null) {
            throw new IllegalArgumentException("Bulgu kategorisi boş olamaz");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Bulgu türü adı boş olamaz");
        }
    }

    public static CheckKind standardViolation(String keyword) {
        return new CheckKind(Category.STANDARD_VIOLATION, keyword);
    }

    public static CheckKind standardRecommendation(String keyword) {
        return new CheckKind(Category.STANDARD_RECOMMENDATION, keyword);
    }

    public static CheckKind requiredViolation() {
        return new CheckKind(Category.REQUIRED_VIOLATION, REQUIRED);
    }

    public static CheckKind primaryKeyViolation() {
        return new CheckKind(Category.PRIMARY_KEY_VIOLATION, PRIMARY_KEY);
    }

    public static CheckKind foreignKeyViolation() {
        return new CheckKind(Category.FOREIGN_KEY_VIOLATION, FOREIGN_KEY);
    }

    public static CheckKind enumViolation() {
        return new CheckKind(Category.ENUM_VIOLATION, ENUM);
    }

    public static CheckKind licenseViolation() {
        return new CheckKind(Category.LICENSE_VIOLATION, LICENSE);
    }

    public static CheckKind customViolation(String checkName) {
        return new CheckKind(Category.CUSTOM_VIOLATION, checkName);
    }

    public static CheckKind checkExecutionFailure(String checkName) {
        return new CheckKind(Category.CHECK_EXECUTION_FAILURE, checkName);
    }
}
