package io.mersel.services.dpcheck.application.enums;

import io.mersel.services.dpcheck.application.interfaces.ConfigException;

/**
 * Bir hariç tutma kuralının hangi bulgulara uygulanacağı.
 */
public enum ExclusionScope {
    /** Eşleşen konumdaki tüm bulgular. */
    WHOLE("whole"),
    /** Eşleşen konumda yalnızca zorunlu alan ihlalleri. */
    REQUIRED_ONLY("required-only");

    private final String id;

    ExclusionScope(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static ExclusionScope fromId(String value) {
        if (value != null) {
            for (ExclusionScope scope : values()) {
                if (scope.id.equalsIgnoreCase(value.trim())) {
                    return scope;
                }
            }
        }
        throw new ConfigException("Bilinmeyen hariç tutma kapsamı: " + value + " (beklenen: whole, required-only)");
    }
}
