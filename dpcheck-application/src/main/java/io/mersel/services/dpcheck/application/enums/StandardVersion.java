package io.mersel.services.dpcheck.application.enums;

import io.mersel.services.dpcheck.application.interfaces.ConfigException;

/**
 * Desteklenen Data Package standart sürümleri.
 */
public enum StandardVersion {
    V1("v1"),
    V2("v2");

    private final String id;

    StandardVersion(String id) {
        this.id = id;
    }

    /** Şema kaynak adlarında ve metrik etiketlerinde kullanılan kısa kimlik. */
    public String id() {
        return id;
    }

    /**
     * Kısa kimlikten sürümü çözer ({@code "v1"}, {@code "v2"}; büyük/küçük harf duyarsız).
     *
     * @throws ConfigException tanınmayan sürüm
     */
    public static StandardVersion fromId(String value) {
        if (value != null) {
            for (StandardVersion version : values()) {
                if (version.id.equalsIgnoreCase(value.trim())) {
                    return version;
                }
            }
        }
        throw new ConfigException("Desteklenmeyen standart sürümü: " + value + " (beklenen: v1, v2)");
    }
}
