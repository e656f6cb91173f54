package io.mersel.services.dpcheck.application.enums;

import io.mersel.services.dpcheck.application.interfaces.ConfigException;

/**
 * Bir özel kontrol çalışırken hata fırlattığında izlenecek politika.
 */
public enum FailurePolicy {
    /** Hata {@code CheckExecutionFailure} bulgusuna dönüştürülür, diğer kontroller devam eder. */
    ISOLATE("isolate"),
    /** Hata {@code CheckExecutionException} olarak çağırana iletilir. */
    ABORT("abort");

    private final String id;

    FailurePolicy(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static FailurePolicy fromId(String value) {
        if (value != null) {
            for (FailurePolicy policy : values()) {
                if (policy.id.equalsIgnoreCase(value.trim())) {
                    return policy;
                }
            }
        }
        throw new ConfigException("Bilinmeyen hata politikası: " + value + " (beklenen: isolate, abort)");
    }
}
