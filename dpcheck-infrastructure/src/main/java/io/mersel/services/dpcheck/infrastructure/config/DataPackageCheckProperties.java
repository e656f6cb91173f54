package io.mersel.services.dpcheck.infrastructure.config;

import io.mersel.services.dpcheck.application.enums.FailurePolicy;
import io.mersel.services.dpcheck.application.enums.StandardVersion;
import io.mersel.services.dpcheck.application.interfaces.ConfigException;
import io.mersel.services.dpcheck.application.models.CheckConfig;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Kontrol motoru yapılandırma özellikleri.
 * <p>
 * {@code datapackage.check} prefix'i altındaki değerleri okur.
 * <ul>
 *   <li>{@code default-version}: Yapılandırma verilmediğinde kullanılan standart sürümü (v1, v2; varsayılan: v2)</li>
 *   <li>{@code strict}: Varsayılan yapılandırmada katı mod (varsayılan: false)</li>
 *   <li>{@code failure-policy}: Özel kontrol hatası politikası (isolate, abort; varsayılan: isolate)</li>
 *   <li>{@code schema-cache-size}: Derlenmiş şema önbelleği boyutu (en az 4; varsayılan: 8)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "datapackage.check")
public class DataPackageCheckProperties {

    private static final Logger log = LoggerFactory.getLogger(DataPackageCheckProperties.class);

    /** İki sürüm x (standart, öneri) şeması. */
    static final int MIN_SCHEMA_CACHE_SIZE = 4;
    private static final int DEFAULT_SCHEMA_CACHE_SIZE = 8;

    private String defaultVersion = "v2";
    private boolean strict = false;
    private String failurePolicy = "isolate";
    private int schemaCacheSize = DEFAULT_SCHEMA_CACHE_SIZE;

    @PostConstruct
    void validate() {
        try {
            StandardVersion.fromId(defaultVersion);
        } catch (ConfigException e) {
            log.warn("default-version geçersiz ({}), varsayılan v2 kullanılıyor", defaultVersion);
            defaultVersion = "v2";
        }
        try {
            FailurePolicy.fromId(failurePolicy);
        } catch (ConfigException e) {
            log.warn("failure-policy geçersiz ({}), varsayılan isolate kullanılıyor", failurePolicy);
            failurePolicy = "isolate";
        }
        if (schemaCacheSize < MIN_SCHEMA_CACHE_SIZE) {
            log.warn("schema-cache-size en az {} olmalı (verilen: {}), varsayılan {} kullanılıyor",
                    MIN_SCHEMA_CACHE_SIZE, schemaCacheSize, DEFAULT_SCHEMA_CACHE_SIZE);
            schemaCacheSize = DEFAULT_SCHEMA_CACHE_SIZE;
        }
    }

    /**
     * Özelliklerden, hariç tutma ve özel kontrol içermeyen varsayılan yapılandırmayı üretir.
     */
    public CheckConfig toDefaultConfig() {
        return CheckConfig.builder()
                .strict(strict)
                .version(StandardVersion.fromId(defaultVersion))
                .failurePolicy(FailurePolicy.fromId(failurePolicy))
                .build();
    }

    public String getDefaultVersion() {
        return defaultVersion;
    }

    public void setDefaultVersion(String defaultVersion) {
        this.defaultVersion = defaultVersion;
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    public String getFailurePolicy() {
        return failurePolicy;
    }

    public void setFailurePolicy(String failurePolicy) {
        this.failurePolicy = failurePolicy;
    }

    public int getSchemaCacheSize() {
        return schemaCacheSize;
    }

    public void setSchemaCacheSize(int schemaCacheSize) {
        this.schemaCacheSize = schemaCacheSize;
    }
}
