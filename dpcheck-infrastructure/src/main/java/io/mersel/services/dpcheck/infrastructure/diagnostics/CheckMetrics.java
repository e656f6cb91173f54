package io.mersel.services.dpcheck.infrastructure.diagnostics;

import com.github.benmanes.caffeine.cache.Cache;
import io.mersel.services.dpcheck.application.models.Issue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Kontrol motoru özel metrikleri.
 * <p>
 * Prometheus üzerinden dışa aktarılan kontrol metriklerini yönetir.
 */
@Component
public class CheckMetrics {

    private final MeterRegistry registry;

    public CheckMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Kontrol metriklerini kaydet.
     *
     * @param version    Standart sürümü (v1, v2)
     * @param result     "valid", "invalid" veya "error"
     * @param durationMs İşlem süresi (milisaniye)
     */
    public void recordCheck(String version, String result, long durationMs) {
        Counter.builder("dpcheck_checks_total")
                .tag("version", version)
                .tag("result", result)
                .description("Toplam descriptor kontrol sayısı")
                .register(registry)
                .increment();

        Timer.builder("dpcheck_check_duration")
                .tag("version", version)
                .description("Descriptor kontrol süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Bulgu sayılarını kategoriye göre kaydet.
     */
    public void recordIssues(List<Issue> issues) {
        for (Issue issue : issues) {
            Counter.builder("dpcheck_issues_total")
                    .tag("kind", issue.source().category().name().toLowerCase(Locale.ROOT))
                    .description("Raporlanan bulgu sayısı")
                    .register(registry)
                    .increment();
        }
    }

    /**
     * Yalıtılan özel kontrol hatasını kaydet.
     */
    public void recordCustomCheckFailure(String checkName) {
        Counter.builder("dpcheck_custom_check_failures_total")
                .tag("check", checkName)
                .description("Çalışırken hata veren özel kontrol sayısı")
                .register(registry)
                .increment();
    }

    /**
     * Derlenmiş şema önbelleği boyutu için gauge kaydeder.
     *
     * @param cache Şema önbelleği (Caffeine)
     */
    public void registerSchemaCacheSizeGauge(Cache<?, ?> cache) {
        Gauge.builder("dpcheck_schema_cache_size", cache, c -> (double) c.estimatedSize())
                .description("Önbelleğe alınmış derlenmiş şema sayısı")
                .register(registry);
    }
}
