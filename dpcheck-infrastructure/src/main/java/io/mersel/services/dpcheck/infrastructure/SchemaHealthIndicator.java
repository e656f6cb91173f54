package io.mersel.services.dpcheck.infrastructure;

import io.mersel.services.dpcheck.application.enums.StandardVersion;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Paketlenmiş standart şemaların durumunu raporlayan sağlık göstergesi.
 * <p>
 * Herhangi bir sürümün standart ya da öneri şeması classpath'te yoksa DOWN döner.
 * Henüz derlenmemiş şemalar servisi DOWN yapmaz; şemalar ilk kontrolde derlenir.
 */
@Component
public class SchemaHealthIndicator implements HealthIndicator {

    private final StandardSchemaRegistry schemaRegistry;

    public SchemaHealthIndicator(StandardSchemaRegistry schemaRegistry) {
        this.schemaRegistry = schemaRegistry;
    }

    @Override
    public Health health() {
        List<String> missing = new ArrayList<>();
        for (StandardVersion version : StandardVersion.values()) {
            if (!schemaRegistry.isBundled(version, false)) {
                missing.add(StandardSchemaRegistry.resourcePath(version, false));
            }
            if (!schemaRegistry.isBundled(version, true)) {
                missing.add(StandardSchemaRegistry.resourcePath(version, true));
            }
        }
        int loaded = schemaRegistry.getLoadedCount();

        if (!missing.isEmpty()) {
            return Health.down()
                    .withDetail("schemas", "missing")
                    .withDetail("missing", missing)
                    .withDetail("schemas_loaded", loaded)
                    .build();
        }

        var builder = Health.up()
                .withDetail("schemas", "bundled")
                .withDetail("schemas_loaded", loaded);
        if (loaded < 1) {
            builder.withDetail("info", "Şemalar henüz derlenmedi, ilk kontrolde derlenecek");
        }
        return builder.build();
    }
}
