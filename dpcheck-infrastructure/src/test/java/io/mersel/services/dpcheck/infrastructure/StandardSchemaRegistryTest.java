package io.mersel.services.dpcheck.infrastructure;

import io.mersel.services.dpcheck.application.enums.StandardVersion;
import io.mersel.services.dpcheck.infrastructure.config.DataPackageCheckProperties;
import io.mersel.services.dpcheck.infrastructure.diagnostics.CheckMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StandardSchemaRegistry")
class StandardSchemaRegistryTest {

    private SimpleMeterRegistry meterRegistry;
    private StandardSchemaRegistry registry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        registry = new StandardSchemaRegistry(new DataPackageCheckProperties(), new CheckMetrics(meterRegistry));
    }

    @Test
    @DisplayName("Kaynak yolu sürüm ve öneri bilgisinden üretilir")
    void kaynak_yolu() {
        assertThat(StandardSchemaRegistry.resourcePath(StandardVersion.V2, false))
                .isEqualTo("schemas/data-package-v2.json");
        assertThat(StandardSchemaRegistry.resourcePath(StandardVersion.V1, true))
                .isEqualTo("schemas/data-package-v1-recommendations.json");
    }

    @ParameterizedTest
    @EnumSource(StandardVersion.class)
    @DisplayName("Her sürümün standart ve öneri şeması derlenir")
    void her_surum_derlenir(StandardVersion version) {
        var standard = registry.standard(version);
        var recommendations = registry.recommendations(version);

        assertThat(standard.schema()).isNotNull();
        assertThat(standard.recommendations()).isFalse();
        assertThat(recommendations.recommendations()).isTrue();
        assertThat(recommendations.source().has("properties")).isTrue();
    }

    @Test
    @DisplayName("Aynı şema ikinci çağrıda yeniden derlenmez")
    void onbellek() {
        var first = registry.standard(StandardVersion.V2);
        var second = registry.standard(StandardVersion.V2);

        assertThat(second).isSameAs(first);
        assertThat(meterRegistry.get("dpcheck_schema_cache_size").gauge().value()).isEqualTo(1.0);
    }
}
