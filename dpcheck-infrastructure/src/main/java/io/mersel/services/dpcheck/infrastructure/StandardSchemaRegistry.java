package io.mersel.services.dpcheck.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SchemaValidatorsConfig;
import com.networknt.schema.SpecVersion;
import io.mersel.services.dpcheck.application.enums.StandardVersion;
import io.mersel.services.dpcheck.infrastructure.config.DataPackageCheckProperties;
import io.mersel.services.dpcheck.infrastructure.diagnostics.CheckMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Paketlenmiş Data Package şemalarının derlenmiş önbelleği.
 * <p>
 * Her (sürüm, öneri) çifti ilk kullanımda classpath'ten okunur, derlenir ve Caffeine
 * önbelleğine konur; sonrasında yalnızca okunur. Caffeine {@code get(key, loader)} aynı
 * anahtar için yükleyiciyi en fazla bir kez çalıştırır, eşzamanlı kontroller aynı
 * derlenmiş şemayı paylaşır.
 */
@Component
public class StandardSchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(StandardSchemaRegistry.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String SCHEMA_DIR = "schemas/";

    /**
     * Derlenmiş şema ve kaynak JSON'u. Kaynak, ihlallerin şema konumundan
     * izin verilen değerleri okumak için tutulur.
     */
    public record CompiledStandard(StandardVersion version, boolean recommendations, JsonNode source, JsonSchema schema) {}

    private record Key(StandardVersion version, boolean recommendations) {}

    private final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

    /** {@code format} (uri, date-time, email) ihlal olarak raporlanır, yalnızca not düşülmez. */
    private final SchemaValidatorsConfig validatorsConfig = SchemaValidatorsConfig.builder()
            .formatAssertionsEnabled(true)
            .build();
    private final Cache<Key, CompiledStandard> cache;

    public StandardSchemaRegistry(DataPackageCheckProperties properties, CheckMetrics metrics) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.getSchemaCacheSize())
                .build();
        metrics.registerSchemaCacheSizeGauge(cache);
    }

    public CompiledStandard standard(StandardVersion version) {
        return cache.get(new Key(version, false), this::load);
    }

    public CompiledStandard recommendations(StandardVersion version) {
        return cache.get(new Key(version, true), this::load);
    }

    /** Önbellekte derlenmiş şema sayısı. */
    public int getLoadedCount() {
        return (int) cache.estimatedSize();
    }

    /** Şema kaynağı classpath'te paketlenmiş mi? Derleme yapmaz. */
    public boolean isBundled(StandardVersion version, boolean recommendations) {
        return StandardSchemaRegistry.class.getClassLoader()
                .getResource(resourcePath(version, recommendations)) != null;
    }

    static String resourcePath(StandardVersion version, boolean recommendations) {
        return SCHEMA_DIR + "data-package-" + version.id() + (recommendations ? "-recommendations" : "") + ".json";
    }

    private CompiledStandard load(Key key) {
        String path = resourcePath(key.version(), key.recommendations());
        long startTime = System.currentTimeMillis();
        try (InputStream in = StandardSchemaRegistry.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Standart şema bulunamadı: " + path);
            }
            JsonNode source = MAPPER.readTree(in);
            JsonSchema schema = factory.getSchema(source, validatorsConfig);
            log.info("Standart şema derlendi: {} ({} ms)", path, System.currentTimeMillis() - startTime);
            return new CompiledStandard(key.version(), key.recommendations(), source, schema);
        } catch (IOException e) {
            throw new IllegalStateException("Standart şema okunamadı: " + path, e);
        }
    }
}
