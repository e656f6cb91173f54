package io.mersel.services.dpcheck.application.interfaces;

import com.fasterxml.jackson.databind.JsonNode;
import io.mersel.services.dpcheck.application.enums.StandardVersion;
import io.mersel.services.dpcheck.application.models.SchemaViolation;

import java.util.List;

/**
 * Data Package standart şeması doğrulayıcı arayüzü.
 * <p>
 * Anahtar kelime düzeyindeki ham ihlalleri döner; gruplama ve tekilleştirme
 * kontrol motorunun işidir.
 */
public interface ISchemaValidator {

    /**
     * Descriptor'ı standart şemaya göre doğrular.
     *
     * @return Ham ihlaller (boş liste = geçerli)
     */
    List<SchemaViolation> validate(JsonNode descriptor, StandardVersion version);

    /**
     * Descriptor'ı katı mod öneri şemasına göre doğrular (önerilen ama zorunlu olmayan
     * özellikler, ad ve sürüm biçimleri).
     */
    List<SchemaViolation> validateRecommendations(JsonNode descriptor, StandardVersion version);
}
