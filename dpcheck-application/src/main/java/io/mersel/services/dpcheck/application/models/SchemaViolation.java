package io.mersel.services.dpcheck.application.models;

import java.util.List;

/**
 * Şema doğrulayıcısından gelen ham, anahtar kelime düzeyindeki ihlal.
 * <p>
 * Gruplama bu kaydın {@code evaluationPath} alanındaki {@code anyOf}/{@code oneOf}
 * işaretlerini kullanır.
 *
 * @param keyword        Başarısız olan anahtar kelime ({@code required}, {@code enum} ...)
 * @param instancePath   Descriptor içindeki konum
 * @param evaluationPath Şemada izlenen yol (örn. {@code properties/resources/items/oneOf/0/required})
 * @param message        Doğrulayıcının mesajı (konum öneki olmadan)
 * @param property       {@code required} gibi anahtar kelimeler için ilgili özellik adı, yoksa {@code null}
 * @param allowedValues  {@code enum}/{@code const} için izin verilen değerler, diğerlerinde boş
 */
public record SchemaViolation(
        String keyword,
        DescriptorPath instancePath,
        DescriptorPath evaluationPath,
        String message,
        String property,
        List<String> allowedValues
) {

    public SchemaViolation {
        instancePath = instancePath == null ? DescriptorPath.root() : instancePath;
        evaluationPath = evaluationPath == null ? DescriptorPath.root() : evaluationPath;
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }
}
