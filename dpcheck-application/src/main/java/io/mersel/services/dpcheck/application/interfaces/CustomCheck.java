package io.mersel.services.dpcheck.application.interfaces;

import com.fasterxml.jackson.databind.JsonNode;
import io.mersel.services.dpcheck.application.models.CheckKind;
import io.mersel.services.dpcheck.application.models.Issue;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Kullanıcı tarafından sağlanan kontrol.
 * <p>
 * Durumsuzdur: descriptor'ın tamamını alır ve bulgu listesi döner. Çalışırken fırlattığı
 * hata kontrol motoru tarafından yakalanır ve {@code CheckExecutionFailure} bulgusuna
 * dönüştürülür.
 */
public interface CustomCheck {

    /** Yapılandırma içinde benzersiz ad. */
    String name();

    /**
     * Kontrolü çalıştırır. Descriptor değiştirilmemelidir.
     *
     * @param descriptor Kontrol edilen descriptor
     * @return Bulgular (boş liste = sorun yok)
     */
    List<Issue> apply(JsonNode descriptor);

    /**
     * Kontrol adlarının boş olmadığını, birbirinden farklı olduğunu ve yerleşik kural
     * adlarıyla çakışmadığını doğrular.
     *
     * @throws ConfigException kural ihlalinde
     */
    static void validateNames(List<? extends CustomCheck> checks) {
        Set<String> seen = new HashSet<>();
        for (CustomCheck check : checks) {
            if (check == null) {
                throw new ConfigException("Özel kontrol listesi null eleman içeremez");
            }
            String name = check.name();
            if (name == null || name.isBlank()) {
                throw new ConfigException("Özel kontrol adı boş olamaz");
            }
            if (CheckKind.RESERVED_NAMES.contains(name)) {
                throw new ConfigException("Özel kontrol adı yerleşik bir kural adıyla çakışıyor: " + name);
            }
            if (!seen.add(name)) {
                throw new ConfigException("Özel kontrol adı birden fazla kez kullanılmış: " + name);
            }
        }
    }
}
