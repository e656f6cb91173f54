package io.mersel.services.dpcheck.application.interfaces;

import io.mersel.services.dpcheck.application.models.CheckConfig;

import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * YAML kontrol profillerinden {@link io.mersel.services.dpcheck.application.models.CheckConfig} üretir.
 * <p>
 * Profiller {@code extends} ile kalıtım destekler. Özel kontroller kod olduğu için
 * profil metnine değil, parametre olarak verilir ve her profile eklenir.
 */
public interface ICheckProfileService {

    /**
     * Tüm profilleri çözümler.
     *
     * @throws ConfigException YAML veya profil tanımı geçersizse
     */
    Map<String, CheckConfig> parseProfiles(String yaml, List<CustomCheck> customChecks);

    Map<String, CheckConfig> parseProfiles(InputStream yaml, List<CustomCheck> customChecks);

    /**
     * Tek bir profili çözümler.
     *
     * @throws ConfigException profil bulunamazsa veya tanım geçersizse
     */
    CheckConfig parseProfile(String yaml, String profileName, List<CustomCheck> customChecks);
}
