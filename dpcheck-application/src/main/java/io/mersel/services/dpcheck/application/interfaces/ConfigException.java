package io.mersel.services.dpcheck.application.interfaces;

/**
 * Geçersiz kontrol yapılandırması.
 * <p>
 * Yapılandırma kurulurken (yol ifadesi derlenirken, özel kontrol adları doğrulanırken,
 * profil çözümlenirken) hemen fırlatılır; hiçbir zaman bulgu listesine katılmaz.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
