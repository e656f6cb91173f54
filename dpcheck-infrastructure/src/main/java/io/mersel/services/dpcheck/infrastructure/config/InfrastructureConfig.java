package io.mersel.services.dpcheck.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Altyapı katmanı Spring yapılandırması.
 * <p>
 * Bu katmandaki tüm bileşenleri (kontrol motoru, kurallar, şema doğrulayıcı, metrikler)
 * otomatik tarar ve kontrol yapılandırma özelliklerini etkinleştirir.
 */
@Configuration
@ComponentScan(basePackages = "io.mersel.services.dpcheck.infrastructure")
@EnableConfigurationProperties(DataPackageCheckProperties.class)
public class InfrastructureConfig {
}
