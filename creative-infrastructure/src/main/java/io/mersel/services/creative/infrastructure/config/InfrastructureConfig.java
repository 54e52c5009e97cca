package io.mersel.services.creative.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Altyapı katmanı Spring yapılandırması.
 * <p>
 * Bu katmandaki tüm bileşenleri (bundle fabrikası, dönüştürücüler, metrikler) otomatik tarar.
 * Kreatif bundle yapılandırma özelliklerini etkinleştirir.
 */
@Configuration
@ComponentScan(basePackages = "io.mersel.services.creative.infrastructure")
@EnableConfigurationProperties(CreativeProperties.class)
public class InfrastructureConfig {
}
