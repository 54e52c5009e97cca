package io.mersel.services.creative.infrastructure.diagnostics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Kreatif servisi özel metrikleri.
 */
@Component
public class CreativeMetrics {

    private final MeterRegistry registry;

    public CreativeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Arşiv sınıflandırma metrikleri kaydet.
     *
     * @param success    Arşiv başarıyla sınıflandırıldı mı
     * @param durationMs Sınıflandırma süresi (milisaniye)
     */
    public void recordIngestion(boolean success, long durationMs) {
        Counter.builder("creative_bundle_ingestions_total")
                .tag("status", success ? "success" : "failure")
                .description("Arşiv sınıflandırma sayısı")
                .register(registry)
                .increment();

        Timer.builder("creative_bundle_ingestion_duration")
                .description("Arşiv sınıflandırma süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Snippet dönüşüm metrikleri kaydet.
     *
     * @param converter Dönüştürücü etiketi (edge, hype, default) veya "none"
     * @param result    "success" veya "failure"
     */
    public void recordConversion(String converter, String result) {
        Counter.builder("creative_conversions_total")
                .tag("converter", converter)
                .tag("result", result)
                .description("Snippet dönüşüm sayısı")
                .register(registry)
                .increment();
    }

    /**
     * Kreatif oluşturma metrikleri kaydet.
     *
     * @param assetCount   Kreatife eklenen asset sayısı
     * @param omittedCount Politika gereği sıfır byte ile gönderilen asset sayısı
     */
    public void recordCreativePart(int assetCount, int omittedCount) {
        Counter.builder("creative_parts_total")
                .description("Oluşturulan kreatif sayısı")
                .register(registry)
                .increment();

        registry.summary("creative_part_assets").record(assetCount);

        if (omittedCount > 0) {
            Counter.builder("creative_omitted_assets_total")
                    .description("Boyut veya tip nedeniyle atlanan asset sayısı")
                    .register(registry)
                    .increment(omittedCount);
        }
    }

    /**
     * Hata metrikleri kaydet.
     *
     * @param operation "ingest", "transform", "creative" veya "validation"
     */
    public void recordError(String operation) {
        Counter.builder("creative_errors_total")
                .tag("operation", operation)
                .description("Toplam hata sayısı")
                .register(registry)
                .increment();
    }
}
