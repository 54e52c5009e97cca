package io.mersel.services.creative.infrastructure;

import io.mersel.services.creative.application.interfaces.ArchiveSource;
import io.mersel.services.creative.application.interfaces.ICreativeTransform;
import io.mersel.services.creative.application.interfaces.ICreativeTransformFactory;
import io.mersel.services.creative.infrastructure.bundle.BundleFactory;
import io.mersel.services.creative.infrastructure.diagnostics.CreativeMetrics;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * {@link CreativeTransform} örneklerini üreten servis.
 * <p>
 * Servis durumsuzdur; her dönüşüm kendi bundle'ını saklar ve süreçler arası
 * önbellek tutulmaz.
 */
@Service
public class CreativeTransformFactory implements ICreativeTransformFactory {

    private final BundleFactory bundleFactory;
    private final CreativeMetrics metrics;

    public CreativeTransformFactory(BundleFactory bundleFactory, CreativeMetrics metrics) {
        this.bundleFactory = bundleFactory;
        this.metrics = metrics;
    }

    @Override
    public ICreativeTransform open(String transformId, String filename, ArchiveSource source) {
        return new CreativeTransform(transformId, filename, source, bundleFactory, metrics);
    }

    @Override
    public String newTransformId(String networkCode, String userId, Instant createdAt) {
        return TransformIds.generate(networkCode, userId, createdAt);
    }
}
