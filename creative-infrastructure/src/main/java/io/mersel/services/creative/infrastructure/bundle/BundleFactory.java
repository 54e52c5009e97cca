package io.mersel.services.creative.infrastructure.bundle;

import io.mersel.services.creative.application.interfaces.ArchiveSource;
import io.mersel.services.creative.application.interfaces.BundleException;
import io.mersel.services.creative.infrastructure.config.CreativeProperties;
import io.mersel.services.creative.infrastructure.converter.CreativeConverter;
import io.mersel.services.creative.infrastructure.diagnostics.CreativeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;

/**
 * ZIP arşivinden {@link Bundle} oluşturur.
 * <p>
 * Girdiler arşiv sırasıyla tek geçişte sınıflandırılır. Dizinler, {@code __MACOSX/}
 * altındaki dosyalar, noktayla başlayan dosyalar ve işletim sistemi metadata
 * dosyaları atlanır. Dönüştürücüler Spring'in {@code @Order} sırasıyla enjekte edilir;
 * araca özel olanlar önce, varsayılan en sonda.
 */
@Component
public class BundleFactory {

    private static final Logger log = LoggerFactory.getLogger(BundleFactory.class);

    private static final String MACOS_RESOURCE_DIR = "__MACOSX/";
    private static final Set<String> OS_METADATA_FILES = Set.of("Thumbs.db", "desktop.ini", "Icon\r");

    private final CreativeProperties properties;
    private final List<CreativeConverter> converters;
    private final CreativeMetrics metrics;

    public BundleFactory(CreativeProperties properties, List<CreativeConverter> converters, CreativeMetrics metrics) {
        this.properties = properties;
        this.converters = List.copyOf(converters);
        this.metrics = metrics;
    }

    /**
     * Arşivi açar ve girdilerini snippet/asset olarak sınıflandırır.
     *
     * @param transformId Hata mesajları ve dosya adları için dönüşüm kimliği
     * @param source      Arşiv kaynağı; kreatif oluşturulurken yeniden açılır
     * @throws BundleException Arşiv açılamazsa, bir girdi okunamazsa veya hiç snippet yoksa
     */
    public Bundle create(String transformId, ArchiveSource source) throws BundleException {
        long startTime = System.currentTimeMillis();
        var limits = new Bundle.Limits(
                properties.getAssetSizeLimit(), properties.getMaxArchiveSize(), properties.getMaxEntries());
        var bundle = new Bundle(transformId, source, converters, limits, metrics);

        try (ArchiveReader reader = bundle.openArchive()) {
            for (ZipEntry entry : reader.entries()) {
                String name = entry.getName();
                if (entry.isDirectory() || isIgnored(name)) {
                    log.debug("  Girdi atlandı: {}", name);
                    continue;
                }
                bundle.addMember(name, entry.getSize(), reader);
            }
            if (bundle.getSnippets().isEmpty()) {
                throw new BundleException("No snippets found (" + transformId + ")", transformId);
            }
        } catch (BundleException e) {
            metrics.recordIngestion(false, System.currentTimeMillis() - startTime);
            metrics.recordError("ingest");
            throw e;
        }

        long elapsed = System.currentTimeMillis() - startTime;
        metrics.recordIngestion(true, elapsed);
        log.info("Arşiv sınıflandırıldı — dönüşüm: {}, snippet: {}, asset: {}, süre: {} ms",
                transformId, bundle.getSnippets().size(), bundle.getAssets().size(), elapsed);
        return bundle;
    }

    /**
     * Platform artığı veya gizli dosya mı.
     */
    static boolean isIgnored(String name) {
        if (name.endsWith("/") || name.contains(MACOS_RESOURCE_DIR)) {
            return true;
        }
        String basename = name.substring(name.lastIndexOf('/') + 1);
        return basename.startsWith(".") || OS_METADATA_FILES.contains(basename);
    }
}
