package io.mersel.services.creative.infrastructure;

import io.mersel.services.creative.application.interfaces.ArchiveSource;
import io.mersel.services.creative.application.interfaces.BundleException;
import io.mersel.services.creative.infrastructure.bundle.Bundle;
import io.mersel.services.creative.infrastructure.bundle.BundleFactory;
import io.mersel.services.creative.infrastructure.config.CreativeProperties;
import io.mersel.services.creative.infrastructure.converter.CreativeConverter;
import io.mersel.services.creative.infrastructure.converter.DefaultConverter;
import io.mersel.services.creative.infrastructure.converter.EdgeConverter;
import io.mersel.services.creative.infrastructure.converter.HypeConverter;
import io.mersel.services.creative.infrastructure.diagnostics.CreativeMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Testler için bellekte ZIP arşivi ve bundle üreten yardımcılar.
 */
public final class ZipFixtures {

    public static final String TRANSFORM_ID = "tx-test";

    private ZipFixtures() {
    }

    /**
     * Ad/içerik çiftlerinden sıralı girdi eşlemesi. İçerik {@code String} (UTF-8) veya {@code byte[]} olabilir.
     * Sonu {@code /} ile biten adlar dizin girdisi olarak yazılır.
     */
    public static Map<String, Object> entries(Object... nameAndContent) {
        var entries = new LinkedHashMap<String, Object>();
        for (int i = 0; i < nameAndContent.length; i += 2) {
            entries.put((String) nameAndContent[i], nameAndContent[i + 1]);
        }
        return entries;
    }

    public static byte[] zip(Map<String, Object> entries) {
        var bytes = new ByteArrayOutputStream();
        try (var zip = new ZipOutputStream(bytes)) {
            for (var entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                Object content = entry.getValue();
                if (content instanceof byte[] raw) {
                    zip.write(raw);
                } else if (content != null) {
                    zip.write(content.toString().getBytes(StandardCharsets.UTF_8));
                }
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    public static ArchiveSource source(Map<String, Object> entries) {
        return ArchiveSource.ofBytes(zip(entries));
    }

    public static List<CreativeConverter> converters() {
        return List.of(new EdgeConverter(), new HypeConverter(), new DefaultConverter());
    }

    public static BundleFactory bundleFactory(CreativeProperties properties, CreativeMetrics metrics) {
        return new BundleFactory(properties, converters(), metrics);
    }

    public static BundleFactory bundleFactory() {
        return bundleFactory(new CreativeProperties(), new CreativeMetrics(new SimpleMeterRegistry()));
    }

    /** Arşivi sınıflandırır, dönüştürmez. */
    public static Bundle bundle(Map<String, Object> entries) throws BundleException {
        return bundleFactory().create(TRANSFORM_ID, source(entries));
    }

    /** Arşivi sınıflandırır ve dönüştürür. */
    public static Bundle transformed(Map<String, Object> entries) throws BundleException {
        Bundle bundle = bundle(entries);
        bundle.transform();
        return bundle;
    }
}
