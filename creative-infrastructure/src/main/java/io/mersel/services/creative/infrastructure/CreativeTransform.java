package io.mersel.services.creative.infrastructure;

import io.mersel.services.creative.application.interfaces.ArchiveSource;
import io.mersel.services.creative.application.interfaces.BundleException;
import io.mersel.services.creative.application.interfaces.ICreativeTransform;
import io.mersel.services.creative.application.models.BundleSummary;
import io.mersel.services.creative.application.models.Creative;
import io.mersel.services.creative.application.models.CreativePart;
import io.mersel.services.creative.application.models.CreativeRequest;
import io.mersel.services.creative.application.models.CreativeSize;
import io.mersel.services.creative.infrastructure.bundle.Bundle;
import io.mersel.services.creative.infrastructure.bundle.BundleFactory;
import io.mersel.services.creative.infrastructure.diagnostics.CreativeMetrics;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/**
 * Tek bir yüklenmiş arşiv üzerindeki dönüşüm.
 * <p>
 * Bundle ilk ihtiyaçta sınıflandırılıp dönüştürülür ve nesnenin ömrü boyunca
 * saklanır. Başarısız deneme saklanmaz; sonraki çağrı arşivi yeniden okur.
 */
public class CreativeTransform implements ICreativeTransform {

    private static final Logger log = LoggerFactory.getLogger(CreativeTransform.class);

    private final String transformId;
    private final String filename;
    private final ArchiveSource source;
    private final BundleFactory bundleFactory;
    private final CreativeMetrics metrics;

    private Bundle bundle;

    public CreativeTransform(String transformId, String filename, ArchiveSource source,
                             BundleFactory bundleFactory, CreativeMetrics metrics) {
        this.transformId = Objects.requireNonNull(transformId, "transformId");
        this.filename = filename;
        this.source = Objects.requireNonNull(source, "source");
        this.bundleFactory = bundleFactory;
        this.metrics = metrics;
    }

    @Override
    public String getTransformId() {
        return transformId;
    }

    @Override
    public String getFilename() {
        return filename;
    }

    /**
     * Sınıflandırılmış ve dönüştürülmüş bundle.
     *
     * @throws TransformException Arşiv açılamazsa veya dönüştürülemezse
     */
    Bundle bundle() throws TransformException {
        if (bundle == null) {
            Bundle created;
            try {
                created = bundleFactory.create(transformId, source);
            } catch (BundleException e) {
                throw new TransformException("Cannot open the archive: " + e.getMessage(), e);
            }
            try {
                created.transform();
            } catch (BundleException e) {
                metrics.recordError("transform");
                throw new TransformException("Cannot transform the archive: " + e.getMessage(), e);
            }
            bundle = created;
        }
        return bundle;
    }

    @Override
    public BundleSummary summary() throws TransformException {
        return bundle().summary();
    }

    @Override
    public Creative getCreative(CreativeRequest request) throws TransformException {
        long advertiserId = parseAdvertiserId(request.getAdvertiserId());
        CreativeSize size = parseSize(request.getSize());
        String destinationUrl = validateUrl(request.getDestinationUrl());

        CreativePart part;
        try {
            part = bundle().getCreativePart(request.getSnippetName());
        } catch (BundleException e) {
            metrics.recordError("creative");
            throw new TransformException(e.getMessage(), e);
        }

        String name = creativeName(request.getCreativeName());
        log.info("Kreatif hazırlandı — dönüşüm: {}, ad: {}, boyut: {}x{}",
                transformId, name, size.width(), size.height());

        return Creative.builder()
                .name(name)
                .advertiserId(advertiserId)
                .size(size)
                .destinationUrl(destinationUrl)
                .part(part)
                .build();
    }

    // ── Doğrulama ──────────────────────────────────────────────────

    private long parseAdvertiserId(String value) throws TransformException {
        try {
            return Long.parseLong(value == null ? "" : value.trim());
        } catch (NumberFormatException e) {
            throw invalid("Invalid advertiser id '" + value + "'");
        }
    }

    private CreativeSize parseSize(String value) throws TransformException {
        String[] parts = value == null ? new String[0] : value.split("x", -1);
        if (parts.length != 2) {
            throw invalid("Invalid size '" + value + "'");
        }
        try {
            int width = Integer.parseInt(parts[0].trim());
            int height = Integer.parseInt(parts[1].trim());
            if (width <= 0 || height <= 0) {
                throw invalid("Invalid size '" + value + "'");
            }
            return new CreativeSize(width, height);
        } catch (NumberFormatException e) {
            throw invalid("Invalid size '" + value + "'");
        }
    }

    private String validateUrl(String value) throws TransformException {
        if (value == null) {
            throw invalid("Invalid URL 'null'");
        }
        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            throw invalid("Invalid URL '" + value + "'");
        }
        if (uri.getScheme() == null || uri.getRawAuthority() == null || uri.getRawAuthority().isEmpty()) {
            throw invalid("Incorrect URL '" + value + "'");
        }
        return value;
    }

    private TransformException invalid(String message) {
        metrics.recordError("validation");
        log.warn("Geçersiz kreatif isteği — dönüşüm: {}, {}", transformId, message);
        return new TransformException(message);
    }

    /**
     * Verilen ad HTML etiketlerinden arındırılır; boşsa dosya adı ve kimlikten üretilir.
     */
    private String creativeName(String requested) {
        if (requested != null && !requested.isBlank()) {
            String text = Jsoup.parse(requested).text();
            if (!text.isEmpty()) {
                return text;
            }
        }
        return filename != null ? "X5 " + filename + " " + transformId : "X5 " + transformId;
    }
}
