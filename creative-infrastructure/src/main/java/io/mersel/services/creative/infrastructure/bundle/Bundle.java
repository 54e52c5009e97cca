package io.mersel.services.creative.infrastructure.bundle;

import io.mersel.services.creative.application.interfaces.ArchiveSource;
import io.mersel.services.creative.application.interfaces.BundleException;
import io.mersel.services.creative.application.interfaces.ConverterException;
import io.mersel.services.creative.application.models.BundleSummary;
import io.mersel.services.creative.application.models.CreativeAsset;
import io.mersel.services.creative.application.models.CreativePart;
import io.mersel.services.creative.application.models.ResourceSummary;
import io.mersel.services.creative.infrastructure.converter.CreativeConverter;
import io.mersel.services.creative.infrastructure.diagnostics.CreativeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tek bir kreatif arşivinin sınıflandırılmış içeriği.
 * <p>
 * Yaşam döngüsü: {@link BundleFactory} tek geçişte girdileri ekler,
 * {@link #transform()} snippet'leri ve gömülebilir asset'leri yerinde yeniden yazar,
 * ardından bundle yalnızca okunur. Kaynakların tek sahibi bundle'dır.
 * Eşzamanlı kullanım için tasarlanmamıştır.
 */
public class Bundle {

    private static final Logger log = LoggerFactory.getLogger(Bundle.class);

    private final String transformId;
    private final ArchiveSource source;
    private final List<CreativeConverter> converters;
    private final Limits limits;
    private final CreativeMetrics metrics;

    private final Map<String, Snippet> snippets = new LinkedHashMap<>();
    private final Map<String, Asset> assets = new LinkedHashMap<>();
    private final Map<String, Integer> macroCounters = new HashMap<>();

    /**
     * Bundle sınırları.
     *
     * @param assetSizeLimit Asset başına byte sınırı; aşan asset sıfır byte ile gönderilir
     * @param maxArchiveSize Arşiv boyutu sınırı (byte)
     * @param maxEntries     Arşiv girdi sayısı sınırı
     */
    public record Limits(long assetSizeLimit, long maxArchiveSize, int maxEntries) {
    }

    public Bundle(String transformId, ArchiveSource source, List<CreativeConverter> converters,
                  Limits limits, CreativeMetrics metrics) {
        this.transformId = transformId;
        this.source = source;
        this.converters = List.copyOf(converters);
        this.limits = limits;
        this.metrics = metrics;
    }

    public String getTransformId() {
        return transformId;
    }

    /** Arşivi baştan, yeni bir tutamaçla açar. */
    ArchiveReader openArchive() throws BundleException {
        return ArchiveReader.open(source, transformId, limits.maxArchiveSize(), limits.maxEntries());
    }

    public Map<String, Snippet> getSnippets() {
        return Collections.unmodifiableMap(snippets);
    }

    public Map<String, Asset> getAssets() {
        return Collections.unmodifiableMap(assets);
    }

    public Asset getAsset(String name) {
        return assets.get(name);
    }

    /**
     * Asset'i bundle'dan tamamen çıkarır (ör: içeriği snippet'e gömüldüğünde).
     */
    public Asset removeAsset(String name) {
        return assets.remove(name);
    }

    // ── Sınıflandırma ──────────────────────────────────────────────

    /**
     * Arşiv girdisini snippet veya asset olarak ekler.
     * <p>
     * Kimlik, büyük harfli uzantı ve uzantı başına 1'den başlayan sayaçtan üretilir
     * ({@code PNG1}, {@code PNG2}, {@code JS1}). Uzantısız girdiler atlanır.
     * Snippet'ler ve gömülebilir asset'ler hemen okunur, diğerleri kreatif
     * oluşturulurken. Aynı ada sahip sonraki girdi öncekinin yerine geçer.
     *
     * @return Eklenen kaynak, girdi atlandıysa boş
     */
    public Optional<CreativeResource> addMember(String name, long size, ArchiveReader reader) throws BundleException {
        String extension = MimeTypes.extensionOf(name);
        if (extension.isEmpty()) {
            log.debug("Uzantısız girdi atlandı: {}", name);
            return Optional.empty();
        }
        String key = extension.substring(1).toUpperCase(Locale.ROOT);
        int counter = macroCounters.merge(key, 1, Integer::sum);
        String id = key + counter;
        String mimetype = MimeTypes.guess(name);

        if (MimeTypes.SNIPPET.equals(mimetype)) {
            var snippet = new Snippet(id, name, size, mimetype);
            snippet.load(reader);
            snippets.put(name, snippet);
            log.debug("  Snippet eklendi: {} → {}", name, id);
            return Optional.of(snippet);
        }

        var asset = new Asset(id, name, size, mimetype, limits.assetSizeLimit());
        if (asset.isInlineable()) {
            asset.load(reader);
        }
        assets.put(name, asset);
        log.debug("  Asset eklendi: {} → {} ({}, {} byte)", name, id, mimetype, size);
        return Optional.of(asset);
    }

    // ── Göreli asset arama ─────────────────────────────────────────

    /**
     * Tek bir köke göre erişilebilen asset'ler, köke göreli adlarıyla.
     */
    public Map<String, Asset> assetsRelativeTo(String root) {
        return assetsRelativeTo(List.of(root));
    }

    /**
     * Kaynağın dizinine göre erişilebilen asset'ler.
     */
    public Map<String, Asset> assetsRelativeTo(CreativeResource resource) {
        return assetsRelativeTo(resource.getRoot());
    }

    /**
     * Köklerden birine göre erişilebilen asset'ler.
     * <p>
     * Her asset için kökler verilen sırayla denenir; ilk eşleşen kök göreli adı belirler.
     * Hiçbir kökle başlamayan asset'ler sonuca girmez.
     */
    public Map<String, Asset> assetsRelativeTo(Collection<String> roots) {
        var result = new LinkedHashMap<String, Asset>();
        for (Asset asset : assets.values()) {
            for (String root : roots) {
                Optional<String> relative = asset.nameRelativeTo(root);
                if (relative.isPresent()) {
                    result.put(relative.get(), asset);
                    break;
                }
            }
        }
        return result;
    }

    // ── Dönüşüm ────────────────────────────────────────────────────

    /**
     * Her snippet'i eşleşen ilk dönüştürücüyle yerinde dönüştürür.
     *
     * @throws BundleException Desteklenen asset yoksa veya bir dönüştürücü başarısız olursa
     */
    public void transform() throws BundleException {
        if (assets.values().stream().allMatch(Asset::isUnsupported)) {
            throw new BundleException("No assets in bundle (" + transformId + ")", transformId);
        }
        for (Snippet snippet : snippets.values()) {
            for (CreativeConverter converter : converters) {
                if (!converter.matches(snippet)) {
                    continue;
                }
                try {
                    converter.convert(this, snippet);
                } catch (ConverterException | RuntimeException e) {
                    metrics.recordConversion(converter.getType().getTag(), "failure");
                    log.error("Dönüştürme hatası — dönüşüm: {}, snippet: {}, dönüştürücü: {}",
                            transformId, snippet.getName(), converter.getType(), e);
                    throw new BundleException("Error converting " + transformId + ": " + e.getMessage(),
                            transformId, e);
                }
                snippet.setConverterType(converter.getType());
                metrics.recordConversion(converter.getType().getTag(), "success");
                log.info("Snippet dönüştürüldü — {} ({}), {} referans",
                        snippet.getName(), converter.getType().getTag(), snippet.getAssets().size());
                break;
            }
        }
    }

    // ── Kreatif oluşturma ──────────────────────────────────────────

    /**
     * Seçilen snippet için HTML parçası ve asset tanımlarını üretir.
     * <p>
     * Arşiv yeni bir tutamaçla yeniden açılır; snippet'in referans verdiği her asset
     * tekrarsız olarak bir kez eklenir.
     *
     * @throws BundleException Snippet yoksa, referans verilen asset bundle'da değilse
     *                         veya arşiv okunamazsa
     */
    public CreativePart getCreativePart(String snippetName) throws BundleException {
        Snippet snippet = snippetName != null ? snippets.get(snippetName) : null;
        if (snippet == null) {
            throw new BundleException("Invalid snippet name or bundle not populated: " + snippetName, transformId);
        }

        var creativeAssets = new ArrayList<CreativeAsset>();
        int omitted = 0;
        try (ArchiveReader reader = openArchive()) {
            for (String assetName : new LinkedHashSet<>(snippet.getAssets())) {
                Asset asset = assets.get(assetName);
                if (asset == null) {
                    throw new BundleException("Referans verilen asset bundle'da yok: " + assetName
                            + " (" + transformId + ")", transformId);
                }
                if (asset.isOverLimit() || asset.isUnsupported()) {
                    omitted++;
                    log.warn("Asset politika gereği atlandı, makro korunuyor — {} ({}, {} byte)",
                            asset.getName(), asset.getMimetype(), asset.getSize());
                }
                creativeAssets.add(asset.toCreativeAsset(transformId, reader));
            }
        }

        metrics.recordCreativePart(creativeAssets.size(), omitted);
        log.info("Kreatif oluşturuldu — dönüşüm: {}, snippet: {}, asset: {}, atlanan: {}",
                transformId, snippetName, creativeAssets.size(), omitted);
        if (log.isDebugEnabled()) {
            log.debug("Kreatif asset tablosu:\n{}", assetsTable(snippetName));
        }
        return new CreativePart(snippet.asSnippet(), creativeAssets);
    }

    // ── Özet ───────────────────────────────────────────────────────

    public BundleSummary summary() {
        List<ResourceSummary> snippetSummaries = snippets.values().stream().map(Snippet::summary).toList();
        List<ResourceSummary> assetSummaries = assets.values().stream().map(Asset::summary).toList();
        return new BundleSummary(transformId, snippetSummaries, assetSummaries);
    }

    /**
     * Snippet'in referans verdiği asset'lerin sabit genişlikli tablosu.
     *
     * @throws IllegalArgumentException Snippet yoksa
     */
    public String assetsTable(String snippetName) {
        Snippet snippet = snippets.get(snippetName);
        if (snippet == null) {
            throw new IllegalArgumentException("Snippet bulunamadı: " + snippetName);
        }
        List<Asset> referenced = new LinkedHashSet<>(snippet.getAssets()).stream()
                .map(assets::get)
                .filter(Objects::nonNull)
                .toList();
        return AssetsTable.render(snippetName, referenced);
    }
}
