package io.mersel.services.creative.infrastructure.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Kreatif bundle yapılandırma özellikleri.
 * <p>
 * {@code creative.bundle} prefix'i altındaki değerleri okur.
 * <ul>
 *   <li>{@code asset-size-limit} — Asset başına byte sınırı; aşan asset tek sıfır byte olarak gönderilir</li>
 *   <li>{@code max-entries} — Arşivdeki en fazla girdi sayısı (pozitif olmalı)</li>
 *   <li>{@code max-archive-size} — Arşivin en büyük boyutu, byte (pozitif olmalı)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "creative.bundle")
public class CreativeProperties {

    private static final Logger log = LoggerFactory.getLogger(CreativeProperties.class);

    static final long DEFAULT_ASSET_SIZE_LIMIT = 1_000_000L;
    static final int DEFAULT_MAX_ENTRIES = 5000;
    static final long DEFAULT_MAX_ARCHIVE_SIZE = 100L * 1024 * 1024;

    private long assetSizeLimit = DEFAULT_ASSET_SIZE_LIMIT;
    private int maxEntries = DEFAULT_MAX_ENTRIES;
    private long maxArchiveSize = DEFAULT_MAX_ARCHIVE_SIZE;

    @PostConstruct
    void validate() {
        if (assetSizeLimit <= 0) {
            log.warn("asset-size-limit değeri pozitif olmalı (verilen: {}), varsayılan {} byte kullanılıyor",
                    assetSizeLimit, DEFAULT_ASSET_SIZE_LIMIT);
            assetSizeLimit = DEFAULT_ASSET_SIZE_LIMIT;
        }
        if (maxEntries <= 0) {
            log.warn("max-entries değeri pozitif olmalı (verilen: {}), varsayılan {} kullanılıyor",
                    maxEntries, DEFAULT_MAX_ENTRIES);
            maxEntries = DEFAULT_MAX_ENTRIES;
        }
        if (maxArchiveSize <= 0) {
            log.warn("max-archive-size değeri pozitif olmalı (verilen: {}), varsayılan {} byte kullanılıyor",
                    maxArchiveSize, DEFAULT_MAX_ARCHIVE_SIZE);
            maxArchiveSize = DEFAULT_MAX_ARCHIVE_SIZE;
        }
    }

    public long getAssetSizeLimit() {
        return assetSizeLimit;
    }

    public void setAssetSizeLimit(long assetSizeLimit) {
        this.assetSizeLimit = assetSizeLimit;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public long getMaxArchiveSize() {
        return maxArchiveSize;
    }

    public void setMaxArchiveSize(long maxArchiveSize) {
        this.maxArchiveSize = maxArchiveSize;
    }
}
