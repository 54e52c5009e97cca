package io.mersel.services.creative.infrastructure.bundle;

import io.mersel.services.creative.application.interfaces.BundleException;
import io.mersel.services.creative.application.models.CreativeAsset;
import io.mersel.services.creative.application.models.ResourceSummary;

import java.util.Base64;
import java.util.List;

/**
 * Snippet'in referans verdiği HTML dışı dosya (görsel, script, stil vb.).
 * <p>
 * Türetilmiş bayraklar ({@link #isOverLimit()}, {@link #isUnsupported()},
 * {@link #isInlineable()}, {@link #isInlined()}) her çağrıda mevcut durumdan hesaplanır.
 */
public class Asset extends CreativeResource {

    /** Boyut veya tip politikası nedeniyle atlanan asset'in yerine gönderilen tek byte. */
    static final byte[] OMITTED_SENTINEL = {0};

    private final long sizeLimit;

    public Asset(String id, String name, long size, String mimetype, long sizeLimit) {
        super(id, name, size, mimetype);
        this.sizeLimit = sizeLimit;
    }

    /** Boyut, yapılandırılmış sınırdan kesinlikle büyük mü. */
    public boolean isOverLimit() {
        return getSize() > sizeLimit;
    }

    /** MIME tipi bilinmiyor veya ad-server tarafından kabul edilmiyor mu. */
    public boolean isUnsupported() {
        return getMimetype() == null || MimeTypes.UNSUPPORTED.contains(getMimetype());
    }

    /** İçeriği yeniden yazılabilir metin tipi mi (CSS, düz metin, HTML, JavaScript). */
    public boolean isInlineable() {
        return getMimetype() != null && MimeTypes.INLINEABLE.contains(getMimetype());
    }

    /** Yeniden yazıldı ve kendisi başka asset'lere referans veriyor mu. */
    public boolean isInlined() {
        return isInlineable() && !getAssets().isEmpty();
    }

    /**
     * API'nin beklediği asset tanımını üretir.
     * <p>
     * Sınırı aşan veya desteklenmeyen asset'ler tek sıfır byte olarak gönderilir;
     * makro referansı geçerli kalır. Yeniden yazılabilir asset'lerde dönüştürülmüş
     * içerik, diğerlerinde arşivden yeni okunan byte'lar kullanılır.
     *
     * @param transformId Dosya adına eklenen dönüşüm kimliği
     * @param reader      Yeniden açılmış arşiv
     */
    public CreativeAsset toCreativeAsset(String transformId, ArchiveReader reader) throws BundleException {
        byte[] bytes;
        if (isOverLimit() || isUnsupported()) {
            bytes = OMITTED_SENTINEL;
        } else if (isInlineable()) {
            if (isConverted()) {
                bytes = getParsedBytes();
            } else {
                if (!isLoaded()) {
                    load(reader);
                }
                bytes = getContent();
            }
        } else {
            bytes = reader.read(getName());
        }
        return new CreativeAsset(getId(), new CreativeAsset.AssetPayload(
                Base64.getEncoder().encodeToString(bytes),
                getId() + "-" + transformId + getExtension()));
    }

    public ResourceSummary summary() {
        return new ResourceSummary(getId(), getName(), getSize(), getMimetype(), getRoot(), getBasename(),
                List.copyOf(getAssets()), null,
                isInlineable(), isInlined(), isOverLimit(), isUnsupported());
    }
}
