package io.mersel.services.creative.infrastructure.bundle;

import io.mersel.services.creative.application.interfaces.BundleException;
import io.mersel.services.creative.infrastructure.support.Macros;
import io.mersel.services.creative.infrastructure.support.RawText;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Kreatif bundle'ındaki bir dosya: snippet veya asset.
 * <p>
 * İçerik iki aşamalıdır: yüklenmemiş ({@code content == null}) veya yüklenmiş.
 * Yükleme açık bir {@link ArchiveReader} ile yapılır. Yeniden yazılmış içerik
 * ({@link #getParsedContent()}) yalnızca dönüşüm sırasında atanır ve kaynağı
 * geri alınamaz biçimde "dönüştürülmüş" olarak işaretler.
 * <p>
 * Metin erişimi {@link RawText} görünümündedir: her karakter bir byte'tır,
 * yeniden yazılmayan byte'lar kodlamadan bağımsız olarak korunur.
 */
public abstract class CreativeResource {

    private final String id;
    private final String name;
    private final long size;
    private final String mimetype;
    private final List<String> assets = new ArrayList<>();

    private byte[] content;
    private String parsedContent;
    private boolean converted;

    protected CreativeResource(String id, String name, long size, String mimetype) {
        this.id = id;
        this.name = name;
        this.size = size;
        this.mimetype = mimetype;
    }

    /** Uzantı ve sayaçtan üretilen makro kimliği (ör: {@code JS3}). */
    public String getId() {
        return id;
    }

    /** Arşiv içindeki yol, arşivde saklandığı haliyle. */
    public String getName() {
        return name;
    }

    /** Arşiv dizininde bildirilen boyut. */
    public long getSize() {
        return size;
    }

    public String getMimetype() {
        return mimetype;
    }

    /** Dosyanın bulunduğu dizin; arşiv kökündeyse boş string. */
    public String getRoot() {
        int slash = name.lastIndexOf('/');
        return slash < 0 ? "" : name.substring(0, slash);
    }

    public String getBasename() {
        return name.substring(name.lastIndexOf('/') + 1);
    }

    /** Noktayla birlikte orijinal uzantı. */
    public String getExtension() {
        return MimeTypes.extensionOf(name);
    }

    /**
     * Adı verilen köke göre göreli hale getirir. Kök boşsa ad aynen döner,
     * ad kökle başlamıyorsa boş döner.
     */
    public Optional<String> nameRelativeTo(String root) {
        if (root == null || root.isEmpty()) {
            return Optional.of(name);
        }
        String prefix = root.endsWith("/") ? root : root + "/";
        if (!name.startsWith(prefix)) {
            return Optional.empty();
        }
        return Optional.of(name.substring(prefix.length()));
    }

    // ── İçerik ─────────────────────────────────────────────────────

    public boolean isLoaded() {
        return content != null;
    }

    /**
     * İçeriği açık arşivden okur.
     */
    public void load(ArchiveReader reader) throws BundleException {
        this.content = reader.read(name);
    }

    /**
     * Orijinal içerik.
     *
     * @throws IllegalStateException İçerik yüklenmemişse
     */
    public byte[] getContent() {
        if (content == null) {
            throw new IllegalStateException("İçerik yüklenmedi: " + name);
        }
        return content;
    }

    /** Orijinal içeriğin ham metin görünümü. */
    public String getText() {
        return RawText.decode(getContent());
    }

    /**
     * Orijinal içeriği değiştirir. Dönüştürücüler, asıl yeniden yazmadan önce
     * içeriği hazırlamak için kullanır.
     */
    public void setText(String text) {
        this.content = RawText.encode(text);
    }

    /** Yeniden yazılmış içeriğin ham metin görünümü; dönüşümden önce {@code null}. */
    public String getParsedContent() {
        return parsedContent;
    }

    /** Yeniden yazılmış içerik byte olarak; dönüşümden önce {@code null}. */
    public byte[] getParsedBytes() {
        return parsedContent == null ? null : RawText.encode(parsedContent);
    }

    /**
     * Yeniden yazılmış içeriği atar ve kaynağı dönüştürülmüş olarak işaretler.
     * HTML ve script içeriği mod operatörü kaçışından geçer.
     */
    public void setParsedContent(String value) {
        if (isScriptOrSnippet()) {
            value = Macros.escapeModuloOperator(value);
        }
        this.parsedContent = value;
        this.converted = true;
    }

    public boolean isConverted() {
        return converted;
    }

    private boolean isScriptOrSnippet() {
        return MimeTypes.SNIPPET.equals(mimetype) || MimeTypes.SCRIPT.contains(mimetype);
    }

    // ── Referanslar ────────────────────────────────────────────────

    /**
     * Dönüşüm sırasında keşfedilen asset adları, keşif sırasıyla. Tekrar içerebilir.
     */
    public List<String> getAssets() {
        return Collections.unmodifiableList(assets);
    }

    public void addAsset(String assetName) {
        assets.add(assetName);
    }

    public void addAssets(Collection<String> assetNames) {
        assets.addAll(assetNames);
    }

    public void clearAssets() {
        assets.clear();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + " " + name + "]";
    }
}
