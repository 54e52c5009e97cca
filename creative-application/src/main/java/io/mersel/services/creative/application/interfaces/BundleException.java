package io.mersel.services.creative.application.interfaces;

/**
 * Arşiv veya bundle yapısı kullanılamaz olduğunda fırlatılan istisna.
 * <p>
 * Açılamayan/bozuk/çok büyük arşiv, okunamayan arşiv girdisi, snippet veya asset
 * bulunamaması, geçersiz snippet adı ve sarmalanmış dönüştürücü hataları bu
 * tiple işlemin dışına taşınır.
 */
public class BundleException extends Exception {

    private final String transformId;

    public BundleException(String message) {
        this(message, null, null);
    }

    public BundleException(String message, String transformId) {
        this(message, transformId, null);
    }

    public BundleException(String message, String transformId, Throwable cause) {
        super(message, cause);
        this.transformId = transformId;
    }

    /**
     * Hatanın ait olduğu dönüşüm kimliği, bilinmiyorsa {@code null}.
     */
    public String getTransformId() {
        return transformId;
    }
}
