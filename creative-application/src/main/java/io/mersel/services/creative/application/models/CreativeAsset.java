package io.mersel.services.creative.application.models;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Ad-server kreatif API'sine gönderilen tek asset tanımı.
 * <p>
 * Örnek çıktı:
 * <pre>
 * {"macroName": "PNG1", "asset": {"assetByteArray": "iVBORw0...", "fileName": "PNG1-abc123.png"}}
 * </pre>
 *
 * @param macroName Asset kimliği; HTML içindeki {@code %%FILE:macroName%%} ile eşleşir
 * @param asset     Base64 içerik ve dosya adı
 */
@JsonPropertyOrder({"macroName", "asset"})
public record CreativeAsset(String macroName, AssetPayload asset) {

    /**
     * @param assetByteArray Base64 kodlanmış içerik; politika gereği atlanan asset'lerde tek sıfır byte
     * @param fileName       {@code {id}-{transformId}{uzantı}} biçiminde dosya adı
     */
    @JsonPropertyOrder({"assetByteArray", "fileName"})
    public record AssetPayload(String assetByteArray, String fileName) {
    }
}
