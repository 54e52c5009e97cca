package io.mersel.services.creative.application.models;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Bundle'ın ürettiği kreatif parçası: yeniden yazılmış HTML parçası ve
 * referans verilen asset'ler.
 * <p>
 * Metadata alanları (ad, reklamveren, boyut, hedef URL) bu parçaya
 * dönüşüm katmanında eklenir, bkz. {@link Creative}.
 */
@JsonPropertyOrder({"htmlSnippet", "customCreativeAssets"})
public record CreativePart(String htmlSnippet, List<CreativeAsset> customCreativeAssets) {

    public CreativePart {
        customCreativeAssets = List.copyOf(customCreativeAssets);
    }
}
