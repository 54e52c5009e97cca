package io.mersel.services.creative.application.models;

import java.util.List;

/**
 * Dönüştürülmüş bundle'ın metadata görünümü: tüm snippet ve asset özetleri.
 */
public record BundleSummary(String transformId, List<ResourceSummary> snippets, List<ResourceSummary> assets) {

    public BundleSummary {
        snippets = List.copyOf(snippets);
        assets = List.copyOf(assets);
    }
}
