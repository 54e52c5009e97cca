package io.mersel.services.creative.application.models;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Ad-server kreatif API'sine gönderilecek tam kreatif.
 * <p>
 * {@link CreativePart} içeriğine doğrulanmış metadata alanları eklenmiş halidir:
 * <pre>
 * {
 *   "name": "X5 banner.zip abc123",
 *   "advertiserId": 12345,
 *   "size": {"width": 300, "height": 250},
 *   "destinationUrl": "https://example.com",
 *   "htmlSnippet": "...",
 *   "customCreativeAssets": [...]
 * }
 * </pre>
 */
@JsonPropertyOrder({"name", "advertiserId", "size", "destinationUrl", "htmlSnippet", "customCreativeAssets"})
public class Creative {

    private final String name;
    private final long advertiserId;
    private final CreativeSize size;
    private final String destinationUrl;
    private final String htmlSnippet;
    private final List<CreativeAsset> customCreativeAssets;

    private Creative(Builder builder) {
        this.name = builder.name;
        this.advertiserId = builder.advertiserId;
        this.size = builder.size;
        this.destinationUrl = builder.destinationUrl;
        this.htmlSnippet = builder.htmlSnippet;
        this.customCreativeAssets = builder.customCreativeAssets;
    }

    public String getName() {
        return name;
    }

    public long getAdvertiserId() {
        return advertiserId;
    }

    public CreativeSize getSize() {
        return size;
    }

    public String getDestinationUrl() {
        return destinationUrl;
    }

    public String getHtmlSnippet() {
        return htmlSnippet;
    }

    public List<CreativeAsset> getCustomCreativeAssets() {
        return customCreativeAssets;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private long advertiserId;
        private CreativeSize size;
        private String destinationUrl;
        private String htmlSnippet;
        private List<CreativeAsset> customCreativeAssets = List.of();

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder advertiserId(long advertiserId) {
            this.advertiserId = advertiserId;
            return this;
        }

        public Builder size(CreativeSize size) {
            this.size = size;
            return this;
        }

        public Builder destinationUrl(String destinationUrl) {
            this.destinationUrl = destinationUrl;
            return this;
        }

        /** Kreatif parçasının HTML ve asset listesini kopyalar. */
        public Builder part(CreativePart part) {
            this.htmlSnippet = part.htmlSnippet();
            this.customCreativeAssets = part.customCreativeAssets();
            return this;
        }

        public Creative build() {
            return new Creative(this);
        }
    }
}
