package io.mersel.services.creative.application.models;

/**
 * Kreatif oluşturma isteği modeli.
 * <p>
 * Dış katmandan gelen ham değerleri taşır; doğrulama dönüşüm katmanında yapılır.
 */
public class CreativeRequest {

    /**
     * Arşiv içindeki snippet adı (ör: {@code banner/index.html}).
     */
    private String snippetName;

    /**
     * Kreatifin kaydedileceği reklamveren kimliği. Tamsayı olmalı.
     */
    private String advertiserId;

    /**
     * Tıklama hedef URL'i. Şema ve host içermeli.
     */
    private String destinationUrl;

    /**
     * {@code GENİŞLİKxYÜKSEKLİK} biçiminde boyut (ör: {@code 300x250}).
     */
    private String size;

    /**
     * Kreatif adı (opsiyonel). Boşsa otomatik üretilir.
     */
    private String creativeName;

    public CreativeRequest() {
    }

    public CreativeRequest(String snippetName, String advertiserId, String destinationUrl,
                           String size, String creativeName) {
        this.snippetName = snippetName;
        this.advertiserId = advertiserId;
        this.destinationUrl = destinationUrl;
        this.size = size;
        this.creativeName = creativeName;
    }

    public String getSnippetName() {
        return snippetName;
    }

    public void setSnippetName(String snippetName) {
        this.snippetName = snippetName;
    }

    public String getAdvertiserId() {
        return advertiserId;
    }

    public void setAdvertiserId(String advertiserId) {
        this.advertiserId = advertiserId;
    }

    public String getDestinationUrl() {
        return destinationUrl;
    }

    public void setDestinationUrl(String destinationUrl) {
        this.destinationUrl = destinationUrl;
    }

    public String getSize() {
        return size;
    }

    public void setSize(String size) {
        this.size = size;
    }

    public String getCreativeName() {
        return creativeName;
    }

    public void setCreativeName(String creativeName) {
        this.creativeName = creativeName;
    }
}
