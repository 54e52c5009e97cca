package io.mersel.services.creative.application.enums;

/**
 * Kreatif dönüştürücü tipleri.
 * <p>
 * Her snippet, içerik imzasına göre bu tiplerden biriyle dönüştürülür.
 * {@link #DEFAULT} her zaman eşleşen son çaredir.
 */
public enum ConverterType {

    /** Adobe Edge Animate çalışma zamanı ile üretilmiş kreatifler. */
    EDGE("edge"),

    /** Tumult Hype ile üretilmiş kreatifler. */
    HYPE("hype"),

    /** Genel HTML5 kreatifler. */
    DEFAULT("default");

    private final String tag;

    ConverterType(String tag) {
        this.tag = tag;
    }

    /** Metadata görünümünde kullanılan kısa etiket ({@code edge}, {@code hype}, {@code default}). */
    public String getTag() {
        return tag;
    }
}
