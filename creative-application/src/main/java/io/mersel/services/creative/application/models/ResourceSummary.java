package io.mersel.services.creative.application.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Bundle içindeki tek bir snippet veya asset'in metadata görünümü.
 * <p>
 * Snippet'lerde {@code x5type} dolu, asset bayrakları {@code null} olur;
 * asset'lerde tersi geçerlidir.
 *
 * @param id          Makro kimliği (ör: {@code PNG1})
 * @param name        Arşiv içindeki yol
 * @param size        Arşiv dizininde bildirilen boyut (byte)
 * @param mimetype    Uzantıdan tahmin edilen MIME tipi, bilinmiyorsa {@code null}
 * @param root        Dosyanın bulunduğu dizin
 * @param basename    Dizin olmadan dosya adı
 * @param assets      Dönüşüm sırasında keşfedilen referanslar
 * @param x5type      Snippet'i dönüştüren dönüştürücünün etiketi
 * @param inlineable  İçeriği yeniden yazılabilir metin asset'i mi
 * @param inlined     Yeniden yazıldı ve başka asset'lere referans veriyor mu
 * @param overLimit   Boyut sınırını aşıyor mu
 * @param unsupported MIME tipi desteklenmiyor mu
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceSummary(
        String id,
        String name,
        long size,
        String mimetype,
        String root,
        String basename,
        List<String> assets,
        String x5type,
        Boolean inlineable,
        Boolean inlined,
        Boolean overLimit,
        Boolean unsupported
) {
}
