package io.mersel.services.creative.infrastructure.converter;

import io.mersel.services.creative.application.enums.ConverterType;
import io.mersel.services.creative.application.interfaces.ConverterException;
import io.mersel.services.creative.infrastructure.bundle.Bundle;
import io.mersel.services.creative.infrastructure.bundle.Snippet;

/**
 * Belirli bir yazım aracının ürettiği kreatifleri tanıyan ve yeniden yazan strateji.
 * <p>
 * Uygulamalar durumsuzdur; bundle yalnızca {@link #convert} çağrısı süresince
 * sahiplenilmeden kullanılır. Bundle dönüştürücüleri öncelik sırasıyla dener ve
 * eşleşen ilkini çalıştırır.
 */
public interface CreativeConverter {

    ConverterType getType();

    /**
     * Snippet'in ham içeriği bu dönüştürücünün imzasını taşıyor mu.
     */
    boolean matches(Snippet snippet);

    /**
     * Snippet'i (ve referans verdiği gömülebilir asset'leri) yerinde yeniden yazar.
     *
     * @param bundle  Snippet'in ait olduğu bundle
     * @param snippet Dönüştürülecek snippet
     * @throws ConverterException Eşleşen imzanın beklenen bir parçası bulunamazsa
     */
    void convert(Bundle bundle, Snippet snippet) throws ConverterException;
}
