package io.mersel.services.creative.application.interfaces;

import java.time.Instant;

/**
 * Yüklenmiş arşivler için {@link ICreativeTransform} örnekleri üretir.
 */
public interface ICreativeTransformFactory {

    /**
     * Verilen kimlikle bir dönüşüm nesnesi oluşturur. Arşiv henüz okunmaz.
     *
     * @param transformId Dönüşüm kimliği
     * @param filename    Yüklenen dosyanın adı (opsiyonel)
     * @param source      Arşiv byte kaynağı
     */
    ICreativeTransform open(String transformId, String filename, ArchiveSource source);

    /**
     * Ağ kodu, kullanıcı ve oluşturulma zamanından yeni bir dönüşüm kimliği üretir.
     *
     * @throws IllegalArgumentException Ağ kodu veya kullanıcı kimliği boşsa
     */
    String newTransformId(String networkCode, String userId, Instant createdAt);
}
