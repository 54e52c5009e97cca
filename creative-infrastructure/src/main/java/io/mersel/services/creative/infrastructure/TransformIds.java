package io.mersel.services.creative.infrastructure;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Base64;

/**
 * Dönüşüm kimliği üretici.
 * <p>
 * Kimlik, ağ kodu + kullanıcı kimliği + oluşturulma zamanının (saniye, {@code ".0"} ekiyle)
 * MD5 özetinin base64 halidir. {@code +} yerine {@code _}, {@code /} yerine {@code -}
 * kullanılır ve dolgu atılır; sonuç 22 karakterdir ve dosya adlarında güvenle kullanılır.
 */
public final class TransformIds {

    private TransformIds() {
    }

    /**
     * @throws IllegalArgumentException Ağ kodu veya kullanıcı kimliği boşsa
     */
    public static String generate(String networkCode, String userId, Instant createdAt) {
        if (networkCode == null || networkCode.isBlank()) {
            throw new IllegalArgumentException("Cannot generate id, empty network code");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("Cannot generate id, no user");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Cannot generate id, no creation time");
        }
        String seed = networkCode + userId + createdAt.getEpochSecond() + ".0";
        String encoded = Base64.getEncoder().withoutPadding().encodeToString(md5(seed));
        return encoded.replace('+', '_').replace('/', '-');
    }

    private static byte[] md5(String value) {
        try {
            return MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algoritması bulunamadı", e);
        }
    }
}
