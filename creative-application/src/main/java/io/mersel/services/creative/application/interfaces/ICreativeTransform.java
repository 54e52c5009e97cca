package io.mersel.services.creative.application.interfaces;

import io.mersel.services.creative.application.models.BundleSummary;
import io.mersel.services.creative.application.models.Creative;
import io.mersel.services.creative.application.models.CreativeRequest;

/**
 * Tek bir yüklenmiş kreatif arşivi üzerindeki dönüşüm.
 * <p>
 * Arşiv ilk ihtiyaç anında okunur, sınıflandırılır ve dönüştürülür; sonuç bu
 * nesnenin ömrü boyunca saklanır. Aynı nesne üzerinden yapılan tekrar istekler
 * arşivi yeniden sınıflandırmaz. Nesne eşzamanlı kullanım için tasarlanmamıştır.
 */
public interface ICreativeTransform {

    /** Dönüşüm kimliği; dosya adlarında ve hata mesajlarında kullanılır. */
    String getTransformId();

    /** Yüklenen arşivin orijinal dosya adı, bilinmiyorsa {@code null}. */
    String getFilename();

    /**
     * Dönüştürülmüş bundle'daki tüm snippet ve asset'lerin özetini döner.
     *
     * @throws TransformException Arşiv açılamadığında veya dönüştürülemediğinde
     */
    BundleSummary summary() throws TransformException;

    /**
     * Seçilen snippet için ad-server API'sine gönderilecek kreatifi oluşturur.
     *
     * @param request Snippet adı ve doğrulanacak metadata alanları
     * @return HTML parçası, asset listesi ve metadata alanlarını içeren kreatif
     * @throws TransformException Metadata geçersizse veya bundle kullanılamazsa
     */
    Creative getCreative(CreativeRequest request) throws TransformException;

    /**
     * Dönüşüm başarısız olduğunda fırlatılan istisna.
     */
    class TransformException extends Exception {
        public TransformException(String message) {
            super(message);
        }

        public TransformException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
