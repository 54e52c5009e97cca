package io.mersel.services.creative.application.interfaces;

/**
 * Araca özel bir dönüştürücü, eşleştiği snippet'te beklenen yapısal işareti
 * (çalışma zamanı script'i, üretilmiş script etiketi, kompozisyon yükleyici çağrısı)
 * bulamadığında fırlatılır.
 * <p>
 * Bundle bu istisnayı loglar ve dönüşüm kimliğiyle birlikte {@link BundleException}
 * olarak yeniden fırlatır; başka bir dönüştürücüye geri dönülmez.
 */
public class ConverterException extends Exception {

    public ConverterException(String message) {
        super(message);
    }

    public ConverterException(String message, Throwable cause) {
        super(message, cause);
    }
}
