package io.mersel.services.creative.infrastructure.bundle;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Dosya uzantısından MIME tipi tahmini ve kreatif kaynak kategorileri.
 */
public final class MimeTypes {

    public static final String SNIPPET = "text/html";

    /** Script olarak ele alınan tipler; içerikleri mod operatörü kaçışından geçer. */
    public static final Set<String> SCRIPT = Set.of("application/javascript", "application/x-javascript");

    /** İçeriği yeniden yazılıp gömülebilen metin tipleri. */
    public static final Set<String> INLINEABLE = Set.of(
            "text/css", "text/html", "text/plain", "application/javascript", "application/x-javascript");

    /** Ad-server tarafından kabul edilmeyen tipler (vektör görseller). */
    public static final Set<String> UNSUPPORTED = Set.of("image/svg+xml");

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry("html", "text/html"),
            Map.entry("htm", "text/html"),
            Map.entry("css", "text/css"),
            Map.entry("txt", "text/plain"),
            Map.entry("js", "application/javascript"),
            Map.entry("json", "application/json"),
            Map.entry("xml", "application/xml"),
            Map.entry("png", "image/png"),
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("jpe", "image/jpeg"),
            Map.entry("gif", "image/gif"),
            Map.entry("webp", "image/webp"),
            Map.entry("bmp", "image/bmp"),
            Map.entry("ico", "image/vnd.microsoft.icon"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("mp3", "audio/mpeg"),
            Map.entry("wav", "audio/x-wav"),
            Map.entry("ogg", "audio/ogg"),
            Map.entry("mp4", "video/mp4"),
            Map.entry("webm", "video/webm"),
            Map.entry("mov", "video/quicktime"),
            Map.entry("woff", "font/woff"),
            Map.entry("woff2", "font/woff2"),
            Map.entry("ttf", "font/ttf"),
            Map.entry("otf", "font/otf"),
            Map.entry("eot", "application/vnd.ms-fontobject"),
            Map.entry("swf", "application/x-shockwave-flash")
    );

    private MimeTypes() {
    }

    /**
     * Yolun uzantısından MIME tipini tahmin eder; tanınmıyorsa {@code null}.
     */
    public static String guess(String name) {
        String extension = extensionOf(name);
        if (extension.isEmpty()) {
            return null;
        }
        return BY_EXTENSION.get(extension.substring(1).toLowerCase(Locale.ROOT));
    }

    /**
     * Dosya adının noktayla birlikte uzantısı ({@code .png}); yoksa boş string.
     * Baştaki noktalar uzantı sayılmaz ({@code .htaccess} → boş).
     */
    public static String extensionOf(String name) {
        String basename = name.substring(name.lastIndexOf('/') + 1);
        int dot = basename.lastIndexOf('.');
        if (dot <= 0 || dot == basename.length() - 1) {
            return "";
        }
        for (int i = 0; i < dot; i++) {
            if (basename.charAt(i) != '.') {
                return basename.substring(dot);
            }
        }
        return "";
    }
}
