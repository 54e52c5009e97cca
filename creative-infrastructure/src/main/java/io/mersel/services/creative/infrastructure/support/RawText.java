package io.mersel.services.creative.infrastructure.support;

import java.nio.charset.StandardCharsets;

/**
 * Byte başına bir karakterlik metin görünümü.
 * <p>
 * Kaynak içerikleri ISO-8859-1 ile çözülüp kodlanır; böylece dosyanın karakter
 * kodlaması ne olursa olsun yeniden yazma sonrası değişmeyen her byte aynen kalır.
 * Asset adları ve diğer Unicode metinler bu görünüme UTF-8 byte'ları üzerinden
 * çevrilir.
 */
public final class RawText {

    private RawText() {
    }

    public static String decode(byte[] bytes) {
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    public static byte[] encode(String raw) {
        return raw.getBytes(StandardCharsets.ISO_8859_1);
    }

    /** Unicode metnin UTF-8 byte'larının ham görünümü. */
    public static String of(String unicode) {
        return decode(unicode.getBytes(StandardCharsets.UTF_8));
    }

    /** Ham görünümdeki byte'ları UTF-8 olarak çözer. */
    public static String toUnicode(String raw) {
        return new String(encode(raw), StandardCharsets.UTF_8);
    }
}
