package io.mersel.services.creative.infrastructure.support;

import io.mersel.services.creative.infrastructure.bundle.Asset;
import io.mersel.services.creative.infrastructure.bundle.CreativeResource;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Asset yolu eşleştirme yardımcıları.
 * <p>
 * Durumsuzdur; snippet ve asset içeriklerindeki yol referanslarını bulmak için
 * tek bir alternation regex'i üretir ve eşleşen yolu makroya çevirir.
 */
public final class TokenMatchers {

    private static final String UNRESERVED =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789_.-/";

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    /** Hiçbir metinle eşleşmeyen, tek gruplu desen. */
    private static final Pattern NEVER_MATCHES = Pattern.compile("((?!))");

    private TokenMatchers() {
    }

    // ── Yüzde kodlama ──────────────────────────────────────────────

    /**
     * Yolu yüzde kodlar. Harfler, rakamlar ve {@code _.-/} olduğu gibi kalır,
     * diğer her UTF-8 byte'ı ({@code ~} dahil) {@code %XX} olur.
     */
    public static String quote(String token) {
        var sb = new StringBuilder(token.length());
        for (byte b : token.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if (c < 0x80 && UNRESERVED.indexOf(c) >= 0) {
                sb.append((char) c);
            } else {
                sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return sb.toString();
    }

    /**
     * {@code %XX} dizilerini çözer. {@code +} boşluğa çevrilmez.
     *
     * @throws IllegalArgumentException Geçersiz kaçış dizisinde
     */
    public static String unquote(String token) {
        if (token.indexOf('%') < 0) {
            return token;
        }
        var out = new ByteArrayOutputStream(token.length());
        byte[] bytes = token.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < bytes.length; i++) {
            byte b = bytes[i];
            if (b != '%') {
                out.write(b);
                continue;
            }
            if (i + 2 >= bytes.length) {
                throw new IllegalArgumentException("Eksik yüzde kaçışı: " + token);
            }
            int hi = Character.digit(bytes[i + 1], 16);
            int lo = Character.digit(bytes[i + 2], 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Geçersiz yüzde kaçışı: " + token);
            }
            out.write((hi << 4) | lo);
            i += 2;
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    /**
     * Token'ların düz ve yüzde kodlanmış hallerini içeren küme, {@link RawText}
     * görünümünde.
     */
    public static Set<String> quotedAndUnquoted(Collection<String> tokens) {
        var result = new LinkedHashSet<String>();
        for (String token : tokens) {
            result.add(RawText.of(token));
        }
        for (String token : tokens) {
            result.add(quote(token));
        }
        return result;
    }

    // ── Desen üretimi ──────────────────────────────────────────────

    /**
     * Token'ların düz veya yüzde kodlanmış herhangi biriyle eşleşen desen.
     * Desen {@link RawText} görünümündeki içerik için üretilir; eşleşen metin 1. gruptadır.
     */
    public static Pattern quotedTokensPattern(Collection<String> tokens) {
        return quotedTokensPattern(tokens, "%s");
    }

    /**
     * Her token'ı {@code format} ile sararak alternation deseni üretir.
     * <p>
     * {@code format} içindeki {@code %s} kaçışlanmış token ile değiştirilir, ör:
     * {@code ".{2}%s.{2}"} token'ı iki karakterlik bağlamla birlikte yakalar.
     * Uzun token'lar önce denenir; aynı konumda kısa bir yol uzun olanı kesmez.
     */
    public static Pattern quotedTokensPattern(Collection<String> tokens, String format) {
        if (tokens.isEmpty()) {
            return NEVER_MATCHES;
        }
        String alternation = quotedAndUnquoted(tokens).stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .map(token -> String.format(format, Pattern.quote(token)))
                .collect(Collectors.joining("|"));
        return Pattern.compile("(" + alternation + ")");
    }

    /**
     * Desendeki her yakalama grubunun metinde en az bir kez eşleşip eşleşmediğini döner.
     * Hiç eşleşme yoksa {@code false}.
     */
    public static boolean allGroupsMatch(Pattern pattern, CharSequence text) {
        Matcher matcher = pattern.matcher(text);
        int groups = matcher.groupCount();
        var seen = new boolean[groups + 1];
        int remaining = groups;
        boolean matched = false;
        while (matcher.find()) {
            matched = true;
            for (int g = 1; g <= groups; g++) {
                if (!seen[g] && matcher.group(g) != null) {
                    seen[g] = true;
                    remaining--;
                }
            }
            if (remaining == 0) {
                return true;
            }
        }
        return matched && remaining == 0;
    }

    // ── Değiştirme ─────────────────────────────────────────────────

    /**
     * Eşleşen yolu asset makrosuna çeviren fonksiyon.
     * <p>
     * Eşleşen ham metin UTF-8 olarak çözülür; {@code %} içeriyorsa ardından yüzde
     * kodlaması da çözülür. Asset bulunamazsa
     * metin değişmeden bırakılır. Bulunursa asset adı {@code owner} kaynağının
     * referans listesine eklenir.
     *
     * @param owner    Referansın kaydedileceği kaynak
     * @param assets   Göreli ad → asset eşlemesi
     * @param template Makro şablonu, {@code null} ise {@link Macros#FILE_TEMPLATE}
     */
    public static Function<MatchResult, String> referenceReplacer(CreativeResource owner,
                                                                  Map<String, Asset> assets,
                                                                  String template) {
        return match -> {
            String matched = match.group(1);
            String name = RawText.toUnicode(matched);
            if (name.indexOf('%') >= 0) {
                try {
                    name = unquote(name);
                } catch (IllegalArgumentException e) {
                    return matched;
                }
            }
            Asset asset = assets.get(name);
            if (asset == null) {
                return matched;
            }
            owner.addAsset(asset.getName());
            return Macros.render(template, asset.getId());
        };
    }

    /**
     * Her eşleşmeyi fonksiyonun döndürdüğü düz metinle değiştirir.
     * Dönen metindeki {@code $} ve {@code \} grup referansı olarak yorumlanmaz.
     */
    public static String replaceAll(Pattern pattern, CharSequence text, Function<MatchResult, String> replacer) {
        Matcher matcher = pattern.matcher(text);
        var sb = new StringBuilder(text.length());
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacer.apply(matcher.toMatchResult())));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
