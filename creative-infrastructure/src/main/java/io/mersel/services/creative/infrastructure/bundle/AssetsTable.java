package io.mersel.services.creative.infrastructure.bundle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Bir snippet'in asset eşlemelerini sabit genişlikli ASCII tablo olarak çizer.
 * <p>
 * Metin sütunlar sola, sayısal ve mantıksal sütunlar sağa yaslanır;
 * boş, sıfır ve {@code false} değerler boş hücre olarak görünür.
 * <pre>
 * snippet: index.html
 *
 * name         id   size mimetype  inlined over_limit unsupported
 * ------------ ---- ---- --------- ------- ---------- -----------
 * img/logo.png PNG1  120 image/png
 * </pre>
 */
final class AssetsTable {

    private static final Map<String, Function<Asset, Object>> COLUMNS = new LinkedHashMap<>();

    static {
        COLUMNS.put("name", Asset::getName);
        COLUMNS.put("id", Asset::getId);
        COLUMNS.put("size", Asset::getSize);
        COLUMNS.put("mimetype", Asset::getMimetype);
        COLUMNS.put("inlined", Asset::isInlined);
        COLUMNS.put("over_limit", Asset::isOverLimit);
        COLUMNS.put("unsupported", Asset::isUnsupported);
    }

    private AssetsTable() {
    }

    static String render(String snippetName, List<Asset> assets) {
        var widths = new LinkedHashMap<String, Integer>();
        COLUMNS.forEach((column, getter) -> {
            int width = column.length();
            for (Asset asset : assets) {
                width = Math.max(width, String.valueOf(getter.apply(asset)).length());
            }
            widths.put(column, width);
        });

        var lines = new ArrayList<String>();
        lines.add("snippet: " + snippetName);
        lines.add("");
        lines.add(header(widths));
        var dashes = new ArrayList<String>();
        widths.values().forEach(width -> dashes.add("-".repeat(width)));
        lines.add(String.join(" ", dashes));

        for (Asset asset : assets) {
            var cells = new ArrayList<String>();
            COLUMNS.forEach((column, getter) -> {
                Object value = getter.apply(asset);
                int width = widths.get(column);
                if (isEmpty(value)) {
                    cells.add(" ".repeat(width));
                } else if (value instanceof String text) {
                    cells.add(padRight(text, width));
                } else {
                    cells.add(padLeft(String.valueOf(value), width));
                }
            });
            lines.add(String.join(" ", cells));
        }
        return String.join("\n", lines);
    }

    private static String header(Map<String, Integer> widths) {
        var cells = new ArrayList<String>();
        widths.forEach((column, width) -> cells.add(padRight(column, width)));
        return String.join(" ", cells);
    }

    private static boolean isEmpty(Object value) {
        return value == null
                || Boolean.FALSE.equals(value)
                || value instanceof Long number && number == 0L
                || value instanceof String text && text.isEmpty();
    }

    private static String padRight(String text, int width) {
        return text.length() >= width ? text : text + " ".repeat(width - text.length());
    }

    private static String padLeft(String text, int width) {
        return text.length() >= width ? text : " ".repeat(width - text.length()) + text;
    }
}
