package io.mersel.services.creative.infrastructure.bundle;

import io.mersel.services.creative.application.enums.ConverterType;
import io.mersel.services.creative.application.models.ResourceSummary;
import io.mersel.services.creative.infrastructure.support.RawText;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Kreatifin HTML giriş noktası.
 */
public class Snippet extends CreativeResource {

    static final String REVIEW_COMMENT = "<!-- Please make sure you review the creative and "
            + "that it contains the clicktracking macro -->";

    private static final Set<String> SKIPPED_HEAD_TAGS = Set.of("meta", "title");
    private static final Pattern BODY_TAG = Pattern.compile("<body[\\s>]", Pattern.CASE_INSENSITIVE);

    private ConverterType converterType;

    public Snippet(String id, String name, long size, String mimetype) {
        super(id, name, size, mimetype);
    }

    /**
     * Snippet'i başarıyla dönüştüren dönüştürücü; dönüşümden önce {@code null}.
     */
    public ConverterType getConverterType() {
        return converterType;
    }

    public void setConverterType(ConverterType converterType) {
        this.converterType = converterType;
    }

    /**
     * Yeniden yazılmış içeriği ad-server API'sinin beklediği HTML parçasına çevirir.
     * <p>
     * Gözden geçirme hatırlatma yorumu, {@code <meta>} ve {@code <title>} dışındaki
     * head elemanları ve body'nin iç HTML'i sırayla birleştirilir. Belgede body
     * yoksa yeniden yazılmış içerik aynen döner. HTML UTF-8 olarak çözülür.
     */
    public String asSnippet() {
        String parsed = getParsedContent();
        if (parsed == null || parsed.isEmpty()) {
            return "";
        }
        String content = RawText.toUnicode(parsed);
        Document document = Jsoup.parse(content);
        document.outputSettings().prettyPrint(false);

        var buf = new StringBuilder(REVIEW_COMMENT);
        for (Element element : document.head().children()) {
            if (SKIPPED_HEAD_TAGS.contains(element.normalName())) {
                continue;
            }
            buf.append(element.outerHtml());
        }

        Element body = document.body();
        if (body == null || body.childNodeSize() == 0 && !BODY_TAG.matcher(content).find()) {
            return content;
        }
        buf.append(body.html());
        return buf.toString();
    }

    public ResourceSummary summary() {
        return new ResourceSummary(getId(), getName(), getSize(), getMimetype(), getRoot(), getBasename(),
                List.copyOf(getAssets()), converterType != null ? converterType.getTag() : null,
                null, null, null, null);
    }
}
