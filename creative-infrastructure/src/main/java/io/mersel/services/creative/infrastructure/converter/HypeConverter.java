package io.mersel.services.creative.infrastructure.converter;

import io.mersel.services.creative.application.enums.ConverterType;
import io.mersel.services.creative.application.interfaces.ConverterException;
import io.mersel.services.creative.infrastructure.bundle.Asset;
import io.mersel.services.creative.infrastructure.bundle.Bundle;
import io.mersel.services.creative.infrastructure.bundle.Snippet;
import io.mersel.services.creative.infrastructure.support.RawText;
import io.mersel.services.creative.infrastructure.support.TokenMatchers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tumult Hype kreatifleri için dönüştürücü.
 * <p>
 * Üretilmiş Hype script'ini snippet'e gömer, klasör değişkenini boşaltır ve
 * arka plan görsel adreslerini düzelten küçük bir script ekler. Ardından
 * varsayılan dönüşüm kalan asset yollarını makrolara çevirir.
 */
@Component
@Order(2)
public class HypeConverter extends DefaultConverter {

    private static final Logger log = LoggerFactory.getLogger(HypeConverter.class);

    private static final String GENERATED_SUFFIX = "_hype_generated_script.js";

    private static final Pattern MATCH = Pattern.compile(
            "<script\\s[^>]*src=[\"'][^\"']+_hype_generated_script.js\\?[0-9]+[\"']");

    private static final Pattern SCRIPT_TAG = Pattern.compile(
            "<script\\s[^>]*src=[\"']([^\"']+_hype_generated_script.js)(?:\\?[0-9]+)?[\"'][^>]*/?>(?:\\s*</script>)?");

    private static final Pattern FOLDER_VAR = Pattern.compile("var f\\s*=\\s*\"[^\"]+\",");

    private static final String EMPTY_FOLDER_VAR = "var f=\"\",";

    private static final String BODY_END = "</body>";

    private static final String DOMAIN_FIX_SCRIPT = """
            var hypeElementContainer = '%s_hype_container';
            function hypeUpdate(){
              var hypeDivElements = document.getElementById(hypeElementContainer)
                  .getElementsByTagName('DIV');
              var ph = window.location.protocol + '//' + window.location.host + '/';
              for (hi=0; hi<hypeDivElements.length; hi++) {
                if (hypeDivElements[hi].style.backgroundImage.indexOf('url') > -1) {
                  hypeDivElements[hi].style.backgroundImage = hypeDivElements[hi].style.backgroundImage\
            .replace('url("/', 'url("').replace(ph, '')
                }
              }
            }
            onload=hypeUpdate;
            """;

    @Override
    public ConverterType getType() {
        return ConverterType.HYPE;
    }

    @Override
    public boolean matches(Snippet snippet) {
        return MATCH.matcher(snippet.getText()).find();
    }

    @Override
    public void convert(Bundle bundle, Snippet snippet) throws ConverterException {
        String content = snippet.getText();
        Matcher tag = SCRIPT_TAG.matcher(content);
        if (!tag.find()) {
            throw new ConverterException("Hype script tag not found (" + bundle.getTransformId() + ")");
        }
        Asset script = findGeneratedScript(bundle, snippet, RawText.toUnicode(tag.group(1)));

        String generated = FOLDER_VAR.matcher(script.getText()).replaceAll(Matcher.quoteReplacement(EMPTY_FOLDER_VAR));
        String container = script.getBasename().replace(GENERATED_SUFFIX, "");
        String block = "<script>\n" + generated + "\n" + DOMAIN_FIX_SCRIPT.formatted(RawText.of(container)) + "\n</script>\n";

        content = content.substring(0, tag.start()) + content.substring(tag.end());
        int bodyEnd = content.lastIndexOf(BODY_END);
        content = bodyEnd < 0
                ? content + block
                : content.substring(0, bodyEnd) + block + content.substring(bodyEnd);
        snippet.setText(content);
        bundle.removeAsset(script.getName());
        log.debug("  Hype script'i gömüldü: {}", script.getName());

        super.convert(bundle, snippet);
    }

    /**
     * Script etiketindeki yolu snippet dizinine göre çözer; bulunamazsa
     * bundle'da aynı dosya adına sahip tek asset aranır.
     */
    private Asset findGeneratedScript(Bundle bundle, Snippet snippet, String reference) throws ConverterException {
        var relative = bundle.assetsRelativeTo(snippet);
        Asset script = relative.get(reference);
        if (script == null && reference.indexOf('%') >= 0) {
            try {
                script = relative.get(TokenMatchers.unquote(reference));
            } catch (IllegalArgumentException e) {
                log.debug("  Hype script yolu çözülemedi: {}", reference);
            }
        }
        if (script == null) {
            String basename = reference.substring(reference.lastIndexOf('/') + 1);
            List<Asset> candidates = bundle.getAssets().values().stream()
                    .filter(asset -> asset.getBasename().equals(basename))
                    .toList();
            if (candidates.size() == 1) {
                script = candidates.get(0);
            }
        }
        if (script == null) {
            throw new ConverterException("Hype script " + reference + " not found ("
                    + bundle.getTransformId() + ")");
        }
        return script;
    }
}
