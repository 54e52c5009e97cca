package io.mersel.services.creative.infrastructure.converter;

import io.mersel.services.creative.application.enums.ConverterType;
import io.mersel.services.creative.application.interfaces.ConverterException;
import io.mersel.services.creative.infrastructure.bundle.Asset;
import io.mersel.services.creative.infrastructure.bundle.Bundle;
import io.mersel.services.creative.infrastructure.bundle.CreativeResource;
import io.mersel.services.creative.infrastructure.bundle.Snippet;
import io.mersel.services.creative.infrastructure.support.TokenMatchers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Genel HTML5 kreatifleri için varsayılan dönüştürücü.
 * <p>
 * Her snippet ile eşleşir ve listede her zaman en sondadır. Snippet dizinine göre
 * erişilebilen asset yollarını makrolara çevirir, ardından referans verilen
 * gömülebilir asset'leri (CSS, JS, metin) aynı şekilde yeniden yazar.
 * Alt asset'lerde bulunan referanslar hem asset'in kendi listesine hem de
 * üst snippet'in listesine eklenir. Her asset en fazla bir kez yeniden yazılır.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class DefaultConverter implements CreativeConverter {

    private static final Logger log = LoggerFactory.getLogger(DefaultConverter.class);

    @Override
    public ConverterType getType() {
        return ConverterType.DEFAULT;
    }

    @Override
    public boolean matches(Snippet snippet) {
        return true;
    }

    @Override
    public void convert(Bundle bundle, Snippet snippet) throws ConverterException {
        List<String> references = rewrite(snippet, bundle.assetsRelativeTo(snippet), null);
        inlineReferencedAssets(bundle, snippet, references);
    }

    /**
     * Kaynağın içeriğindeki asset yollarını makrolarla değiştirir ve sonucu
     * yeniden yazılmış içerik olarak atar.
     *
     * @param resource Yeniden yazılacak kaynak; bulunan referanslar listesine eklenir
     * @param assets   Göreli ad → asset eşlemesi
     * @param template Makro şablonu, {@code null} ise varsayılan
     * @return Bu çağrıda bulunan referanslar, bulunma sırasıyla
     */
    protected List<String> rewrite(CreativeResource resource, Map<String, Asset> assets, String template) {
        int before = resource.getAssets().size();
        Pattern pattern = TokenMatchers.quotedTokensPattern(assets.keySet());
        resource.setParsedContent(TokenMatchers.replaceAll(pattern, resource.getText(),
                TokenMatchers.referenceReplacer(resource, assets, template)));
        List<String> found = resource.getAssets();
        return List.copyOf(found.subList(before, found.size()));
    }

    /**
     * Referans verilen gömülebilir ve henüz dönüştürülmemiş asset'leri yeniden yazar.
     * <p>
     * İş listesiyle ilerler; her asset adı bir kez ziyaret edilir. Alt asset'lerde
     * bulunan referanslar {@code collector} kaynağına da eklenir ve sıraya alınır.
     *
     * @param collector  Tüm alt referansların toplandığı üst kaynak (genelde snippet)
     * @param references İncelenecek ilk referanslar
     */
    protected void inlineReferencedAssets(Bundle bundle, CreativeResource collector, Collection<String> references) {
        Deque<String> pending = new ArrayDeque<>(references);
        Set<String> visited = new HashSet<>();
        while (!pending.isEmpty()) {
            String name = pending.poll();
            if (!visited.add(name)) {
                continue;
            }
            Asset asset = bundle.getAsset(name);
            if (asset == null || !asset.isInlineable() || asset.isConverted()) {
                continue;
            }
            List<String> found = rewrite(asset, bundle.assetsRelativeTo(asset), null);
            log.debug("  Asset yeniden yazıldı: {} ({} referans)", asset.getName(), found.size());
            collector.addAssets(found);
            pending.addAll(found);
        }
    }
}
