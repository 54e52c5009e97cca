package io.mersel.services.creative.infrastructure.converter;

import io.mersel.services.creative.application.enums.ConverterType;
import io.mersel.services.creative.application.interfaces.ConverterException;
import io.mersel.services.creative.infrastructure.bundle.Asset;
import io.mersel.services.creative.infrastructure.bundle.Bundle;
import io.mersel.services.creative.infrastructure.bundle.Snippet;
import io.mersel.services.creative.infrastructure.support.Macros;
import io.mersel.services.creative.infrastructure.support.RawText;
import io.mersel.services.creative.infrastructure.support.TokenMatchers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adobe Edge Animate kreatifleri için dönüştürücü.
 * <p>
 * Yerel Edge çalışma zamanını CDN adresine çevirir, üretilmiş kompozisyon
 * script'indeki asset yollarını {@code __x5__.macro_ID} değişkenlerine bağlar ve
 * bu değişkenleri yükleyici çağrısından hemen önce snippet'e enjekte eder.
 * Yükleyici, makrolarla yeniden yazılmış script'i ad-server'dan alır.
 * <p>
 * Kaçışlı tırnak içindeki yollarda ({@code \"yol\"}) kaçışlı tırnaklar korunur ve
 * makro değişkeni string birleştirmeyle araya girer; üretilen HTML özniteliği
 * tırnaklı kalır.
 */
@Component
@Order(1)
public class EdgeConverter extends DefaultConverter {

    private static final Logger log = LoggerFactory.getLogger(EdgeConverter.class);

    /** Dört imzanın tamamı en az bir kez bulunmalı. */
    private static final Pattern MATCH = Pattern.compile(
            "(edge\\.[0-9]\\.[0-9]\\.[0-9]\\.min\\.js)"
                    + "|(<!--Adobe Edge Runtime-->)"
                    + "|(AdobeEdge\\.loadComposition)"
                    + "|(<!--Adobe Edge Runtime End-->)");

    private static final Pattern RUNTIME = Pattern.compile(
            "<script\\s[^>]*src=\"(?<src>[^\"]*(?<name>edge\\.(?<version>[0-9.]+)\\.min\\.js))\"[^>]*>");

    private static final String RUNTIME_URL = "https://animate.adobe.com/runtime/%1$s/edge.%1$s.min.js";

    private static final Pattern LOADER = Pattern.compile(
            "(?<pre>AdobeEdge.loadComposition\\(')(?<name>[^']+)(?<post>', '[A-Za-z0-9_-]+', \\{)");

    /** Kompozisyon script'indeki görsel, ses, video ve script klasörü değişkenleri. */
    private static final Pattern FOLDER_PATHS = Pattern.compile("\\b(im|aud|vid|js)='([^']*?)/?'");

    private static final Pattern WINDOW_OPEN = Pattern.compile(
            "window\\.open\\(['\"][^'\"]*['\"]((?:,[^)]+)?)\\)");

    /** Yolun iki yanındaki iki karakterlik tırnak bağlamı. */
    private static final String QUOTING_CONTEXT = ".{2}%s.{2}";

    private static final String COMPOSITION_SUFFIX = "_edge.js";
    private static final String MACRO_VARIABLE = "__x5__.macro_";

    private static final List<String> CLICK_TAGS = List.of(
            "var clickTag=\"%%CLICK_URL_UNESC%%\" + \"%%DEST_URL_ESC%%\";",
            "var clickTarget=\"_blank\";");

    @Override
    public ConverterType getType() {
        return ConverterType.EDGE;
    }

    @Override
    public boolean matches(Snippet snippet) {
        return TokenMatchers.allGroupsMatch(MATCH, snippet.getText());
    }

    @Override
    public void convert(Bundle bundle, Snippet snippet) throws ConverterException {
        String transformId = bundle.getTransformId();
        String content = snippet.getText();

        Matcher runtime = RUNTIME.matcher(content);
        if (!runtime.find()) {
            throw new ConverterException("Edge detected in " + transformId + " but no runtime found");
        }
        String runtimeName = runtime.group("name");
        content = content.replace(runtime.group("src"), String.format(RUNTIME_URL, runtime.group("version")));

        Matcher loader = LOADER.matcher(content);
        if (!loader.find()) {
            throw new ConverterException("Edge detected in " + transformId + " but no js found");
        }
        Asset composition = findComposition(bundle, snippet, loader.group("name"));
        snippet.addAsset(composition.getName());

        rewriteComposition(bundle, composition, snippet.getRoot(), runtimeName);
        composition.setParsedContent(WINDOW_OPEN.matcher(composition.getParsedContent())
                .replaceAll("window.open(clickTag$1)"));

        var parts = new ArrayList<String>();
        parts.add(content.substring(0, loader.start()));
        parts.add("\n// start x5 injected variables");
        parts.addAll(CLICK_TAGS);
        parts.add("var __x5__ = {};");
        parts.addAll(registerCompositionAssets(bundle, composition, snippet));
        parts.add("// end x5 injected variables\n");
        parts.add("// Firefox and IE rendering latency remover\n");
        parts.add("AdobeEdge.yepnope.errorTimeout = 5e2;\n\n");
        parts.add(loader.group("pre") + Macros.fileMacro(composition.getId()) + "&_=" + loader.group("post"));
        parts.add(content.substring(loader.end()));
        snippet.setParsedContent(String.join("\n", parts));

        log.debug("  Edge çalışma zamanı {} → CDN, kompozisyon: {}", runtimeName, composition.getName());
    }

    private Asset findComposition(Bundle bundle, Snippet snippet, String compositionName) throws ConverterException {
        String transformId = bundle.getTransformId();
        String scriptName;
        try {
            scriptName = TokenMatchers.unquote(RawText.toUnicode(compositionName) + COMPOSITION_SUFFIX);
        } catch (IllegalArgumentException e) {
            throw new ConverterException("Edge detected in " + transformId + " but no js asset found", e);
        }
        Asset composition = bundle.assetsRelativeTo(snippet).get(scriptName);
        if (composition == null) {
            throw new ConverterException("Edge detected in " + transformId + " but no js asset found");
        }
        return composition;
    }

    /**
     * Kompozisyon script'indeki klasör değişkenlerini boşaltır ve asset yollarını
     * makro değişkenlerine çevirir. Klasör değerleri snippet köküyle birleştirilip
     * ek arama kökleri olarak kullanılır; snippet kökü en son denenir.
     */
    private void rewriteComposition(Bundle bundle, Asset composition, String snippetRoot, String runtimeName) {
        String text = composition.getText();
        var roots = new ArrayList<String>();
        Matcher folders = FOLDER_PATHS.matcher(text);
        while (folders.find()) {
            String folder = RawText.toUnicode(folders.group(2));
            if (!folder.isEmpty()) {
                roots.add(snippetRoot.isEmpty() || folder.startsWith("/") ? folder : snippetRoot + "/" + folder);
            }
        }
        roots.add(snippetRoot);
        text = FOLDER_PATHS.matcher(text).replaceAll("$1=''");
        composition.setText(text);

        var assets = new LinkedHashMap<String, Asset>();
        bundle.assetsRelativeTo(roots).forEach((name, asset) -> {
            if (!name.endsWith(runtimeName) && asset != composition) {
                assets.put(name, asset);
            }
        });
        Pattern pattern = TokenMatchers.quotedTokensPattern(assets.keySet(), QUOTING_CONTEXT);
        composition.setParsedContent(TokenMatchers.replaceAll(pattern, text,
                match -> macroVariable(composition, assets, match)));
    }

    /**
     * Tırnak bağlamıyla eşleşen yolu makro değişkenine çevirir.
     * <ul>
     *   <li>{@code \"yol\"} → {@code \"' + __x5__.macro_ID + '\"}: string birleştirme sınırı</li>
     *   <li>{@code ="yol",} → {@code =__x5__.macro_ID,}: tırnaklar düşer</li>
     *   <li>diğer bağlamlar aynen korunur</li>
     * </ul>
     */
    private static String macroVariable(Asset owner, Map<String, Asset> assets, MatchResult match) {
        String matched = match.group(1);
        if (matched.length() < 5) {
            return matched;
        }
        String name = RawText.toUnicode(matched.substring(2, matched.length() - 2));
        if (name.indexOf('%') >= 0) {
            try {
                name = TokenMatchers.unquote(name);
            } catch (IllegalArgumentException e) {
                return matched;
            }
        }
        Asset asset = assets.get(name);
        if (asset == null) {
            return matched;
        }
        owner.addAsset(asset.getName());

        String variable = MACRO_VARIABLE + asset.getId();
        String prefix = matched.substring(0, 2);
        String suffix = matched.substring(matched.length() - 2);
        if (prefix.equals("\\\"") || prefix.equals("\\'")) {
            return prefix + "' + " + variable + " + '" + suffix;
        }
        if (matched.charAt(1) == '"' || matched.charAt(1) == '\'') {
            return matched.charAt(0) + variable + matched.charAt(matched.length() - 1);
        }
        return prefix + variable + suffix;
    }

    /**
     * Kompozisyonun referans verdiği asset'leri snippet'e bağlar ve her biri için
     * makro kayıt satırı üretir. Gömülebilir olanlar varsayılan kurallarla
     * yeniden yazılır.
     */
    private List<String> registerCompositionAssets(Bundle bundle, Asset composition, Snippet snippet) {
        var registry = new ArrayList<String>();
        var inlineable = new ArrayList<String>();
        for (String name : new LinkedHashSet<>(composition.getAssets())) {
            Asset asset = bundle.getAsset(name);
            snippet.addAsset(name);
            registry.add(MACRO_VARIABLE + asset.getId() + " = \"" + Macros.fileMacro(asset.getId()) + "\";");
            if (asset.isInlineable()) {
                inlineable.add(name);
            }
        }
        inlineReferencedAssets(bundle, snippet, inlineable);
        composition.clearAssets();
        return registry;
    }
}
