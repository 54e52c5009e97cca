package io.mersel.services.creative.infrastructure.converter;

import io.mersel.services.creative.application.enums.ConverterType;
import io.mersel.services.creative.application.interfaces.BundleException;
import io.mersel.services.creative.application.models.CreativeAsset;
import io.mersel.services.creative.infrastructure.ZipFixtures;
import io.mersel.services.creative.infrastructure.bundle.Bundle;
import io.mersel.services.creative.infrastructure.bundle.Snippet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

import static io.mersel.services.creative.infrastructure.ZipFixtures.entries;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EdgeConverter birim testleri.
 * <p>
 * Adobe Edge Animate çıktısına benzeyen küçük bir arşiv üzerinde çalışma zamanı
 * yönlendirmesini, kompozisyon script'inin yeniden yazılmasını ve değişken
 * enjeksiyonunu test eder.
 */
@DisplayName("EdgeConverter")
class EdgeConverterTest {

    private static final String INDEX = """
            <!DOCTYPE html>
            <html>
            <head>
            <meta http-equiv="X-UA-Compatible" content="IE=Edge"/>
            <title>banner</title>
            <!--Adobe Edge Runtime-->
            <script type="text/javascript" charset="utf-8" src="edge_includes/edge.6.0.0.min.js"></script>
            <style>.edgeLoad-EDGE-1 { visibility:hidden; }</style>
            <script>
               AdobeEdge.loadComposition('banner', 'EDGE-1', {
                scaleToFit: "none",
                width: "300px",
                height: "250px"
            }, {"dom":{}}, {"dom":{}});
            </script>
            <!--Adobe Edge Runtime End-->
            </head>
            <body style="margin:0;padding:0;">
            <div id="Stage" class="EDGE-1"></div>
            </body>
            </html>
            """;

    private static final String COMPOSITION = """
            (function($,Edge,compId){var Composition=Edge.Composition,Symbol=Edge.Symbol;
            var im='images/',aud='media/',vid='media/',js='js/',
            fonts={},
            symbols={"stage":{content:{dom:[\
            {id:'logo',type:'image',fill:["rgba(0,0,0,0)",im+"logo.png",'0px','0px']},\
            {id:'bg',type:'image',fill:["rgba(0,0,0,0)",im+"bg.jpg",'0px','0px']},\
            {id:'txt',type:'text',text:'<a href=\\"logo.png\\">x</a>'}]}}};
            $(function(){$('#Stage').click(function(){window.open("http://example.com","_blank");});});
            })(jQuery,AdobeEdge,"EDGE-1");
            """;

    private final EdgeConverter converter = new EdgeConverter();

    private static Map<String, Object> edgeArchive(String index) {
        return entries(
                "ad/index.html", index,
                "ad/edge_includes/edge.6.0.0.min.js", "/* runtime */",
                "ad/banner_edge.js", COMPOSITION,
                "ad/images/logo.png", new byte[]{1},
                "ad/images/bg.jpg", new byte[]{2});
    }

    @Test
    @DisplayName("dort_imza_da_gerekli — all four signatures required")
    void dort_imza_da_gerekli() throws Exception {
        Bundle full = ZipFixtures.bundle(edgeArchive(INDEX));
        Bundle partial = ZipFixtures.bundle(edgeArchive(INDEX.replace("<!--Adobe Edge Runtime End-->", "")));

        assertThat(converter.matches(full.getSnippets().get("ad/index.html"))).isTrue();
        assertThat(converter.matches(partial.getSnippets().get("ad/index.html"))).isFalse();
    }

    @Test
    @DisplayName("eksik_imza_varsayilan_donusturucuye_duser — partial signature falls through to default")
    void eksik_imza_varsayilan_donusturucuye_duser() throws Exception {
        Bundle bundle = ZipFixtures.transformed(edgeArchive(INDEX.replace("<!--Adobe Edge Runtime End-->", "")));

        assertThat(bundle.getSnippets().get("ad/index.html").getConverterType()).isEqualTo(ConverterType.DEFAULT);
    }

    @Test
    @DisplayName("snippet_calisma_zamani_ve_yukleyici_yeniden_yazilir — runtime and loader rewritten")
    void snippet_calisma_zamani_ve_yukleyici_yeniden_yazilir() throws Exception {
        Bundle bundle = ZipFixtures.transformed(edgeArchive(INDEX));
        Snippet snippet = bundle.getSnippets().get("ad/index.html");
        String content = snippet.getParsedContent();

        assertThat(snippet.getConverterType()).isEqualTo(ConverterType.EDGE);
        assertThat(content)
                .contains("src=\"https://animate.adobe.com/runtime/6.0.0/edge.6.0.0.min.js\"")
                .doesNotContain("edge_includes/")
                .contains("var clickTag=\"%%CLICK_URL_UNESC%%\" + \"%%DEST_URL_ESC%%\";")
                .contains("var clickTarget=\"_blank\";")
                .contains("var __x5__ = {};")
                .contains("__x5__.macro_PNG1 = \"%%FILE:PNG1%%\";")
                .contains("__x5__.macro_JPG1 = \"%%FILE:JPG1%%\";")
                .contains("AdobeEdge.yepnope.errorTimeout = 5e2;")
                .contains("AdobeEdge.loadComposition('%%FILE:JS2%%&_=', 'EDGE-1', {");
        assertThat(content.indexOf("// start x5 injected variables"))
                .isLessThan(content.indexOf("__x5__.macro_PNG1"));
        assertThat(content.indexOf("// end x5 injected variables"))
                .isLessThan(content.indexOf("AdobeEdge.loadComposition"));
        assertThat(snippet.getAssets()).containsExactly("ad/banner_edge.js", "ad/images/logo.png", "ad/images/bg.jpg");
    }

    @Test
    @DisplayName("kompozisyon_yollari_makro_degiskenine_baglanir — composition paths bound to macro variables")
    void kompozisyon_yollari_makro_degiskenine_baglanir() throws Exception {
        Bundle bundle = ZipFixtures.transformed(edgeArchive(INDEX));
        var composition = bundle.getAsset("ad/banner_edge.js");
        String script = composition.getParsedContent();

        assertThat(script)
                .contains("var im='',aud='',vid='',js='',")
                .contains("im+__x5__.macro_PNG1,'0px'")
                .contains("im+__x5__.macro_JPG1,'0px'")
                .contains("text:'<a href=\\\"' + __x5__.macro_PNG1 + '\\\">x</a>'")
                .contains("window.open(clickTag,\"_blank\")")
                .doesNotContain("logo.png")
                .doesNotContain("http://example.com");
        assertThat(composition.getAssets()).isEmpty();
    }

    @Test
    @DisplayName("kreatif_kompozisyonu_ve_gorselleri_icerir — creative carries composition and images")
    void kreatif_kompozisyonu_ve_gorselleri_icerir() throws Exception {
        Bundle bundle = ZipFixtures.transformed(edgeArchive(INDEX));

        var part = bundle.getCreativePart("ad/index.html");

        assertThat(part.customCreativeAssets()).extracting(CreativeAsset::macroName)
                .containsExactly("JS2", "PNG1", "JPG1");
        String script = new String(Base64.getDecoder().decode(
                part.customCreativeAssets().get(0).asset().assetByteArray()), StandardCharsets.UTF_8);
        assertThat(script).contains("__x5__.macro_PNG1");
    }

    @Test
    @DisplayName("calisma_zamani_bulunamazsa_BundleException — missing runtime fails")
    void calisma_zamani_bulunamazsa_BundleException() throws Exception {
        String index = INDEX.replace("src=\"edge_includes/edge.6.0.0.min.js\"", "src='edge_includes/edge.6.0.0.min.js'");
        Bundle bundle = ZipFixtures.bundle(edgeArchive(index));

        assertThatThrownBy(bundle::transform)
                .isInstanceOf(BundleException.class)
                .hasMessageContaining("Error converting " + ZipFixtures.TRANSFORM_ID)
                .hasMessageContaining("no runtime found");
    }

    @Test
    @DisplayName("kompozisyon_asseti_yoksa_BundleException — missing composition fails")
    void kompozisyon_asseti_yoksa_BundleException() throws Exception {
        var archive = edgeArchive(INDEX);
        archive.remove("ad/banner_edge.js");
        Bundle bundle = ZipFixtures.bundle(archive);

        assertThatThrownBy(bundle::transform)
                .isInstanceOf(BundleException.class)
                .hasMessageContaining("no js asset found");
    }
}
