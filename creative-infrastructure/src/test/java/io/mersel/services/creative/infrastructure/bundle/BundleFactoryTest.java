package io.mersel.services.creative.infrastructure.bundle;

import io.mersel.services.creative.application.interfaces.ArchiveSource;
import io.mersel.services.creative.application.interfaces.BundleException;
import io.mersel.services.creative.infrastructure.ZipFixtures;
import io.mersel.services.creative.infrastructure.config.CreativeProperties;
import io.mersel.services.creative.infrastructure.diagnostics.CreativeMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static io.mersel.services.creative.infrastructure.ZipFixtures.TRANSFORM_ID;
import static io.mersel.services.creative.infrastructure.ZipFixtures.entries;
import static io.mersel.services.creative.infrastructure.ZipFixtures.source;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BundleFactory birim testleri.
 * <p>
 * Girdi sınıflandırmasını, kimlik üretimini, platform artığı filtrelemesini
 * ve hata metriklerini test eder.
 */
@DisplayName("BundleFactory")
class BundleFactoryTest {

    private SimpleMeterRegistry registry;
    private BundleFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = ZipFixtures.bundleFactory(new CreativeProperties(), new CreativeMetrics(registry));
    }

    @Test
    @DisplayName("kimlikler_uzanti_basina_sayilir — ids counted per extension")
    void kimlikler_uzanti_basina_sayilir() throws Exception {
        var bundle = factory.create(TRANSFORM_ID, source(entries(
                "index.html", "<p>x</p>",
                "img/a.png", "a",
                "img/B.PNG", "b",
                "style.css", "body{}",
                "js/app.js", "var a;",
                "alt.htm", "<p>y</p>")));

        assertThat(bundle.getSnippets().get("index.html").getId()).isEqualTo("HTML1");
        assertThat(bundle.getSnippets().get("alt.htm").getId()).isEqualTo("HTM1");
        assertThat(bundle.getAsset("img/a.png").getId()).isEqualTo("PNG1");
        assertThat(bundle.getAsset("img/B.PNG").getId()).isEqualTo("PNG2");
        assertThat(bundle.getAsset("style.css").getId()).isEqualTo("CSS1");
        assertThat(bundle.getAsset("js/app.js").getId()).isEqualTo("JS1");
        assertThat(bundle.getAssets().keySet())
                .containsExactly("img/a.png", "img/B.PNG", "style.css", "js/app.js");
    }

    @Test
    @DisplayName("platform_artiklari_ve_uzantisiz_girdiler_atlanir — platform junk and extensionless entries skipped")
    void platform_artiklari_ve_uzantisiz_girdiler_atlanir() throws Exception {
        var bundle = factory.create(TRANSFORM_ID, source(entries(
                "img/", null,
                "index.html", "<p>x</p>",
                "__MACOSX/._index.html", "junk",
                "__MACOSX/img/._a.png", "junk",
                ".DS_Store", "junk",
                "img/.hidden.png", "junk",
                "img/Thumbs.db", "junk",
                "LICENSE", "text",
                "img/a.png", "a")));

        assertThat(bundle.getSnippets().keySet()).containsExactly("index.html");
        assertThat(bundle.getAssets().keySet()).containsExactly("img/a.png");
        assertThat(bundle.getAsset("img/a.png").getId()).isEqualTo("PNG1");
    }

    @Test
    @DisplayName("snippet_ve_gomulebilir_asset_hemen_okunur — snippets and inlineable assets read eagerly")
    void snippet_ve_gomulebilir_asset_hemen_okunur() throws Exception {
        var bundle = factory.create(TRANSFORM_ID, source(entries(
                "index.html", "<p>ç</p>",
                "style.css", "body{}",
                "logo.png", new byte[]{1, 2})));

        assertThat(bundle.getSnippets().get("index.html").isLoaded()).isTrue();
        assertThat(bundle.getSnippets().get("index.html").getContent())
                .isEqualTo("<p>ç</p>".getBytes(StandardCharsets.UTF_8));
        assertThat(bundle.getAsset("style.css").isLoaded()).isTrue();
        assertThat(bundle.getAsset("logo.png").isLoaded()).isFalse();
        assertThat(bundle.getAsset("logo.png").getSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("snippet_yoksa_BundleException_ve_metrik — no snippet fails and is counted")
    void snippet_yoksa_BundleException_ve_metrik() {
        var source = source(entries("logo.png", "a", "style.css", "b"));

        assertThatThrownBy(() -> factory.create(TRANSFORM_ID, source))
                .isInstanceOf(BundleException.class)
                .hasMessageContaining("No snippets found");

        assertThat(registry.get("creative_bundle_ingestions_total").tag("status", "failure").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("creative_errors_total").tag("operation", "ingest").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("bozuk_arsiv_BundleException — corrupt archive rejected")
    void bozuk_arsiv_BundleException() {
        ArchiveSource source = ArchiveSource.ofBytes("PK garbage".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> factory.create(TRANSFORM_ID, source))
                .isInstanceOf(BundleException.class)
                .hasMessageContaining(TRANSFORM_ID);
    }

    @Test
    @DisplayName("basarili_siniflandirma_metrigi — success counter and timer recorded")
    void basarili_siniflandirma_metrigi() throws Exception {
        factory.create(TRANSFORM_ID, source(entries("index.html", "<p>x</p>")));

        assertThat(registry.get("creative_bundle_ingestions_total").tag("status", "success").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("creative_bundle_ingestion_duration").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("isIgnored_kurallari — ignore rules")
    void isIgnored_kurallari() {
        assertThat(BundleFactory.isIgnored("a/b/")).isTrue();
        assertThat(BundleFactory.isIgnored("x/__MACOSX/y.png")).isTrue();
        assertThat(BundleFactory.isIgnored("img/.keep.png")).isTrue();
        assertThat(BundleFactory.isIgnored("Thumbs.db")).isTrue();
        assertThat(BundleFactory.isIgnored("img/logo.png")).isFalse();
        assertThat(BundleFactory.isIgnored("MACOSX/logo.png")).isFalse();
    }
}
