package io.mersel.services.creative.infrastructure;

import io.mersel.services.creative.application.interfaces.ArchiveSource;
import io.mersel.services.creative.application.interfaces.ICreativeTransform;
import io.mersel.services.creative.application.models.BundleSummary;
import io.mersel.services.creative.application.models.ResourceSummary;
import io.mersel.services.creative.infrastructure.diagnostics.CreativeMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static io.mersel.services.creative.infrastructure.ZipFixtures.entries;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CreativeTransformFactory")
class CreativeTransformFactoryTest {

    private final CreativeTransformFactory factory = new CreativeTransformFactory(
            ZipFixtures.bundleFactory(), new CreativeMetrics(new SimpleMeterRegistry()));

    @Test
    @DisplayName("yeni_kimlik_ag_kodu_kullanici_ve_zamandan_uretilir — id derived from network, user and time")
    void yeni_kimlik_ag_kodu_kullanici_ve_zamandan_uretilir() {
        String id = factory.newTransformId("1234", "user-1", Instant.ofEpochSecond(1539000000L));

        assertThat(id).isEqualTo("7Pc8RBVhg7VSH96JPE6zrg");
        assertThatThrownBy(() -> factory.newTransformId(" ", "user-1", Instant.now()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("dosyadaki_arsiv_acilir_ve_ozetlenir — archive on disk opened and summarized")
    void dosyadaki_arsiv_acilir_ve_ozetlenir(@TempDir Path dir) throws Exception {
        Path archive = dir.resolve("banner.zip");
        Files.write(archive, ZipFixtures.zip(entries(
                "banner/index.html", "<img src=\"logo.png\">",
                "banner/logo.png", new byte[]{1, 2, 3})));
        String id = factory.newTransformId("1234", "user-1", Instant.ofEpochSecond(1539000000L));

        ICreativeTransform transform = factory.open(id, "banner.zip", ArchiveSource.ofPath(archive));
        BundleSummary summary = transform.summary();

        assertThat(transform.getTransformId()).isEqualTo(id);
        assertThat(transform.getFilename()).isEqualTo("banner.zip");
        assertThat(summary.transformId()).isEqualTo(id);
        assertThat(summary.snippets()).extracting(ResourceSummary::name).containsExactly("banner/index.html");
        assertThat(summary.assets()).extracting(ResourceSummary::name).containsExactly("banner/logo.png");
    }
}
