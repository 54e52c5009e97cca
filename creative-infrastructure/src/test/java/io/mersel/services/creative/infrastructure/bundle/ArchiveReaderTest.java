package io.mersel.services.creative.infrastructure.bundle;

import io.mersel.services.creative.application.interfaces.ArchiveSource;
import io.mersel.services.creative.application.interfaces.BundleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.ZipEntry;

import static io.mersel.services.creative.infrastructure.ZipFixtures.entries;
import static io.mersel.services.creative.infrastructure.ZipFixtures.source;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ArchiveReader")
class ArchiveReaderTest {

    private static final long MAX_SIZE = 1024 * 1024;

    @Test
    @DisplayName("girdiler_arsiv_sirasiyla_listelenir — entries listed in archive order")
    void girdiler_arsiv_sirasiyla_listelenir() throws Exception {
        var source = source(entries("b.html", "<p>b</p>", "a.png", new byte[]{1, 2, 3}));

        try (var reader = ArchiveReader.open(source, "tx", MAX_SIZE, 10)) {
            assertThat(names(reader)).containsExactly("b.html", "a.png");
            assertThat(reader.read("a.png")).containsExactly(1, 2, 3);
            assertThat(new String(reader.read("b.html"), StandardCharsets.UTF_8)).isEqualTo("<p>b</p>");
        }
    }

    @Test
    @DisplayName("arsiv_ikinci_kez_acilabilir — reopening yields identical entry order")
    void arsiv_ikinci_kez_acilabilir() throws Exception {
        var source = source(entries("index.html", "x", "img/a.png", "y"));

        try (var first = ArchiveReader.open(source, "tx", MAX_SIZE, 10);
             var second = ArchiveReader.open(source, "tx", MAX_SIZE, 10)) {
            assertThat(names(second)).containsExactlyElementsOf(names(first));
        }
    }

    @Test
    @DisplayName("zip_olmayan_icerik_BundleException — non-zip bytes rejected")
    void zip_olmayan_icerik_BundleException() {
        ArchiveSource source = ArchiveSource.ofBytes("not a zip at all".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> ArchiveReader.open(source, "tx-bad", MAX_SIZE, 10))
                .hasMessageContaining("tx-bad")
                .isInstanceOfSatisfying(BundleException.class,
                        e -> assertThat(e.getTransformId()).isEqualTo("tx-bad"));
    }

    @Test
    @DisplayName("okunamayan_kaynak_BundleException — unreadable source rejected")
    void okunamayan_kaynak_BundleException() {
        ArchiveSource source = () -> {
            throw new IOException("disk gone");
        };

        assertThatThrownBy(() -> ArchiveReader.open(source, "tx", MAX_SIZE, 10))
                .isInstanceOf(BundleException.class)
                .hasMessageContaining("disk gone");
    }

    @Test
    @DisplayName("girdi_sayisi_siniri_asilirsa_BundleException — entry limit enforced")
    void girdi_sayisi_siniri_asilirsa_BundleException() {
        var source = source(entries("a.png", "1", "b.png", "2", "c.png", "3"));

        assertThatThrownBy(() -> ArchiveReader.open(source, "tx", MAX_SIZE, 2))
                .isInstanceOf(BundleException.class)
                .hasMessageContaining("3 girdi");
    }

    @Test
    @DisplayName("boyut_siniri_asilirsa_BundleException — size limit enforced")
    void boyut_siniri_asilirsa_BundleException() {
        var source = source(entries("a.png", new byte[4096]));

        assertThatThrownBy(() -> ArchiveReader.open(source, "tx", 50, 10))
                .isInstanceOf(BundleException.class);
    }

    @Test
    @DisplayName("olmayan_girdi_okunursa_BundleException — missing entry rejected")
    void olmayan_girdi_okunursa_BundleException() throws Exception {
        try (var reader = ArchiveReader.open(source(entries("a.png", "1")), "tx", MAX_SIZE, 10)) {
            assertThatThrownBy(() -> reader.read("missing.png"))
                    .isInstanceOf(BundleException.class)
                    .hasMessageContaining("missing.png");
        }
    }

    private static List<String> names(ArchiveReader reader) {
        return reader.entries().stream().map(ZipEntry::getName).toList();
    }
}
