package io.mersel.services.creative.application.interfaces;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Yüklenmiş kreatif ZIP arşivinin byte kaynağı.
 * <p>
 * Her {@link #openStream()} çağrısı arşivin başından konumlanmış yeni bir akış döner.
 * Arşiv bir bundle yaşam döngüsünde iki kez açılır: sınıflandırma için ve
 * son asset byte'larını okumak için.
 */
@FunctionalInterface
public interface ArchiveSource {

    /**
     * Arşivin başından konumlanmış yeni bir akış açar. Akışı çağıran kapatır.
     *
     * @throws IOException Kaynak okunamadığında
     */
    InputStream openStream() throws IOException;

    static ArchiveSource ofBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return () -> new ByteArrayInputStream(bytes);
    }

    static ArchiveSource ofPath(Path path) {
        Objects.requireNonNull(path, "path");
        return () -> Files.newInputStream(path);
    }
}
