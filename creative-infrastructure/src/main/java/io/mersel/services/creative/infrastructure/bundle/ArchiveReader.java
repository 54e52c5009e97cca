package io.mersel.services.creative.infrastructure.bundle;

import io.mersel.services.creative.application.interfaces.ArchiveSource;
import io.mersel.services.creative.application.interfaces.BundleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Kreatif arşivine açık bir okuma tutamacı.
 * <p>
 * {@link ZipFile} dosya sistemi gerektirdiği için kaynak akış geçici bir dosyaya
 * yazılır; tutamaç kapatıldığında dosya silinir. Girdiler merkezi dizin sırasıyla
 * döner, aynı kaynağın her açılışı aynı sırayı üretir.
 */
public final class ArchiveReader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ArchiveReader.class);

    private final Path tempFile;
    private final ZipFile zipFile;
    private final List<? extends ZipEntry> entries;
    private final String transformId;

    private ArchiveReader(Path tempFile, ZipFile zipFile, List<? extends ZipEntry> entries, String transformId) {
        this.tempFile = tempFile;
        this.zipFile = zipFile;
        this.entries = entries;
        this.transformId = transformId;
    }

    /**
     * Kaynağı baştan okuyup ZIP olarak açar.
     *
     * @param source          Arşiv kaynağı
     * @param transformId     Hata mesajları için dönüşüm kimliği
     * @param maxArchiveSize  Kabul edilen en büyük arşiv boyutu (byte)
     * @param maxEntries      Kabul edilen en fazla girdi sayısı
     * @throws BundleException Kaynak okunamazsa, ZIP değilse, bozuksa veya sınırları aşıyorsa
     */
    public static ArchiveReader open(ArchiveSource source, String transformId,
                                     long maxArchiveSize, int maxEntries) throws BundleException {
        Path tempFile;
        try {
            tempFile = Files.createTempFile("creative-bundle-", ".zip");
        } catch (IOException e) {
            throw new BundleException("Geçici arşiv dosyası oluşturulamadı: " + e.getMessage(), transformId, e);
        }

        try {
            try (InputStream in = source.openStream(); OutputStream out = Files.newOutputStream(tempFile)) {
                copyLimited(in, out, maxArchiveSize, transformId);
            }
            var zipFile = new ZipFile(tempFile.toFile());
            List<? extends ZipEntry> entries;
            try {
                entries = Collections.list(zipFile.entries());
            } catch (IllegalArgumentException e) {
                // Geçersiz karakter kodlamalı girdi adı
                zipFile.close();
                throw e;
            }
            if (entries.size() > maxEntries) {
                zipFile.close();
                throw new BundleException("Arşiv çok büyük: " + entries.size()
                        + " girdi, en fazla " + maxEntries + " (" + transformId + ")", transformId);
            }
            return new ArchiveReader(tempFile, zipFile, entries, transformId);
        } catch (ZipException | IllegalArgumentException e) {
            deleteTempFile(tempFile);
            throw new BundleException("ZIP açılamadı (" + transformId + "): " + e.getMessage(), transformId, e);
        } catch (IOException e) {
            deleteTempFile(tempFile);
            throw new BundleException("Arşiv okunamadı (" + transformId + "): " + e.getMessage(), transformId, e);
        } catch (BundleException e) {
            deleteTempFile(tempFile);
            throw e;
        }
    }

    /**
     * Tüm girdiler, merkezi dizin sırasıyla.
     */
    public List<? extends ZipEntry> entries() {
        return entries;
    }

    /**
     * Adı verilen girdinin tüm içeriğini okur.
     *
     * @throws BundleException Girdi yoksa veya okunamazsa
     */
    public byte[] read(String name) throws BundleException {
        ZipEntry entry = zipFile.getEntry(name);
        if (entry == null) {
            throw new BundleException("Arşivde girdi bulunamadı: " + name + " (" + transformId + ")", transformId);
        }
        return read(entry);
    }

    /**
     * Girdinin tüm içeriğini okur.
     *
     * @throws BundleException Girdi bozuksa
     */
    public byte[] read(ZipEntry entry) throws BundleException {
        try (InputStream in = zipFile.getInputStream(entry)) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new BundleException("ZIP girdisi okunamadı: " + entry.getName()
                    + " (" + transformId + "): " + e.getMessage(), transformId, e);
        }
    }

    @Override
    public void close() {
        try {
            zipFile.close();
        } catch (IOException e) {
            log.warn("Arşiv kapatılamadı ({}): {}", transformId, e.getMessage());
        }
        deleteTempFile(tempFile);
    }

    private static void copyLimited(InputStream in, OutputStream out, long maxArchiveSize, String transformId)
            throws IOException, BundleException {
        byte[] buffer = new byte[8192];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            total += read;
            if (total > maxArchiveSize) {
                throw new BundleException("Arşiv çok büyük: " + maxArchiveSize
                        + " byte sınırı aşıldı (" + transformId + ")", transformId);
            }
            out.write(buffer, 0, read);
        }
    }

    private static void deleteTempFile(Path tempFile) {
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("Geçici arşiv dosyası silinemedi: {} — {}", tempFile, e.getMessage());
        }
    }
}
