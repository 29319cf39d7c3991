package org.pubkit;

import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

public final class TestArchives {

    public static final String CONTAINER_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <container version="1.0" xmlns="urn:oasis:names:tc:opendocument:xmlns:container">
              <rootfiles>
                <rootfile full-path="OEBPS/content.opf" media-type="application/oebps-package+xml"/>
              </rootfiles>
            </container>
            """;

    private TestArchives() {
    }

    /**
     * Writes a ZIP with the given entries in iteration order. A {@code mimetype} entry is stored uncompressed,
     * as EPUB requires.
     */
    public static Path zip(Path file, Map<String, ?> entries) throws IOException {
        try (ZipOutputStream zos = new ZipOutputStream(new FileOutputStream(file.toFile()))) {
            for (Map.Entry<String, ?> entry : entries.entrySet()) {
                byte[] content = entry.getValue() instanceof byte[] bytes
                        ? bytes
                        : String.valueOf(entry.getValue()).getBytes(StandardCharsets.UTF_8);
                ZipEntry zipEntry = new ZipEntry(entry.getKey());
                if ("mimetype".equals(entry.getKey())) {
                    CRC32 crc = new CRC32();
                    crc.update(content);
                    zipEntry.setMethod(ZipEntry.STORED);
                    zipEntry.setSize(content.length);
                    zipEntry.setCrc(crc.getValue());
                }
                zos.putNextEntry(zipEntry);
                zos.write(content);
                zos.closeEntry();
            }
        }
        return file;
    }
}
