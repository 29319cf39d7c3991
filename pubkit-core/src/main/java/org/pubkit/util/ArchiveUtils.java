package org.pubkit.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.*;

@Slf4j
@UtilityClass
public class ArchiveUtils {

    public enum ArchiveType {
        ZIP,
        RAR,
        UNKNOWN
    }

    private static final byte[] ZIP_MAGIC = {0x50, 0x4B, 0x03, 0x04};
    // Empty archives only carry the end of central directory record
    private static final byte[] ZIP_EMPTY_MAGIC = {0x50, 0x4B, 0x05, 0x06};
    // RAR 5.0 signature: 0x52 0x61 0x72 0x21 0x1A 0x07 0x01 0x00
    private static final byte[] RAR_MAGIC_V5 = {0x52, 0x61, 0x72, 0x21, 0x1A, 0x07, 0x01, 0x00};
    // RAR 4.x signature: 0x52 0x61 0x72 0x21 0x1A 0x07 0x00
    private static final byte[] RAR_MAGIC_V4 = {0x52, 0x61, 0x72, 0x21, 0x1A, 0x07, 0x00};

    /**
     * Detects the container kind from the leading bytes, falling back to the extension.
     * A CBR that is really a ZIP (a common mislabel) is reported as ZIP.
     */
    public static ArchiveType detectArchiveType(File file) {
        if (file == null || !file.exists() || !file.isFile()) {
            return ArchiveType.UNKNOWN;
        }

        try (InputStream is = new BufferedInputStream(new FileInputStream(file))) {
            byte[] buffer = new byte[8];
            int bytesRead = is.read(buffer);
            if (bytesRead < 4) {
                return detectArchiveTypeByExtension(file.getName());
            }

            if (startsWith(buffer, ZIP_MAGIC) || startsWith(buffer, ZIP_EMPTY_MAGIC)) {
                return ArchiveType.ZIP;
            }
            if (startsWith(buffer, RAR_MAGIC_V5) || startsWith(buffer, RAR_MAGIC_V4)) {
                return ArchiveType.RAR;
            }
        } catch (IOException e) {
            log.warn("Failed to detect archive type by content for file: {}", file.getAbsolutePath());
        }

        return detectArchiveTypeByExtension(file.getName());
    }

    public static ArchiveType detectArchiveTypeByExtension(String fileName) {
        if (fileName == null) {
            return ArchiveType.UNKNOWN;
        }
        String lower = fileName.toLowerCase();
        if (lower.endsWith(".cbz") || lower.endsWith(".zip") || lower.endsWith(".epub")) {
            return ArchiveType.ZIP;
        }
        if (lower.endsWith(".cbr") || lower.endsWith(".rar")) {
            return ArchiveType.RAR;
        }
        return ArchiveType.UNKNOWN;
    }

    private static boolean startsWith(byte[] buffer, byte[] magic) {
        if (buffer.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (buffer[i] != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
