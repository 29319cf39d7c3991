package org.pubkit.asset;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOUtils;
import org.pubkit.fetcher.Fetcher;
import org.pubkit.fetcher.RarArchiveFetcher;
import org.pubkit.fetcher.SingleFileFetcher;
import org.pubkit.fetcher.ZipArchiveFetcher;
import org.pubkit.model.enums.KnownMediaType;
import org.pubkit.util.ArchiveUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;

/**
 * A publication stored as a local file. The media type is sniffed from the extension, then from the
 * {@code mimetype} entry of ZIP containers whose extension says nothing useful.
 */
@Slf4j
public class FileAsset implements PublicationAsset {

    private static final String MIMETYPE_ENTRY = "mimetype";

    private final Path path;
    private final ArchiveUtils.ArchiveType archiveType;
    private final String mediaType;

    public FileAsset(Path path) {
        this.path = path;
        this.archiveType = ArchiveUtils.detectArchiveType(path.toFile());
        this.mediaType = sniffMediaType();
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String getName() {
        return FilenameUtils.getBaseName(path.getFileName().toString());
    }

    @Override
    public String getMediaType() {
        return mediaType;
    }

    @Override
    public Fetcher createFetcher() throws IOException {
        return switch (archiveType) {
            case ZIP -> ZipArchiveFetcher.open(path);
            case RAR -> RarArchiveFetcher.open(path);
            case UNKNOWN -> new SingleFileFetcher(path);
        };
    }

    private String sniffMediaType() {
        KnownMediaType byExtension = KnownMediaType.fromFileName(path.getFileName().toString()).orElse(null);
        if (byExtension != null && byExtension != KnownMediaType.ZIP) {
            return byExtension.getMimeType();
        }
        if (archiveType == ArchiveUtils.ArchiveType.ZIP) {
            return readMimetypeEntry().orElse(KnownMediaType.ZIP.getMimeType());
        }
        if (archiveType == ArchiveUtils.ArchiveType.RAR) {
            return "application/vnd.rar";
        }
        return "application/octet-stream";
    }

    private Optional<String> readMimetypeEntry() {
        try (ZipFile zipFile = ZipFile.builder().setPath(path).get()) {
            ZipArchiveEntry entry = zipFile.getEntry(MIMETYPE_ENTRY);
            if (entry == null) {
                return Optional.empty();
            }
            try (InputStream in = zipFile.getInputStream(entry)) {
                String declared = IOUtils.toString(in, StandardCharsets.US_ASCII).trim();
                return declared.isEmpty() ? Optional.empty() : Optional.of(declared);
            }
        } catch (IOException e) {
            log.debug("Cannot read mimetype entry of {}: {}", path.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }
}
