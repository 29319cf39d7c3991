package org.pubkit.parser;

import lombok.extern.slf4j.Slf4j;
import org.pubkit.asset.FileAsset;
import org.pubkit.asset.PublicationAsset;
import org.pubkit.exception.ParseError;
import org.pubkit.fetcher.Fetcher;
import org.pubkit.publication.Publication;
import org.pubkit.publication.PublicationBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Opens publications by offering the asset to each configured parser in turn; the first match wins.
 */
@Slf4j
public class PublicationOpener {

    private final List<PublicationParser> parsers;

    public PublicationOpener(List<PublicationParser> parsers) {
        this.parsers = List.copyOf(parsers);
    }

    public Publication open(Path path) {
        if (!Files.isRegularFile(path)) {
            throw ParseError.FILE_READ_ERROR.createException(path);
        }
        return open(new FileAsset(path));
    }

    public Publication open(PublicationAsset asset) {
        Fetcher fetcher;
        try {
            fetcher = asset.createFetcher();
        } catch (IOException e) {
            throw ParseError.FILE_READ_ERROR.createException(e, asset.getName());
        }

        try {
            for (PublicationParser parser : parsers) {
                Optional<PublicationBuilder> builder = parser.parse(asset, fetcher);
                if (builder.isPresent()) {
                    log.debug("Opened '{}' with {}", asset.getName(), parser.getClass().getSimpleName());
                    return builder.get().build();
                }
            }
        } catch (RuntimeException e) {
            closeAfterFailure(fetcher, asset);
            throw e;
        }

        closeAfterFailure(fetcher, asset);
        throw ParseError.UNSUPPORTED_FORMAT.createException(asset.getName(), asset.getMediaType());
    }

    private void closeAfterFailure(Fetcher fetcher, PublicationAsset asset) {
        try {
            fetcher.close();
        } catch (IOException e) {
            log.warn("Failed to close resources of '{}': {}", asset.getName(), e.getMessage());
        }
    }
}
