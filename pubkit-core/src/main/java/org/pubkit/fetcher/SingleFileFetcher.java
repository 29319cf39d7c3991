package org.pubkit.fetcher;

import org.pubkit.model.Link;
import org.pubkit.model.enums.KnownMediaType;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Exposes a standalone file (a single bitmap, for instance) as a one-resource container.
 */
public class SingleFileFetcher implements Fetcher {

    private final Path file;
    private final Link link;

    public SingleFileFetcher(Path file) {
        this.file = file;
        String href = file.getFileName().toString();
        this.link = Link.builder()
                .href(href)
                .type(KnownMediaType.fromFileName(href).map(KnownMediaType::getMimeType).orElse(null))
                .build();
    }

    @Override
    public List<Link> links() {
        return List.of(link);
    }

    @Override
    public Resource get(Link requested) {
        if (!link.getHref().equals(requested.getHref())) {
            return new FailureResource(requested, new FileNotFoundException("Unknown resource: " + requested.getHref()));
        }
        return new Resource() {
            @Override
            public Link getLink() {
                return requested;
            }

            @Override
            public long length() throws IOException {
                return Files.size(file);
            }

            @Override
            public byte[] read() throws IOException {
                return Files.readAllBytes(file);
            }
        };
    }

    @Override
    public void close() {
    }
}
