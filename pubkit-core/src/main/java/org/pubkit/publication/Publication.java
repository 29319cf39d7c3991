package org.pubkit.publication;

import lombok.Getter;
import org.pubkit.fetcher.Fetcher;
import org.pubkit.fetcher.Resource;
import org.pubkit.model.Link;
import org.pubkit.model.Locator;
import org.pubkit.model.Manifest;
import org.pubkit.publication.services.PositionsService;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Getter
public class Publication implements Closeable {

    private final Manifest manifest;
    private final Fetcher fetcher;
    private final Map<String, PublicationService> services;

    Publication(Manifest manifest, Fetcher fetcher, Map<String, PublicationService> services) {
        this.manifest = manifest;
        this.fetcher = fetcher;
        this.services = Map.copyOf(services);
    }

    public <T extends PublicationService> Optional<T> findService(String name, Class<T> type) {
        PublicationService service = services.get(name);
        return type.isInstance(service) ? Optional.of(type.cast(service)) : Optional.empty();
    }

    /**
     * Reads a resource through the publication fetcher. Manifest links are preferred over bare hrefs so
     * that their encryption properties reach the resource transformers.
     */
    public Resource get(String href) {
        return manifest.linkWithHref(href)
                .map(fetcher::get)
                .orElseGet(() -> fetcher.get(Link.of(href)));
    }

    public List<Locator> positions() {
        return findService(PositionsService.NAME, PositionsService.class)
                .map(PositionsService::positions)
                .orElse(List.of());
    }

    @Override
    public void close() throws IOException {
        fetcher.close();
    }
}
