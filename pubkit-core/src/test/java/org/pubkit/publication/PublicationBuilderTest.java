package org.pubkit.publication;

import org.junit.jupiter.api.Test;
import org.pubkit.fetcher.InMemoryFetcher;
import org.pubkit.model.Link;
import org.pubkit.model.Manifest;
import org.pubkit.publication.services.PerResourcePositionsService;
import org.pubkit.publication.services.PositionsService;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PublicationBuilderTest {

    @Test
    void buildSkipsFactoriesReturningNull() throws IOException {
        InMemoryFetcher fetcher = new InMemoryFetcher().with("1.png", new byte[]{1});
        Manifest manifest = Manifest.builder().readingOrder(List.of(Link.of("1.png"))).build();
        Map<String, ServiceFactory> factories = new LinkedHashMap<>();
        factories.put(PositionsService.NAME, PerResourcePositionsService.factory("image/*"));
        factories.put("nothing", context -> null);

        Publication publication = new PublicationBuilder(manifest, fetcher, factories).build();

        assertThat(publication.getServices()).containsOnlyKeys(PositionsService.NAME);
        assertThat(publication.findService(PositionsService.NAME, PerResourcePositionsService.class)).isPresent();
        assertThat(publication.findService(PositionsService.NAME, Wrong.class)).isEmpty();
        assertThat(publication.positions()).singleElement().satisfies(locator -> assertThat(locator.getType()).isEqualTo("image/*"));
        assertThat(publication.get("1.png").read()).containsExactly(1);

        publication.close();
        assertThat(fetcher.isClosed()).isTrue();
    }

    private interface Wrong extends PublicationService {
    }
}
