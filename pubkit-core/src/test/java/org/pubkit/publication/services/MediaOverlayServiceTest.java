package org.pubkit.publication.services;

import org.junit.jupiter.api.Test;
import org.pubkit.fetcher.InMemoryFetcher;
import org.pubkit.model.Link;
import org.pubkit.model.LinkProperties;
import org.pubkit.model.Manifest;
import org.pubkit.publication.ServiceContext;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MediaOverlayServiceTest {

    @Test
    void noSmilMeansNoService() {
        Manifest manifest = Manifest.builder()
                .readingOrder(List.of(Link.builder().href("ch1.xhtml").type("application/xhtml+xml").build()))
                .build();

        assertThat(MediaOverlayService.factory().create(new ServiceContext(manifest, new InMemoryFetcher()))).isNull();
    }

    @Test
    void findsOverlayOfReadingOrderItem() {
        Link smil = Link.builder().href("ch1.smil").type("application/smil+xml").build();
        Manifest manifest = Manifest.builder()
                .readingOrder(List.of(
                        Link.builder().href("ch1.xhtml").properties(LinkProperties.builder().mediaOverlay("ch1.smil").build()).build(),
                        Link.of("ch2.xhtml")))
                .resources(List.of(smil))
                .build();

        MediaOverlayService service = (MediaOverlayService) MediaOverlayService.factory()
                .create(new ServiceContext(manifest, new InMemoryFetcher()));

        assertThat(service.getOverlayDocuments()).containsExactly(smil);
        assertThat(service.overlayFor("ch1.xhtml")).contains(smil);
        assertThat(service.overlayFor("ch2.xhtml")).isEmpty();
    }
}
