package org.pubkit.publication.services;

import org.junit.jupiter.api.Test;
import org.pubkit.fetcher.InMemoryFetcher;
import org.pubkit.model.Encryption;
import org.pubkit.model.Link;
import org.pubkit.model.LinkProperties;
import org.pubkit.model.Locator;
import org.pubkit.model.enums.Layout;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EpubPositionsServiceTest {

    @Test
    void reflowableResourcesAreSplitByPageLength() {
        InMemoryFetcher fetcher = new InMemoryFetcher()
                .with("ch1.xhtml", new byte[250])
                .with("ch2.xhtml", new byte[100])
                .with("empty.xhtml", new byte[0]);
        List<Link> readingOrder = List.of(Link.of("ch1.xhtml"), Link.of("ch2.xhtml"), Link.of("empty.xhtml"));

        EpubPositionsService service = new EpubPositionsService(readingOrder, Layout.REFLOWABLE, fetcher, 100);

        List<List<Locator>> positions = service.positionsByReadingOrder();
        assertThat(positions).extracting(List::size).containsExactly(3, 1, 1);
        assertThat(service.positions()).extracting(Locator::getPosition).containsExactly(1, 2, 3, 4, 5);
        assertThat(positions.get(0)).extracting(Locator::getProgression).containsExactly(0.0, 1.0 / 3, 2.0 / 3);
        assertThat(service.positions().get(4).getTotalProgression()).isEqualTo(0.8);
    }

    @Test
    void originalLengthOfEncryptedResourceIsPreferred() {
        Link encrypted = Link.builder()
                .href("ch1.xhtml")
                .properties(LinkProperties.builder()
                        .encrypted(Encryption.builder().algorithm("aes").originalLength(1000L).build())
                        .build())
                .build();
        InMemoryFetcher fetcher = new InMemoryFetcher().with("ch1.xhtml", new byte[10]);

        EpubPositionsService service = new EpubPositionsService(List.of(encrypted), null, fetcher, 100);

        assertThat(service.positions()).hasSize(10);
        assertThat(fetcher.getRequested()).isEmpty();
    }

    @Test
    void fixedLayoutHasOnePositionPerResource() {
        InMemoryFetcher fetcher = new InMemoryFetcher().with("p1.xhtml", new byte[5000]);

        EpubPositionsService service = new EpubPositionsService(List.of(Link.of("p1.xhtml")), Layout.FIXED, fetcher, 100);

        assertThat(service.positions()).hasSize(1);
    }

    @Test
    void unreadableResourceCountsOnePosition() {
        EpubPositionsService service = new EpubPositionsService(List.of(Link.of("missing.xhtml")), Layout.REFLOWABLE,
                new InMemoryFetcher(), 100);

        assertThat(service.positions()).hasSize(1);
    }

    @Test
    void pageLengthMustBePositive() {
        assertThatThrownBy(() -> new EpubPositionsService(List.of(), Layout.REFLOWABLE, new InMemoryFetcher(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
