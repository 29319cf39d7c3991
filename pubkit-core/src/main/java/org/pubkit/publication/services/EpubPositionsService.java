package org.pubkit.publication.services;

import lombok.extern.slf4j.Slf4j;
import org.pubkit.fetcher.Fetcher;
import org.pubkit.fetcher.Resource;
import org.pubkit.model.Link;
import org.pubkit.model.LinkProperties;
import org.pubkit.model.Locator;
import org.pubkit.model.Presentation;
import org.pubkit.model.enums.Layout;
import org.pubkit.publication.ServiceFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits reflowable resources into positions of {@code pageLength} bytes each, based on the original
 * (pre-encryption) length when the publication declares it. Fixed-layout resources get a single position.
 */
@Slf4j
public class EpubPositionsService implements PositionsService {

    private final List<Link> readingOrder;
    private final Layout publicationLayout;
    private final Fetcher fetcher;
    private final int pageLength;
    private List<List<Locator>> positions;

    public EpubPositionsService(List<Link> readingOrder, Layout publicationLayout, Fetcher fetcher, int pageLength) {
        if (pageLength <= 0) {
            throw new IllegalArgumentException("Page length must be positive: " + pageLength);
        }
        this.readingOrder = List.copyOf(readingOrder);
        this.publicationLayout = publicationLayout != null ? publicationLayout : Layout.REFLOWABLE;
        this.fetcher = fetcher;
        this.pageLength = pageLength;
    }

    public static ServiceFactory factory(int pageLength) {
        return context -> {
            Presentation presentation = context.getManifest().getMetadata().getPresentation();
            return new EpubPositionsService(
                    context.getManifest().getReadingOrder(),
                    presentation != null ? presentation.getLayout() : null,
                    context.getFetcher(),
                    pageLength);
        };
    }

    @Override
    public synchronized List<List<Locator>> positionsByReadingOrder() {
        if (positions == null) {
            positions = computePositions();
        }
        return positions;
    }

    private List<List<Locator>> computePositions() {
        List<List<Locator>> perResource = new ArrayList<>(readingOrder.size());
        int lastPosition = 0;
        for (Link link : readingOrder) {
            int count = layoutOf(link) == Layout.FIXED ? 1 : reflowablePositionCount(link);
            List<Locator> locators = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                locators.add(Locator.builder()
                        .href(link.getHref())
                        .type(link.getType())
                        .title(link.getTitle())
                        .position(lastPosition + i + 1)
                        .progression((double) i / count)
                        .build());
            }
            lastPosition += count;
            perResource.add(locators);
        }

        int total = lastPosition;
        return perResource.stream()
                .map(locators -> locators.stream()
                        .map(locator -> locator.toBuilder()
                                .totalProgression((double) (locator.getPosition() - 1) / total)
                                .build())
                        .toList())
                .toList();
    }

    private Layout layoutOf(Link link) {
        LinkProperties properties = link.getProperties();
        if (properties != null && properties.getLayout() != null) {
            return properties.getLayout();
        }
        return publicationLayout;
    }

    private int reflowablePositionCount(Link link) {
        long length = resourceLength(link);
        return (int) Math.max(1, (length + pageLength - 1) / pageLength);
    }

    private long resourceLength(Link link) {
        LinkProperties properties = link.getProperties();
        if (properties != null && properties.getEncrypted() != null && properties.getEncrypted().getOriginalLength() != null) {
            return properties.getEncrypted().getOriginalLength();
        }
        try (Resource resource = fetcher.get(link)) {
            return resource.length();
        } catch (IOException e) {
            log.debug("Cannot measure {} for positions, counting one: {}", link.getHref(), e.getMessage());
            return 0;
        }
    }
}
