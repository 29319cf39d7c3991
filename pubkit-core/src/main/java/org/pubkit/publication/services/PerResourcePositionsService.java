package org.pubkit.publication.services;

import org.pubkit.model.Link;
import org.pubkit.model.Locator;
import org.pubkit.publication.ServiceFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * One position per reading order resource, as for image sequences where each image is a page.
 */
public class PerResourcePositionsService implements PositionsService {

    private final List<Link> readingOrder;
    private final String fallbackMediaType;

    public PerResourcePositionsService(List<Link> readingOrder, String fallbackMediaType) {
        this.readingOrder = List.copyOf(readingOrder);
        this.fallbackMediaType = fallbackMediaType;
    }

    public static ServiceFactory factory(String fallbackMediaType) {
        return context -> new PerResourcePositionsService(context.getManifest().getReadingOrder(), fallbackMediaType);
    }

    @Override
    public List<List<Locator>> positionsByReadingOrder() {
        int count = readingOrder.size();
        List<List<Locator>> positions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Link link = readingOrder.get(i);
            positions.add(List.of(Locator.builder()
                    .href(link.getHref())
                    .type(link.getType() != null ? link.getType() : fallbackMediaType)
                    .title(link.getTitle())
                    .position(i + 1)
                    .progression(0.0)
                    .totalProgression((double) i / count)
                    .build()));
        }
        return positions;
    }
}
