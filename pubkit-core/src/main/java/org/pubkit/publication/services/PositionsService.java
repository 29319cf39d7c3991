package org.pubkit.publication.services;

import org.pubkit.model.Locator;
import org.pubkit.publication.PublicationService;

import java.util.List;

public interface PositionsService extends PublicationService {

    String NAME = "positions";

    /**
     * Positions grouped by reading order item, in reading order.
     */
    List<List<Locator>> positionsByReadingOrder();

    default List<Locator> positions() {
        return positionsByReadingOrder().stream().flatMap(List::stream).toList();
    }
}
