package org.pubkit.publication.services;

import org.pubkit.model.Link;
import org.pubkit.model.LinkProperties;
import org.pubkit.model.Manifest;
import org.pubkit.model.enums.KnownMediaType;
import org.pubkit.publication.PublicationService;
import org.pubkit.publication.ServiceFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Guided navigation backed by EPUB media overlays (SMIL documents).
 */
public class MediaOverlayService implements PublicationService {

    public static final String NAME = "guided-navigation";

    private final List<Link> readingOrder;
    private final List<Link> overlayDocuments;

    MediaOverlayService(List<Link> readingOrder, List<Link> overlayDocuments) {
        this.readingOrder = List.copyOf(readingOrder);
        this.overlayDocuments = List.copyOf(overlayDocuments);
    }

    public static ServiceFactory factory() {
        return context -> {
            Manifest manifest = context.getManifest();
            List<Link> overlays = Stream.concat(manifest.getReadingOrder().stream(), manifest.getResources().stream())
                    .filter(link -> KnownMediaType.SMIL.matches(link.getType()))
                    .toList();
            return overlays.isEmpty() ? null : new MediaOverlayService(manifest.getReadingOrder(), overlays);
        };
    }

    public List<Link> getOverlayDocuments() {
        return overlayDocuments;
    }

    /**
     * The SMIL document synchronized with the given reading order resource, if any.
     */
    public Optional<Link> overlayFor(String href) {
        return readingOrder.stream()
                .filter(link -> link.getHref().equals(href))
                .map(Link::getProperties)
                .filter(Objects::nonNull)
                .map(LinkProperties::getMediaOverlay)
                .filter(Objects::nonNull)
                .findFirst()
                .flatMap(overlayHref -> overlayDocuments.stream()
                        .filter(link -> link.getHref().equals(overlayHref))
                        .findFirst());
    }
}
