package org.pubkit.publication.services;

import lombok.extern.slf4j.Slf4j;
import org.pubkit.fetcher.Fetcher;
import org.pubkit.fetcher.Resource;
import org.pubkit.model.Link;
import org.pubkit.publication.PublicationService;
import org.pubkit.publication.ServiceFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Iterates the text of the reading order through the first extractor supporting each resource.
 */
@Slf4j
public class ContentService implements PublicationService {

    public static final String NAME = "content";

    private final List<Link> readingOrder;
    private final Fetcher fetcher;
    private final List<ResourceContentExtractor> extractors;

    public ContentService(List<Link> readingOrder, Fetcher fetcher, List<ResourceContentExtractor> extractors) {
        this.readingOrder = List.copyOf(readingOrder);
        this.fetcher = fetcher;
        this.extractors = List.copyOf(extractors);
    }

    public static ServiceFactory factory(List<ResourceContentExtractor> extractors) {
        return context -> new ContentService(context.getManifest().getReadingOrder(), context.getFetcher(), extractors);
    }

    public List<ContentElement> content() {
        List<ContentElement> elements = new ArrayList<>();
        for (Link link : readingOrder) {
            ResourceContentExtractor extractor = extractors.stream()
                    .filter(candidate -> candidate.supports(link))
                    .findFirst()
                    .orElse(null);
            if (extractor == null) {
                continue;
            }
            try (Resource resource = fetcher.get(link)) {
                elements.addAll(extractor.extract(resource));
            } catch (IOException e) {
                log.warn("Skipping content of {}: {}", link.getHref(), e.getMessage());
            }
        }
        return elements;
    }
}
