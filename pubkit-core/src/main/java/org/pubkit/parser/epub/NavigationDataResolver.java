package org.pubkit.parser.epub;

import lombok.extern.slf4j.Slf4j;
import org.pubkit.fetcher.Fetcher;
import org.pubkit.fetcher.XmlDocument;
import org.pubkit.model.Link;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the role-keyed navigation of an EPUB. Missing or unreadable navigation yields an empty map.
 */
@Slf4j
public class NavigationDataResolver {

    public Map<String, List<Link>> resolve(PackageDocument packageDocument, Fetcher fetcher) {
        NavigationStrategy strategy = NavigationStrategy.forVersion(packageDocument.getVersion());
        Optional<PackageDocument.Item> navigationItem = strategy.locate(packageDocument);
        if (navigationItem.isEmpty()) {
            log.debug("No {} navigation declared in {}", strategy, packageDocument.getPath());
            return Map.of();
        }

        PackageDocument.Item item = navigationItem.get();
        try {
            XmlDocument document = fetcher.get(Link.builder().href(item.getHref()).type(item.getMediaType()).build())
                    .readAsXml(strategy.bindings());
            return Collections.unmodifiableMap(new LinkedHashMap<>(strategy.parse(document, item.getHref())));
        } catch (IOException e) {
            log.debug("Ignoring unreadable navigation {}: {}", item.getHref(), e.getMessage());
            return Map.of();
        }
    }
}
