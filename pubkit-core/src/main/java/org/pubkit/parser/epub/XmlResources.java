package org.pubkit.parser.epub;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.pubkit.fetcher.Fetcher;
import org.pubkit.fetcher.XmlDocument;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

@Slf4j
@UtilityClass
class XmlResources {

    /**
     * Reads an optional well-known document. An absent or malformed document is reported as empty.
     */
    static Optional<XmlDocument> readOptional(Fetcher fetcher, String href, Map<String, String> bindings) {
        try {
            return Optional.of(fetcher.get(href).readAsXml(bindings));
        } catch (IOException e) {
            log.debug("Optional document {} unavailable: {}", href, e.getMessage());
            return Optional.empty();
        }
    }
}
