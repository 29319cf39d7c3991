package org.pubkit.parser.epub;

import org.apache.commons.lang3.StringUtils;
import org.pubkit.fetcher.Fetcher;
import org.pubkit.fetcher.XmlDocument;
import org.w3c.dom.Element;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads vendor display options. Candidates are tried in order and the first readable document wins, even if
 * it declares no options.
 */
public class DisplayOptionsResolver {

    public static final List<String> DISPLAY_OPTIONS_PATHS = List.of(
            "META-INF/com.apple.ibooks.display-options.xml",
            "META-INF/com.kobobooks.display-options.xml");

    public Map<String, String> resolve(Fetcher fetcher) {
        return DISPLAY_OPTIONS_PATHS.stream()
                .map(path -> XmlResources.readOptional(fetcher, path, Map.of()))
                .flatMap(Optional::stream)
                .findFirst()
                .map(DisplayOptionsResolver::extractOptions)
                .orElseGet(Map::of);
    }

    private static Map<String, String> extractOptions(XmlDocument document) {
        Map<String, String> options = new LinkedHashMap<>();
        document.selectElement("//platform").ifPresent(platform -> {
            for (Element option : document.selectElements(platform, "option")) {
                String name = option.getAttribute("name");
                String value = option.getTextContent();
                if (StringUtils.isNotEmpty(name) && StringUtils.isNotEmpty(value)) {
                    options.put(name, value);
                }
            }
        });
        return Collections.unmodifiableMap(options);
    }
}
