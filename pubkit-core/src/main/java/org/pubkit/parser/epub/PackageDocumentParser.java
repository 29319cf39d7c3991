package org.pubkit.parser.epub;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.pubkit.fetcher.XmlDocument;
import org.pubkit.util.HrefUtils;
import org.w3c.dom.Element;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

@Slf4j
@UtilityClass
public class PackageDocumentParser {

    // Pre-3.0 packages without a usable version attribute are treated as OEBPS 1.2
    private static final double DEFAULT_VERSION = 1.2;
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    public static PackageDocument parse(XmlDocument document, String path) throws IOException {
        Element root = document.selectElement("/opf:package")
                .orElseThrow(() -> new IOException("No <package> root element in " + path));

        Element metadata = document.selectElement(root, "opf:metadata")
                .orElseThrow(() -> new IOException("No <metadata> element in " + path));

        return PackageDocument.builder()
                .path(path)
                .version(parseVersion(root.getAttribute("version")))
                .metadata(parseMetadata(document, metadata, root.getAttribute("unique-identifier")))
                .manifest(parseManifest(document, root, path))
                .spine(parseSpine(document, root))
                .build();
    }

    static double parseVersion(String version) {
        if (StringUtils.isBlank(version)) {
            return DEFAULT_VERSION;
        }
        try {
            return Double.parseDouble(version.trim());
        } catch (NumberFormatException e) {
            log.debug("Unparsable package version '{}', assuming {}", version, DEFAULT_VERSION);
            return DEFAULT_VERSION;
        }
    }

    private static PackageDocument.PackageMetadata parseMetadata(XmlDocument document, Element metadata, String uniqueIdentifierId) {
        Set<String> subtitleIds = new LinkedHashSet<>();
        for (Element meta : document.selectElements(metadata, "opf:meta[@property='title-type']")) {
            if ("subtitle".equals(meta.getTextContent().trim())) {
                subtitleIds.add(StringUtils.removeStart(meta.getAttribute("refines"), "#"));
            }
        }

        String title = null;
        String subtitle = null;
        for (Element titleElement : document.selectElements(metadata, "dc:title")) {
            String text = titleElement.getTextContent().trim();
            if (text.isEmpty()) {
                continue;
            }
            if (subtitleIds.contains(titleElement.getAttribute("id"))) {
                subtitle = subtitle == null ? text : subtitle;
            } else if (title == null) {
                title = text;
            }
        }

        List<Element> identifiers = document.selectElements(metadata, "dc:identifier");
        String identifier = identifiers.stream()
                .filter(element -> StringUtils.isNotBlank(uniqueIdentifierId) && uniqueIdentifierId.equals(element.getAttribute("id")))
                .findFirst()
                .or(() -> identifiers.stream().findFirst())
                .map(element -> StringUtils.trimToNull(element.getTextContent()))
                .orElse(null);

        return PackageDocument.PackageMetadata.builder()
                .identifier(identifier)
                .title(title)
                .subtitle(subtitle)
                .languages(texts(document, metadata, "dc:language"))
                .creators(texts(document, metadata, "dc:creator"))
                .publishers(texts(document, metadata, "dc:publisher"))
                .description(document.selectText(metadata, "dc:description").orElse(null))
                .date(document.selectText(metadata, "dc:date").orElse(null))
                .modified(document.selectText(metadata, "opf:meta[@property='dcterms:modified']").orElse(null))
                .coverId(document.selectElement(metadata, "opf:meta[@name='cover']")
                        .map(meta -> meta.getAttribute("content"))
                        .filter(StringUtils::isNotBlank)
                        .orElse(null))
                .layout(document.selectText(metadata, "opf:meta[@property='rendition:layout']").orElse(null))
                .orientation(document.selectText(metadata, "opf:meta[@property='rendition:orientation']").orElse(null))
                .spread(document.selectText(metadata, "opf:meta[@property='rendition:spread']").orElse(null))
                .build();
    }

    private static List<PackageDocument.Item> parseManifest(XmlDocument document, Element root, String path) {
        List<PackageDocument.Item> items = new ArrayList<>();
        for (Element item : document.selectElements(root, "opf:manifest/opf:item")) {
            String href = item.getAttribute("href");
            if (StringUtils.isBlank(href)) {
                continue;
            }
            items.add(PackageDocument.Item.builder()
                    .id(item.getAttribute("id"))
                    .href(HrefUtils.resolve(path, href.trim()))
                    .mediaType(StringUtils.trimToNull(item.getAttribute("media-type")))
                    .properties(tokens(item.getAttribute("properties")))
                    .mediaOverlay(StringUtils.trimToNull(item.getAttribute("media-overlay")))
                    .build());
        }
        return items;
    }

    private static PackageDocument.Spine parseSpine(XmlDocument document, Element root) {
        return document.selectElement(root, "opf:spine")
                .map(spine -> {
                    List<PackageDocument.Itemref> itemrefs = new ArrayList<>();
                    for (Element itemref : document.selectElements(spine, "opf:itemref")) {
                        String idref = itemref.getAttribute("idref");
                        if (StringUtils.isBlank(idref)) {
                            continue;
                        }
                        itemrefs.add(PackageDocument.Itemref.builder()
                                .idref(idref.trim())
                                .linear(!"no".equalsIgnoreCase(itemref.getAttribute("linear").trim()))
                                .properties(tokens(itemref.getAttribute("properties")))
                                .build());
                    }
                    return PackageDocument.Spine.builder()
                            .toc(StringUtils.trimToNull(spine.getAttribute("toc")))
                            .pageProgressionDirection(StringUtils.trimToNull(spine.getAttribute("page-progression-direction")))
                            .itemrefs(itemrefs)
                            .build();
                })
                .orElseGet(() -> PackageDocument.Spine.builder().build());
    }

    private static List<String> texts(XmlDocument document, Element context, String expression) {
        return document.selectElements(context, expression).stream()
                .map(element -> element.getTextContent().trim())
                .filter(text -> !text.isEmpty())
                .toList();
    }

    private static Set<String> tokens(String attribute) {
        if (StringUtils.isBlank(attribute)) {
            return Set.of();
        }
        return Set.copyOf(Arrays.asList(WHITESPACE_PATTERN.split(attribute.trim())));
    }
}
