package org.pubkit.parser.epub;

import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;
import org.pubkit.fetcher.XmlDocument;
import org.pubkit.model.Link;
import org.pubkit.util.HrefUtils;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the EPUB 2 NCX index: {@code navMap} becomes the {@code toc} role, {@code pageList} the
 * {@code page-list} role.
 */
@UtilityClass
public class NcxParser {

    public static Map<String, List<Link>> parse(XmlDocument document, String ncxPath) {
        Map<String, List<Link>> navigation = new LinkedHashMap<>();

        document.selectElement("/ncx:ncx/ncx:navMap")
                .map(navMap -> parseNavPoints(document, navMap, "ncx:navPoint", ncxPath))
                .filter(links -> !links.isEmpty())
                .ifPresent(links -> navigation.put("toc", links));

        document.selectElement("/ncx:ncx/ncx:pageList")
                .map(pageList -> parseNavPoints(document, pageList, "ncx:pageTarget", ncxPath))
                .filter(links -> !links.isEmpty())
                .ifPresent(links -> navigation.put("page-list", links));

        return navigation;
    }

    private static List<Link> parseNavPoints(XmlDocument document, Element parent, String childExpression, String ncxPath) {
        List<Link> links = new ArrayList<>();
        for (Element navPoint : document.selectElements(parent, childExpression)) {
            Link link = parseNavPoint(document, navPoint, ncxPath);
            if (link != null) {
                links.add(link);
            }
        }
        return links;
    }

    private static Link parseNavPoint(XmlDocument document, Element navPoint, String ncxPath) {
        String title = document.selectText(navPoint, "ncx:navLabel/ncx:text").orElse(null);
        String href = document.selectElement(navPoint, "ncx:content")
                .map(content -> StringUtils.trimToNull(content.getAttribute("src")))
                .map(src -> HrefUtils.resolve(ncxPath, src))
                .orElse(null);
        List<Link> children = parseNavPoints(document, navPoint, "ncx:navPoint", ncxPath);

        if (href == null && children.isEmpty()) {
            return null;
        }
        return Link.builder()
                .href(href)
                .title(title)
                .children(children)
                .build();
    }
}
