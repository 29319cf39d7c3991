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
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads the EPUB 3 navigation document. Each {@code <nav epub:type="...">} of a known role contributes its
 * top-level {@code <ol>}; the first nav of a given role wins.
 */
@UtilityClass
public class NavigationDocumentParser {

    private static final Set<String> ROLES = Set.of("toc", "page-list", "landmarks", "lot", "loi", "loa", "lov");
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    public static Map<String, List<Link>> parse(XmlDocument document, String navPath) {
        Map<String, List<Link>> navigation = new LinkedHashMap<>();
        for (Element nav : document.selectElements("//html:nav")) {
            Optional<String> role = roleOf(nav);
            if (role.isEmpty() || navigation.containsKey(role.get())) {
                continue;
            }
            List<Link> links = document.selectElement(nav, "html:ol")
                    .map(ol -> parseOl(document, ol, navPath))
                    .orElse(List.of());
            if (!links.isEmpty()) {
                navigation.put(role.get(), links);
            }
        }
        return navigation;
    }

    private static Optional<String> roleOf(Element nav) {
        String type = nav.getAttributeNS(EpubNamespaces.OPS, "type");
        if (StringUtils.isBlank(type)) {
            return Optional.empty();
        }
        for (String token : WHITESPACE_PATTERN.split(type.trim())) {
            if (ROLES.contains(token)) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    private static List<Link> parseOl(XmlDocument document, Element ol, String navPath) {
        List<Link> links = new ArrayList<>();
        for (Element li : document.selectElements(ol, "html:li")) {
            Link link = parseLi(document, li, navPath);
            if (link != null) {
                links.add(link);
            }
        }
        return links;
    }

    private static Link parseLi(XmlDocument document, Element li, String navPath) {
        Element label = document.selectElement(li, "html:a|html:span").orElse(null);
        List<Link> children = document.selectElement(li, "html:ol")
                .map(ol -> parseOl(document, ol, navPath))
                .orElse(List.of());
        if (label == null) {
            return children.isEmpty() ? null : Link.builder().children(children).build();
        }

        String title = StringUtils.normalizeSpace(label.getTextContent());
        String href = "a".equals(label.getLocalName())
                ? Optional.ofNullable(StringUtils.trimToNull(label.getAttribute("href")))
                        .map(value -> HrefUtils.resolve(navPath, value))
                        .orElse(null)
                : null;

        if (href == null && StringUtils.isEmpty(title) && children.isEmpty()) {
            return null;
        }
        return Link.builder()
                .href(href)
                .title(StringUtils.trimToNull(title))
                .children(children)
                .build();
    }
}
