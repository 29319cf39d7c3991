package org.pubkit.publication.services;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.pubkit.fetcher.Resource;
import org.pubkit.model.Link;
import org.pubkit.model.enums.KnownMediaType;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class HtmlContentExtractor implements ResourceContentExtractor {

    private static final String BLOCK_SELECTOR = "h1, h2, h3, h4, h5, h6, p, li, blockquote, pre, figcaption, dt, dd";

    @Override
    public boolean supports(Link link) {
        return KnownMediaType.XHTML.matches(link.getType()) || KnownMediaType.HTML.matches(link.getType());
    }

    @Override
    public List<ContentElement> extract(Resource resource) throws IOException {
        String href = resource.getLink().getHref();
        Document document = Jsoup.parse(resource.readAsString(), href);
        Elements blocks = document.body().select(BLOCK_SELECTOR);
        Set<Element> selected = new HashSet<>(blocks);

        List<ContentElement> elements = new ArrayList<>();
        for (Element block : blocks) {
            // Nested blocks (a <p> inside an <li>) are covered by their outermost ancestor
            if (block.parents().stream().anyMatch(selected::contains)) {
                continue;
            }
            String text = block.text().trim();
            if (!text.isEmpty()) {
                elements.add(new ContentElement(href, block.normalName(), text));
            }
        }
        return elements;
    }
}
