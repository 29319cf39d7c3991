package org.pubkit.parser.image;

import lombok.extern.slf4j.Slf4j;
import org.pubkit.asset.PublicationAsset;
import org.pubkit.exception.ParseError;
import org.pubkit.fetcher.Fetcher;
import org.pubkit.model.Link;
import org.pubkit.model.Manifest;
import org.pubkit.model.Metadata;
import org.pubkit.model.enums.KnownMediaType;
import org.pubkit.model.enums.Profile;
import org.pubkit.parser.PublicationParser;
import org.pubkit.publication.PublicationBuilder;
import org.pubkit.publication.services.PerResourcePositionsService;
import org.pubkit.publication.services.PositionsService;
import org.pubkit.util.PathUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds image sequence publications from bitmap archives (CBZ, CBR, plain ZIP of images) or a standalone
 * bitmap. Pages are ordered by their path and the first page is the cover.
 */
@Slf4j
public class ImageParser implements PublicationParser {

    private static final Set<String> ALLOWED_COMPANION_EXTENSIONS = Set.of("acbf", "xml", "txt", "json");
    private static final String IMAGE_SEQUENCE_FALLBACK_TYPE = "image/*";

    private final List<TitleGuesser> titleGuessers;

    public ImageParser() {
        this(List.of(new FileStructureTitleGuesser()));
    }

    public ImageParser(List<TitleGuesser> titleGuessers) {
        this.titleGuessers = List.copyOf(titleGuessers);
    }

    @Override
    public Optional<PublicationBuilder> parse(PublicationAsset asset, Fetcher fetcher) {
        List<Link> links = listLinks(asset, fetcher);
        if (!accepts(asset, links)) {
            return Optional.empty();
        }

        List<Link> readingOrder = new ArrayList<>();
        for (Link link : links) {
            if (!PathUtils.isHiddenOrSystemFile(link.getHref()) && KnownMediaType.isBitmap(link.getType())) {
                readingOrder.add(link);
            }
        }
        if (readingOrder.isEmpty()) {
            log.warn("No bitmap in image publication {}", asset.getName());
            throw ParseError.NO_BITMAP_FOUND.createException(asset.getName());
        }

        readingOrder.sort(Comparator.comparing(Link::getHref));
        readingOrder.set(0, readingOrder.get(0).withRels(Set.of("cover")));

        String title = titleGuessers.stream()
                .map(guesser -> guesser.guess(links))
                .flatMap(Optional::stream)
                .findFirst()
                .orElse(asset.getName());

        Manifest manifest = Manifest.builder()
                .context(List.of(Profile.WEBPUB_CONTEXT))
                .metadata(Metadata.builder()
                        .title(title)
                        .conformsTo(Set.of(Profile.DIVINA))
                        .build())
                .readingOrder(List.copyOf(readingOrder))
                .build();

        log.debug("Parsed image publication '{}' with {} pages", title, readingOrder.size());

        return Optional.of(new PublicationBuilder(manifest, fetcher,
                Map.of(PositionsService.NAME, PerResourcePositionsService.factory(IMAGE_SEQUENCE_FALLBACK_TYPE))));
    }

    private List<Link> listLinks(PublicationAsset asset, Fetcher fetcher) {
        try {
            return fetcher.links();
        } catch (IOException e) {
            throw ParseError.FETCHER_FAILURE.createException(e, asset.getName());
        }
    }

    private boolean accepts(PublicationAsset asset, List<Link> links) {
        if (KnownMediaType.CBZ.matches(asset.getMediaType()) || KnownMediaType.CBR.matches(asset.getMediaType())) {
            return true;
        }
        for (Link link : links) {
            String href = link.getHref();
            if (PathUtils.isHiddenOrSystemFile(href) || KnownMediaType.isBitmap(link.getType())) {
                continue;
            }
            if (!ALLOWED_COMPANION_EXTENSIONS.contains(PathUtils.extension(href))) {
                return false;
            }
        }
        return true;
    }
}
