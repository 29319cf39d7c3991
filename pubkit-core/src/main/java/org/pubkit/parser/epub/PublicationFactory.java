package org.pubkit.parser.epub;

import lombok.Builder;
import org.apache.commons.lang3.StringUtils;
import org.pubkit.model.Encryption;
import org.pubkit.model.Link;
import org.pubkit.model.LinkProperties;
import org.pubkit.model.Manifest;
import org.pubkit.model.Metadata;
import org.pubkit.model.Presentation;
import org.pubkit.model.enums.Layout;
import org.pubkit.model.enums.Profile;
import org.pubkit.model.enums.ReadingProgression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds a package document and the per-concern maps (navigation, encryption, display options) into a manifest.
 */
@Builder
public class PublicationFactory {

    private static final Map<String, String> CONTAINS_PROPERTIES = Map.of(
            "mathml", "mathml",
            "svg", "svg",
            "remote-resources", "remote-resources",
            "scripted", "js",
            "onix-record", "onix",
            "xmp-record", "xmp");

    private final String fallbackTitle;
    private final PackageDocument packageDocument;
    @Builder.Default
    private final Map<String, List<Link>> navigationData = Map.of();
    @Builder.Default
    private final Map<String, Encryption> encryptionData = Map.of();
    @Builder.Default
    private final Map<String, String> displayOptions = Map.of();

    public Manifest create() {
        PackageDocument.PackageMetadata packageMetadata = packageDocument.getMetadata();

        Map<String, PackageDocument.Item> itemsById = new LinkedHashMap<>();
        for (PackageDocument.Item item : packageDocument.getManifest()) {
            itemsById.putIfAbsent(item.getId(), item);
        }

        List<Link> readingOrder = new ArrayList<>();
        Set<String> readingOrderIds = new HashSet<>();
        Map<String, PackageDocument.Itemref> itemrefsById = new LinkedHashMap<>();
        for (PackageDocument.Itemref itemref : packageDocument.getSpine().getItemrefs()) {
            itemrefsById.putIfAbsent(itemref.getIdref(), itemref);
            PackageDocument.Item item = itemsById.get(itemref.getIdref());
            if (item != null && itemref.isLinear() && readingOrderIds.add(item.getId())) {
                readingOrder.add(toLink(item, itemref, itemsById));
            }
        }

        List<Link> resources = new ArrayList<>();
        for (PackageDocument.Item item : itemsById.values()) {
            if (!readingOrderIds.contains(item.getId())) {
                resources.add(toLink(item, itemrefsById.get(item.getId()), itemsById));
            }
        }

        Metadata metadata = Metadata.builder()
                .identifier(packageMetadata.getIdentifier())
                .title(StringUtils.isNotBlank(packageMetadata.getTitle()) ? packageMetadata.getTitle() : fallbackTitle)
                .subtitle(packageMetadata.getSubtitle())
                .languages(packageMetadata.getLanguages())
                .authors(packageMetadata.getCreators())
                .publishers(packageMetadata.getPublishers())
                .description(packageMetadata.getDescription())
                .published(packageMetadata.getDate())
                .modified(packageMetadata.getModified())
                .readingProgression(ReadingProgression.fromPageProgression(packageDocument.getSpine().getPageProgressionDirection()))
                .conformsTo(Set.of(Profile.EPUB))
                .presentation(presentation(packageMetadata))
                .build();

        Map<String, List<Link>> subcollections = new LinkedHashMap<>();
        navigationData.forEach((role, links) -> {
            if (links != null && !links.isEmpty()) {
                subcollections.put(role, List.copyOf(links));
            }
        });

        return Manifest.builder()
                .context(List.of(Profile.WEBPUB_CONTEXT))
                .metadata(metadata)
                .readingOrder(List.copyOf(readingOrder))
                .resources(List.copyOf(resources))
                .subcollections(Collections.unmodifiableMap(subcollections))
                .build();
    }

    private Presentation presentation(PackageDocument.PackageMetadata packageMetadata) {
        Layout layout;
        if ("pre-paginated".equals(packageMetadata.getLayout())) {
            layout = Layout.FIXED;
        } else if ("reflowable".equals(packageMetadata.getLayout())) {
            layout = Layout.REFLOWABLE;
        } else {
            // EPUB 2 fixed layout is only known through vendor display options
            layout = "true".equals(displayOptions.get("fixed-layout")) ? Layout.FIXED : Layout.REFLOWABLE;
        }

        String orientation = packageMetadata.getOrientation();
        if (orientation == null) {
            String lock = displayOptions.get("orientation-lock");
            if ("portrait-only".equals(lock)) {
                orientation = "portrait";
            } else if ("landscape-only".equals(lock)) {
                orientation = "landscape";
            }
        }

        return Presentation.builder()
                .layout(layout)
                .orientation(orientation)
                .spread(packageMetadata.getSpread())
                .build();
    }

    private Link toLink(PackageDocument.Item item, PackageDocument.Itemref itemref, Map<String, PackageDocument.Item> itemsById) {
        Set<String> rels = new LinkedHashSet<>();
        if (item.getProperties().contains("cover-image") || item.getId().equals(packageDocument.getMetadata().getCoverId())) {
            rels.add("cover");
        }
        if (item.getProperties().contains("nav")) {
            rels.add("contents");
        }

        Set<String> contains = new LinkedHashSet<>();
        for (String property : item.getProperties()) {
            String mapped = CONTAINS_PROPERTIES.get(property);
            if (mapped != null) {
                contains.add(mapped);
            }
        }

        String page = null;
        Layout layout = null;
        if (itemref != null) {
            for (String property : itemref.getProperties()) {
                switch (property) {
                    case "page-spread-left", "rendition:page-spread-left" -> page = "left";
                    case "page-spread-right", "rendition:page-spread-right" -> page = "right";
                    case "rendition:page-spread-center", "page-spread-center" -> page = "center";
                    case "rendition:layout-pre-paginated" -> layout = Layout.FIXED;
                    case "rendition:layout-reflowable" -> layout = Layout.REFLOWABLE;
                    default -> {
                    }
                }
            }
        }

        String mediaOverlay = null;
        if (item.getMediaOverlay() != null && itemsById.containsKey(item.getMediaOverlay())) {
            mediaOverlay = itemsById.get(item.getMediaOverlay()).getHref();
        }

        LinkProperties properties = LinkProperties.builder()
                .contains(Set.copyOf(contains))
                .page(page)
                .layout(layout)
                .encrypted(encryptionData.get(item.getHref()))
                .mediaOverlay(mediaOverlay)
                .build();

        return Link.builder()
                .href(item.getHref())
                .type(item.getMediaType())
                .rels(Set.copyOf(rels))
                .properties(properties.isEmpty() ? null : properties)
                .build();
    }
}
