package org.pubkit.parser.epub;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * The parts of an OPF package document the manifest is assembled from. Item hrefs are already resolved
 * against {@link #path}.
 */
@Value
@Builder
public class PackageDocument {

    String path;
    double version;
    PackageMetadata metadata;
    @Builder.Default
    List<Item> manifest = List.of();
    @Builder.Default
    Spine spine = Spine.builder().build();

    @Value
    @Builder
    public static class Item {
        String id;
        String href;
        String mediaType;
        @Builder.Default
        Set<String> properties = Set.of();
        String mediaOverlay;
    }

    @Value
    @Builder
    public static class Spine {
        String toc;
        String pageProgressionDirection;
        @Builder.Default
        List<Itemref> itemrefs = List.of();
    }

    @Value
    @Builder
    public static class Itemref {
        String idref;
        @Builder.Default
        boolean linear = true;
        @Builder.Default
        Set<String> properties = Set.of();
    }

    @Value
    @Builder
    public static class PackageMetadata {
        String identifier;
        String title;
        String subtitle;
        @Builder.Default
        List<String> languages = List.of();
        @Builder.Default
        List<String> creators = List.of();
        @Builder.Default
        List<String> publishers = List.of();
        String description;
        String date;
        String modified;
        String coverId;
        String layout;
        String orientation;
        String spread;
    }
}
