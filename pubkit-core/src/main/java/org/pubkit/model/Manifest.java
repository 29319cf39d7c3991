package org.pubkit.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Canonical, format-agnostic description of a publication. Serializes to a Readium Web Publication Manifest,
 * with each navigation role ({@code toc}, {@code page-list}, {@code landmarks}...) emitted as a top-level key.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"@context", "metadata", "links", "readingOrder", "resources"})
public class Manifest {
    @JsonProperty("@context")
    @Builder.Default
    List<String> context = List.of();
    Metadata metadata;
    @Builder.Default
    List<Link> links = List.of();
    @Builder.Default
    List<Link> readingOrder = List.of();
    @Builder.Default
    List<Link> resources = List.of();
    @JsonIgnore
    @Builder.Default
    Map<String, List<Link>> subcollections = Map.of();

    @JsonAnyGetter
    public Map<String, List<Link>> navigationRoles() {
        return subcollections;
    }

    public Optional<Link> linkWithHref(String href) {
        return Stream.of(readingOrder, resources, links)
                .flatMap(List::stream)
                .filter(link -> link.getHref().equals(href))
                .findFirst();
    }

    @JsonIgnore
    public List<Link> getTableOfContents() {
        return subcollections.getOrDefault("toc", List.of());
    }
}
