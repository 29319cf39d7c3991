package org.pubkit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Link {
    String href;
    @JsonProperty("type")
    String type;
    String title;
    @JsonProperty("rel")
    @Builder.Default
    Set<String> rels = Set.of();
    LinkProperties properties;
    @Builder.Default
    List<Link> children = List.of();

    public static Link of(String href) {
        return Link.builder().href(href).build();
    }

    public Link withRels(Set<String> rels) {
        return toBuilder().rels(Set.copyOf(rels)).build();
    }

    public Link withProperties(LinkProperties properties) {
        return toBuilder().properties(properties).build();
    }
}
