package org.pubkit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import org.pubkit.model.enums.Layout;

import java.util.Set;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class LinkProperties {
    @Builder.Default
    Set<String> contains = Set.of();
    String page;
    Layout layout;
    Encryption encrypted;
    String mediaOverlay;

    @JsonIgnore
    public boolean isEmpty() {
        return contains.isEmpty() && page == null && layout == null && encrypted == null && mediaOverlay == null;
    }
}
