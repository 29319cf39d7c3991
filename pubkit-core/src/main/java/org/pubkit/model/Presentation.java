package org.pubkit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import org.pubkit.model.enums.Layout;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Presentation {
    Layout layout;
    String orientation;
    String spread;
}
