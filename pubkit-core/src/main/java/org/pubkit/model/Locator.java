package org.pubkit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Locator {
    String href;
    String type;
    String title;
    Integer position;
    Double progression;
    Double totalProgression;
}
