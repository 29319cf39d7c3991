package org.pubkit.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Layout {
    REFLOWABLE("reflowable"),
    FIXED("fixed");

    @JsonValue
    private final String value;
}
