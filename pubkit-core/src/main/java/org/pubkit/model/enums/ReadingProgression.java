package org.pubkit.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ReadingProgression {
    AUTO("auto"),
    LTR("ltr"),
    RTL("rtl");

    @JsonValue
    private final String value;

    public static ReadingProgression fromPageProgression(String direction) {
        if ("ltr".equalsIgnoreCase(direction)) {
            return LTR;
        }
        if ("rtl".equalsIgnoreCase(direction)) {
            return RTL;
        }
        return AUTO;
    }
}
