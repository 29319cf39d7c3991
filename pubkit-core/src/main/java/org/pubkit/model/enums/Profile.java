package org.pubkit.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Profile {
    EPUB("https://readium.org/webpub-manifest/profiles/epub"),
    DIVINA("https://readium.org/webpub-manifest/profiles/divina");

    public static final String WEBPUB_CONTEXT = "https://readium.org/webpub-manifest/context.jsonld";

    @JsonValue
    private final String uri;
}
