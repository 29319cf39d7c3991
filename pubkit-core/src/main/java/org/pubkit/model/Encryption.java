package org.pubkit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * How a single resource was encrypted or obfuscated, as declared in {@code META-INF/encryption.xml}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Encryption {
    String algorithm;
    String compression;
    Long originalLength;
    String profile;
    String scheme;
}
