package org.pubkit.parser.epub;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.pubkit.fetcher.XmlDocument;
import org.pubkit.model.Encryption;
import org.pubkit.util.HrefUtils;
import org.w3c.dom.Element;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads {@code META-INF/encryption.xml} into encryption records keyed by container-relative href.
 */
@Slf4j
@UtilityClass
public class EncryptionParser {

    public static final String LCP_SCHEME = "http://readium.org/2014/01/lcp";
    static final String LCP_CONTENT_KEY_URI = "license.lcpl#/encryption/content_key";

    public static Map<String, Encryption> parse(XmlDocument document) {
        Map<String, Encryption> encryptions = new LinkedHashMap<>();
        for (Element encryptedData : document.selectElements("//enc:EncryptedData")) {
            String algorithm = document.selectElement(encryptedData, "enc:EncryptionMethod")
                    .map(method -> StringUtils.trimToNull(method.getAttribute("Algorithm")))
                    .orElse(null);
            String uri = document.selectElement(encryptedData, "enc:CipherData/enc:CipherReference")
                    .map(reference -> StringUtils.trimToNull(reference.getAttribute("URI")))
                    .orElse(null);
            if (algorithm == null || uri == null) {
                log.debug("Skipping incomplete EncryptedData entry (algorithm={}, uri={})", algorithm, uri);
                continue;
            }

            Encryption.EncryptionBuilder encryption = Encryption.builder().algorithm(algorithm);

            document.selectElement(encryptedData, "ds:KeyInfo/ds:RetrievalMethod")
                    .map(retrieval -> retrieval.getAttribute("URI"))
                    .filter(LCP_CONTENT_KEY_URI::equals)
                    .ifPresent(retrieval -> encryption.scheme(LCP_SCHEME));

            document.selectElement(encryptedData, "enc:EncryptionProperties/enc:EncryptionProperty/comp:Compression")
                    .ifPresent(compression -> {
                        compressionMethod(compression.getAttribute("Method")).ifPresent(encryption::compression);
                        originalLength(compression.getAttribute("OriginalLength")).ifPresent(encryption::originalLength);
                    });

            encryptions.put(HrefUtils.resolve("", uri), encryption.build());
        }
        return Collections.unmodifiableMap(encryptions);
    }

    private static Optional<String> compressionMethod(String method) {
        return switch (StringUtils.trimToEmpty(method)) {
            case "8" -> Optional.of("deflate");
            case "0" -> Optional.of("none");
            default -> Optional.empty();
        };
    }

    private static Optional<Long> originalLength(String value) {
        try {
            return StringUtils.isBlank(value) ? Optional.empty() : Optional.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring invalid OriginalLength '{}'", value);
            return Optional.empty();
        }
    }
}
