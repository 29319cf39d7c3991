package org.pubkit.parser.epub;

import org.pubkit.fetcher.Fetcher;
import org.pubkit.model.Encryption;

import java.util.Map;

/**
 * Encryption is optional metadata: without a readable descriptor the publication simply has no encrypted
 * resources.
 */
public class EncryptionDataParser {

    public static final String ENCRYPTION_PATH = "META-INF/encryption.xml";

    public Map<String, Encryption> parse(Fetcher fetcher) {
        return XmlResources.readOptional(fetcher, ENCRYPTION_PATH, EpubNamespaces.ENCRYPTION_BINDINGS)
                .map(EncryptionParser::parse)
                .orElseGet(Map::of);
    }
}
