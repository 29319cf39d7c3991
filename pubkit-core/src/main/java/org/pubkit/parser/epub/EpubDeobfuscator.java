package org.pubkit.parser.epub;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.pubkit.fetcher.Fetcher;
import org.pubkit.fetcher.Resource;
import org.pubkit.fetcher.ResourceTransformer;
import org.pubkit.fetcher.TransformingFetcher;
import org.pubkit.model.Encryption;
import org.pubkit.model.Link;
import org.pubkit.model.LinkProperties;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Reverts IDPF and Adobe font obfuscation, keyed by the publication identifier. Resources whose link does not
 * declare one of those algorithms pass through untouched.
 */
@Slf4j
public class EpubDeobfuscator implements ResourceTransformer {

    public static final String IDPF_ALGORITHM = "http://www.idpf.org/2008/embedding";
    public static final String ADOBE_ALGORITHM = "http://ns.adobe.com/pdf/enc#RC";

    private static final int IDPF_OBFUSCATED_LENGTH = 1040;
    private static final int ADOBE_OBFUSCATED_LENGTH = 1024;
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    @Getter
    private final String identifier;

    public EpubDeobfuscator(String identifier) {
        this.identifier = identifier;
    }

    /**
     * Wraps a publication fetcher so obfuscated resources are restored on read. Without an identifier there
     * is no key, so the fetcher is returned as is. Wrapping an already wrapped fetcher with the same identifier
     * is a no-op.
     */
    public static Fetcher wrap(Fetcher fetcher, String identifier) {
        if (StringUtils.isEmpty(identifier)) {
            return fetcher;
        }
        if (fetcher instanceof TransformingFetcher transforming
                && transforming.getTransformer() instanceof EpubDeobfuscator deobfuscator
                && identifier.equals(deobfuscator.getIdentifier())) {
            return fetcher;
        }
        return new TransformingFetcher(fetcher, new EpubDeobfuscator(identifier));
    }

    @Override
    public Resource transform(Resource resource) {
        Encryption encryption = encryptionOf(resource.getLink());
        if (encryption == null) {
            return resource;
        }
        if (IDPF_ALGORITHM.equals(encryption.getAlgorithm())) {
            return new DeobfuscatedResource(resource, idpfKey(), IDPF_OBFUSCATED_LENGTH);
        }
        if (ADOBE_ALGORITHM.equals(encryption.getAlgorithm())) {
            byte[] key = adobeKey();
            if (key == null) {
                log.debug("Identifier '{}' is not a UUID, cannot deobfuscate {}", identifier, resource.getLink().getHref());
                return resource;
            }
            return new DeobfuscatedResource(resource, key, ADOBE_OBFUSCATED_LENGTH);
        }
        return resource;
    }

    private static Encryption encryptionOf(Link link) {
        LinkProperties properties = link.getProperties();
        return properties != null ? properties.getEncrypted() : null;
    }

    byte[] idpfKey() {
        String stripped = WHITESPACE_PATTERN.matcher(identifier).replaceAll("");
        try {
            return MessageDigest.getInstance("SHA-1").digest(stripped.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
    }

    byte[] adobeKey() {
        String hex = identifier.replace("urn:uuid:", "").replace("-", "").trim();
        if (hex.length() != 32) {
            return null;
        }
        try {
            return HexFormat.of().parseHex(hex);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static final class DeobfuscatedResource implements Resource {

        private final Resource resource;
        private final byte[] key;
        private final int obfuscatedLength;

        private DeobfuscatedResource(Resource resource, byte[] key, int obfuscatedLength) {
            this.resource = resource;
            this.key = key;
            this.obfuscatedLength = obfuscatedLength;
        }

        @Override
        public Link getLink() {
            return resource.getLink();
        }

        @Override
        public long length() throws IOException {
            return resource.length();
        }

        @Override
        public byte[] read() throws IOException {
            byte[] content = resource.read();
            int limit = Math.min(content.length, obfuscatedLength);
            for (int i = 0; i < limit; i++) {
                content[i] = (byte) (content[i] ^ key[i % key.length]);
            }
            return content;
        }

        @Override
        public void close() throws IOException {
            resource.close();
        }
    }
}
