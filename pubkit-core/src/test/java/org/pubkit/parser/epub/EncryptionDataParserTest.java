package org.pubkit.parser.epub;

import org.junit.jupiter.api.Test;
import org.pubkit.fetcher.InMemoryFetcher;
import org.pubkit.model.Encryption;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EncryptionDataParserTest {

    private static final String ENCRYPTION_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <encryption xmlns="urn:oasis:names:tc:opendocument:xmlns:container"
                        xmlns:enc="http://www.w3.org/2001/04/xmlenc#"
                        xmlns:ds="http://www.w3.org/2000/09/xmldsig#"
                        xmlns:comp="http://www.idpf.org/2016/encryption#compression">
              <enc:EncryptedData>
                <enc:EncryptionMethod Algorithm="http://www.idpf.org/2008/embedding"/>
                <enc:CipherData><enc:CipherReference URI="OEBPS/Fonts/serif.otf"/></enc:CipherData>
              </enc:EncryptedData>
              <enc:EncryptedData>
                <enc:EncryptionMethod Algorithm="http://www.w3.org/2001/04/xmlenc#aes256-cbc"/>
                <ds:KeyInfo><ds:RetrievalMethod URI="license.lcpl#/encryption/content_key"/></ds:KeyInfo>
                <enc:CipherData><enc:CipherReference URI="OEBPS/Text/chapter%201.xhtml"/></enc:CipherData>
                <enc:EncryptionProperties>
                  <enc:EncryptionProperty>
                    <comp:Compression Method="8" OriginalLength="13312"/>
                  </enc:EncryptionProperty>
                </enc:EncryptionProperties>
              </enc:EncryptedData>
              <enc:EncryptedData>
                <enc:CipherData><enc:CipherReference URI="OEBPS/no-algorithm.css"/></enc:CipherData>
              </enc:EncryptedData>
            </encryption>
            """;

    private final EncryptionDataParser parser = new EncryptionDataParser();

    @Test
    void parsesEncryptedDataKeyedByHref() {
        InMemoryFetcher fetcher = new InMemoryFetcher().with(EncryptionDataParser.ENCRYPTION_PATH, ENCRYPTION_XML);

        Map<String, Encryption> encryption = parser.parse(fetcher);

        assertThat(encryption).containsOnlyKeys("OEBPS/Fonts/serif.otf", "OEBPS/Text/chapter 1.xhtml");
        assertThat(encryption.get("OEBPS/Fonts/serif.otf").getAlgorithm()).isEqualTo(EpubDeobfuscator.IDPF_ALGORITHM);
        assertThat(encryption.get("OEBPS/Fonts/serif.otf").getScheme()).isNull();

        Encryption lcp = encryption.get("OEBPS/Text/chapter 1.xhtml");
        assertThat(lcp.getScheme()).isEqualTo(EncryptionParser.LCP_SCHEME);
        assertThat(lcp.getCompression()).isEqualTo("deflate");
        assertThat(lcp.getOriginalLength()).isEqualTo(13312L);
    }

    @Test
    void missingDescriptorYieldsEmptyMap() {
        assertThat(parser.parse(new InMemoryFetcher())).isEmpty();
    }

    @Test
    void malformedDescriptorYieldsEmptyMap() {
        InMemoryFetcher fetcher = new InMemoryFetcher().with(EncryptionDataParser.ENCRYPTION_PATH, "<encryption><broken");

        assertThat(parser.parse(fetcher)).isEmpty();
    }
}
