package org.pubkit.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.pubkit.model.enums.Layout;
import org.pubkit.model.enums.Profile;
import org.pubkit.model.enums.ReadingProgression;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ManifestJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void serializesAsWebPublicationManifest() throws Exception {
        Manifest manifest = Manifest.builder()
                .context(List.of(Profile.WEBPUB_CONTEXT))
                .metadata(Metadata.builder()
                        .identifier("urn:isbn:9780000000000")
                        .title("Moby Dick")
                        .readingProgression(ReadingProgression.LTR)
                        .conformsTo(Set.of(Profile.EPUB))
                        .presentation(Presentation.builder().layout(Layout.FIXED).build())
                        .build())
                .readingOrder(List.of(Link.builder()
                        .href("OEBPS/ch1.xhtml")
                        .type("application/xhtml+xml")
                        .rels(Set.of("cover"))
                        .properties(LinkProperties.builder().page("left").build())
                        .build()))
                .subcollections(Map.of("toc", List.of(Link.builder().href("OEBPS/ch1.xhtml").title("Chapter 1").build())))
                .build();

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(manifest));

        assertThat(json.get("@context").get(0).asText()).isEqualTo(Profile.WEBPUB_CONTEXT);
        assertThat(json.at("/metadata/conformsTo/0").asText()).isEqualTo("https://readium.org/webpub-manifest/profiles/epub");
        assertThat(json.at("/metadata/readingProgression").asText()).isEqualTo("ltr");
        assertThat(json.at("/metadata/presentation/layout").asText()).isEqualTo("fixed");
        assertThat(json.at("/readingOrder/0/rel/0").asText()).isEqualTo("cover");
        assertThat(json.at("/readingOrder/0/properties/page").asText()).isEqualTo("left");
        assertThat(json.at("/toc/0/title").asText()).isEqualTo("Chapter 1");
        assertThat(json.has("subcollections")).isFalse();
        assertThat(json.has("tableOfContents")).isFalse();
        assertThat(json.has("resources")).isFalse();
        assertThat(json.at("/readingOrder/0").has("children")).isFalse();
        assertThat(json.at("/readingOrder/0/properties").has("empty")).isFalse();
    }

    @Test
    void linkWithHref_searchesReadingOrderThenResources() {
        Link chapter = Link.of("ch1.xhtml");
        Link font = Link.of("font.otf");
        Manifest manifest = Manifest.builder()
                .readingOrder(List.of(chapter))
                .resources(List.of(font))
                .build();

        assertThat(manifest.linkWithHref("font.otf")).contains(font);
        assertThat(manifest.linkWithHref("ch1.xhtml")).contains(chapter);
        assertThat(manifest.linkWithHref("missing.css")).isEmpty();
    }
}
