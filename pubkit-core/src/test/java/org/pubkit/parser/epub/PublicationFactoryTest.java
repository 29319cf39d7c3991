package org.pubkit.parser.epub;

import org.junit.jupiter.api.Test;
import org.pubkit.fetcher.XmlDocument;
import org.pubkit.model.Encryption;
import org.pubkit.model.Link;
import org.pubkit.model.Manifest;
import org.pubkit.model.enums.Layout;
import org.pubkit.model.enums.Profile;
import org.pubkit.model.enums.ReadingProgression;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PublicationFactoryTest {

    @Test
    void assemblesEpub3Manifest() throws IOException {
        Encryption fontEncryption = Encryption.builder().algorithm(EpubDeobfuscator.IDPF_ALGORITHM).build();

        Manifest manifest = PublicationFactory.builder()
                .fallbackTitle("file-name")
                .packageDocument(packageDocument(EpubFixtures.OPF_EPUB3, "content.opf"))
                .navigationData(Map.of("toc", List.of(Link.builder().href("page1.xhtml").title("Page One").build())))
                .encryptionData(Map.of("fonts/sans.otf", fontEncryption))
                .build()
                .create();

        assertThat(manifest.getContext()).containsExactly(Profile.WEBPUB_CONTEXT);
        assertThat(manifest.getMetadata().getTitle()).isEqualTo("The Modern Book");
        assertThat(manifest.getMetadata().getSubtitle()).isEqualTo("A Subtitle");
        assertThat(manifest.getMetadata().getConformsTo()).containsExactly(Profile.EPUB);
        assertThat(manifest.getMetadata().getReadingProgression()).isEqualTo(ReadingProgression.RTL);
        assertThat(manifest.getMetadata().getPresentation().getLayout()).isEqualTo(Layout.FIXED);
        assertThat(manifest.getMetadata().getPresentation().getSpread()).isEqualTo("landscape");

        assertThat(manifest.getReadingOrder()).extracting(Link::getHref).containsExactly("page1.xhtml", "page2.xhtml");
        Link first = manifest.getReadingOrder().get(0);
        assertThat(first.getProperties().getContains()).containsExactlyInAnyOrder("svg", "js");
        assertThat(first.getProperties().getPage()).isEqualTo("right");
        assertThat(first.getProperties().getMediaOverlay()).isEqualTo("page1.smil");
        Link second = manifest.getReadingOrder().get(1);
        assertThat(second.getProperties().getPage()).isEqualTo("left");
        assertThat(second.getProperties().getLayout()).isEqualTo(Layout.REFLOWABLE);

        assertThat(manifest.getResources()).extracting(Link::getHref)
                .containsExactly("nav.xhtml", "toc.ncx", "images/cover.png", "page1.smil", "fonts/sans.otf");
        assertThat(manifest.linkWithHref("nav.xhtml").orElseThrow().getRels()).containsExactly("contents");
        assertThat(manifest.linkWithHref("images/cover.png").orElseThrow().getRels()).containsExactly("cover");
        assertThat(manifest.linkWithHref("fonts/sans.otf").orElseThrow().getProperties().getEncrypted()).isEqualTo(fontEncryption);
        assertThat(manifest.linkWithHref("toc.ncx").orElseThrow().getProperties()).isNull();

        assertThat(manifest.getTableOfContents()).extracting(Link::getTitle).containsExactly("Page One");
    }

    @Test
    void nonLinearSpineItemsGoToResources() throws IOException {
        Manifest manifest = PublicationFactory.builder()
                .fallbackTitle("file-name")
                .packageDocument(packageDocument(EpubFixtures.OPF_EPUB2, "OEBPS/content.opf"))
                .build()
                .create();

        assertThat(manifest.getReadingOrder()).extracting(Link::getHref)
                .containsExactly("OEBPS/Text/chapter1.xhtml", "OEBPS/Text/chapter2.xhtml");
        assertThat(manifest.getResources()).extracting(Link::getHref).contains("OEBPS/Text/notes.xhtml");
        assertThat(manifest.linkWithHref("OEBPS/Images/cover.jpg").orElseThrow().getRels()).containsExactly("cover");
        assertThat(manifest.getMetadata().getReadingProgression()).isEqualTo(ReadingProgression.AUTO);
        assertThat(manifest.getSubcollections()).isEmpty();
    }

    @Test
    void epub2FixedLayoutComesFromDisplayOptions() throws IOException {
        Manifest manifest = PublicationFactory.builder()
                .fallbackTitle("file-name")
                .packageDocument(packageDocument(EpubFixtures.OPF_EPUB2, "OEBPS/content.opf"))
                .displayOptions(Map.of("fixed-layout", "true", "orientation-lock", "portrait-only"))
                .build()
                .create();

        assertThat(manifest.getMetadata().getPresentation().getLayout()).isEqualTo(Layout.FIXED);
        assertThat(manifest.getMetadata().getPresentation().getOrientation()).isEqualTo("portrait");
    }

    @Test
    void fallbackTitleWhenPackageHasNone() throws IOException {
        String opf = """
                <package xmlns="http://www.idpf.org/2007/opf" version="3.0">
                  <metadata/>
                  <manifest><item id="c" href="c.xhtml" media-type="application/xhtml+xml"/></manifest>
                  <spine><itemref idref="c"/></spine>
                </package>
                """;

        Manifest manifest = PublicationFactory.builder()
                .fallbackTitle("my-book")
                .packageDocument(packageDocument(opf, "content.opf"))
                .build()
                .create();

        assertThat(manifest.getMetadata().getTitle()).isEqualTo("my-book");
        assertThat(manifest.getMetadata().getPresentation().getLayout()).isEqualTo(Layout.REFLOWABLE);
    }

    private static PackageDocument packageDocument(String opf, String path) throws IOException {
        XmlDocument document = XmlDocument.parse(opf.getBytes(StandardCharsets.UTF_8), EpubNamespaces.PACKAGE_BINDINGS);
        return PackageDocumentParser.parse(document, path);
    }
}
