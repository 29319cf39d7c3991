package org.pubkit.parser.epub;

import org.pubkit.fetcher.XmlDocument;
import org.pubkit.model.Link;
import org.pubkit.model.enums.KnownMediaType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The two mutually exclusive ways an EPUB declares its navigation. Exactly one is selected per package,
 * from the package version alone.
 */
public enum NavigationStrategy {

    LEGACY_INDEX {
        @Override
        Optional<PackageDocument.Item> locate(PackageDocument packageDocument) {
            List<PackageDocument.Item> items = packageDocument.getManifest();
            String tocId = packageDocument.getSpine().getToc();
            Optional<PackageDocument.Item> declared = tocId == null
                    ? Optional.empty()
                    : items.stream().filter(item -> tocId.equals(item.getId())).findFirst();
            return declared.or(() -> items.stream()
                    .filter(item -> KnownMediaType.NCX.matches(item.getMediaType()))
                    .findFirst());
        }

        @Override
        Map<String, String> bindings() {
            return EpubNamespaces.NCX_BINDINGS;
        }

        @Override
        Map<String, List<Link>> parse(XmlDocument document, String path) {
            return NcxParser.parse(document, path);
        }
    },

    NAVIGATION_DOCUMENT {
        @Override
        Optional<PackageDocument.Item> locate(PackageDocument packageDocument) {
            return packageDocument.getManifest().stream()
                    .filter(item -> item.getProperties().contains("nav"))
                    .findFirst();
        }

        @Override
        Map<String, String> bindings() {
            return EpubNamespaces.NAVIGATION_BINDINGS;
        }

        @Override
        Map<String, List<Link>> parse(XmlDocument document, String path) {
            return NavigationDocumentParser.parse(document, path);
        }
    };

    private static final double NAVIGATION_DOCUMENT_VERSION = 3.0;

    public static NavigationStrategy forVersion(double packageVersion) {
        return packageVersion < NAVIGATION_DOCUMENT_VERSION ? LEGACY_INDEX : NAVIGATION_DOCUMENT;
    }

    abstract Optional<PackageDocument.Item> locate(PackageDocument packageDocument);

    abstract Map<String, String> bindings();

    abstract Map<String, List<Link>> parse(XmlDocument document, String path);
}
