package org.pubkit.parser.epub;

import lombok.extern.slf4j.Slf4j;
import org.pubkit.asset.PublicationAsset;
import org.pubkit.config.ParserProperties;
import org.pubkit.exception.ParseError;
import org.pubkit.fetcher.Fetcher;
import org.pubkit.fetcher.XmlDocument;
import org.pubkit.model.Link;
import org.pubkit.model.Manifest;
import org.pubkit.model.enums.KnownMediaType;
import org.pubkit.parser.PublicationParser;
import org.pubkit.publication.PublicationBuilder;
import org.pubkit.publication.ServiceFactory;
import org.pubkit.publication.services.ContentService;
import org.pubkit.publication.services.EpubPositionsService;
import org.pubkit.publication.services.HtmlContentExtractor;
import org.pubkit.publication.services.MediaOverlayService;
import org.pubkit.publication.services.PositionsService;
import org.pubkit.publication.services.ResourceContentExtractor;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class EpubParser implements PublicationParser {

    private final ContainerRootFileLocator rootFileLocator;
    private final NavigationDataResolver navigationDataResolver;
    private final EncryptionDataParser encryptionDataParser;
    private final DisplayOptionsResolver displayOptionsResolver;
    private final ParserProperties properties;

    public EpubParser() {
        this(new ParserProperties());
    }

    public EpubParser(ParserProperties properties) {
        this(new ContainerRootFileLocator(), new NavigationDataResolver(), new EncryptionDataParser(),
                new DisplayOptionsResolver(), properties);
    }

    public EpubParser(ContainerRootFileLocator rootFileLocator,
                      NavigationDataResolver navigationDataResolver,
                      EncryptionDataParser encryptionDataParser,
                      DisplayOptionsResolver displayOptionsResolver,
                      ParserProperties properties) {
        this.rootFileLocator = rootFileLocator;
        this.navigationDataResolver = navigationDataResolver;
        this.encryptionDataParser = encryptionDataParser;
        this.displayOptionsResolver = displayOptionsResolver;
        this.properties = properties;
    }

    @Override
    public Optional<PublicationBuilder> parse(PublicationAsset asset, Fetcher fetcher) {
        if (!KnownMediaType.EPUB.matches(asset.getMediaType())) {
            return Optional.empty();
        }

        String packagePath = rootFileLocator.locate(fetcher);
        PackageDocument packageDocument = readPackageDocument(fetcher, packagePath);

        Manifest manifest = PublicationFactory.builder()
                .fallbackTitle(asset.getName())
                .packageDocument(packageDocument)
                .navigationData(navigationDataResolver.resolve(packageDocument, fetcher))
                .encryptionData(encryptionDataParser.parse(fetcher))
                .displayOptions(displayOptionsResolver.resolve(fetcher))
                .build()
                .create();

        Fetcher publicationFetcher = EpubDeobfuscator.wrap(fetcher, manifest.getMetadata().getIdentifier());

        log.debug("Parsed EPUB {} '{}': {} reading order items, navigation roles {}",
                packageDocument.getVersion(), manifest.getMetadata().getTitle(),
                manifest.getReadingOrder().size(), manifest.getSubcollections().keySet());

        return Optional.of(new PublicationBuilder(manifest, publicationFetcher, serviceFactories()));
    }

    private PackageDocument readPackageDocument(Fetcher fetcher, String packagePath) {
        try {
            XmlDocument document = fetcher.get(Link.builder().href(packagePath).type(KnownMediaType.OPF.getMimeType()).build())
                    .readAsXml(EpubNamespaces.PACKAGE_BINDINGS);
            return PackageDocumentParser.parse(document, packagePath);
        } catch (IOException e) {
            log.warn("Invalid package document {}: {}", packagePath, e.getMessage());
            throw ParseError.INVALID_PACKAGE_DOCUMENT.createException(e, packagePath);
        }
    }

    private Map<String, ServiceFactory> serviceFactories() {
        List<ResourceContentExtractor> extractors = properties.getContent().isHtmlEnabled()
                ? List.of(new HtmlContentExtractor())
                : List.of();

        Map<String, ServiceFactory> factories = new LinkedHashMap<>();
        factories.put(PositionsService.NAME, EpubPositionsService.factory(properties.getPositions().getPageLength()));
        factories.put(ContentService.NAME, ContentService.factory(extractors));
        factories.put(MediaOverlayService.NAME, MediaOverlayService.factory());
        return factories;
    }
}
