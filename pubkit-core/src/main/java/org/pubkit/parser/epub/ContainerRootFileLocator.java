package org.pubkit.parser.epub;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.pubkit.exception.ParseError;
import org.pubkit.fetcher.Fetcher;
import org.pubkit.fetcher.XmlDocument;
import org.pubkit.model.enums.KnownMediaType;
import org.w3c.dom.Element;

import java.io.IOException;
import java.util.List;

/**
 * Finds the package document through {@code META-INF/container.xml}, preferring the first rootfile declared
 * as an OPF package.
 */
@Slf4j
public class ContainerRootFileLocator {

    public static final String CONTAINER_PATH = "META-INF/container.xml";

    public String locate(Fetcher fetcher) {
        XmlDocument container;
        try {
            container = fetcher.get(CONTAINER_PATH).readAsXml(EpubNamespaces.CONTAINER_BINDINGS);
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", CONTAINER_PATH, e.getMessage());
            throw ParseError.ROOT_FILE_NOT_FOUND.createException(e, CONTAINER_PATH);
        }

        List<Element> rootfiles = container.selectElements("/cn:container/cn:rootfiles/cn:rootfile");
        return rootfiles.stream()
                .filter(rootfile -> KnownMediaType.OPF.matches(rootfile.getAttribute("media-type")))
                .findFirst()
                .or(() -> rootfiles.stream().findFirst())
                .map(rootfile -> StringUtils.trimToNull(rootfile.getAttribute("full-path")))
                .orElseThrow(() -> ParseError.ROOT_FILE_NOT_FOUND.createException("no rootfile declared in " + CONTAINER_PATH));
    }
}
