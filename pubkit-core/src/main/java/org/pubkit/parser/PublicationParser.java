package org.pubkit.parser;

import org.pubkit.asset.PublicationAsset;
import org.pubkit.fetcher.Fetcher;
import org.pubkit.publication.PublicationBuilder;

import java.util.Optional;

/**
 * Turns the resources of one publication format into a canonical manifest.
 */
public interface PublicationParser {

    /**
     * @return the assembled publication, or empty when the asset is not in this parser's format so the caller
     * can try the next parser
     * @throws org.pubkit.exception.PublicationParseException when the asset claims this format but is unusable
     */
    Optional<PublicationBuilder> parse(PublicationAsset asset, Fetcher fetcher);
}
