package org.pubkit.publication.services;

import org.pubkit.fetcher.Resource;
import org.pubkit.model.Link;

import java.io.IOException;
import java.util.List;

/**
 * Extracts textual content from the reading order resources of the media types it supports.
 */
public interface ResourceContentExtractor {

    boolean supports(Link link);

    List<ContentElement> extract(Resource resource) throws IOException;
}
