package org.pubkit.asset;

import org.pubkit.fetcher.Fetcher;

import java.io.IOException;

/**
 * A publication source as seen before parsing: a name, a declared media type and a way to reach its resources.
 */
public interface PublicationAsset {

    String getName();

    String getMediaType();

    Fetcher createFetcher() throws IOException;
}
