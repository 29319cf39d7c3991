package org.pubkit.fetcher;

import org.pubkit.model.Link;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Access to the resources of a publication container, addressed by container-relative href.
 */
public interface Fetcher extends Closeable {

    /**
     * Every resource the container holds, in container order.
     */
    List<Link> links() throws IOException;

    Resource get(Link link);

    default Resource get(String href) {
        return get(Link.of(href));
    }
}
