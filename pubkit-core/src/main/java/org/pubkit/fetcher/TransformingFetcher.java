package org.pubkit.fetcher;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.pubkit.model.Link;

import java.io.IOException;
import java.util.List;

/**
 * Passes every resource of the wrapped fetcher through a transformer before handing it out.
 */
@Getter
@RequiredArgsConstructor
public class TransformingFetcher implements Fetcher {

    private final Fetcher base;
    private final ResourceTransformer transformer;

    @Override
    public List<Link> links() throws IOException {
        return base.links();
    }

    @Override
    public Resource get(Link link) {
        return transformer.transform(base.get(link));
    }

    @Override
    public void close() throws IOException {
        base.close();
    }
}
