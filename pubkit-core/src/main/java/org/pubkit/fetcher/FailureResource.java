package org.pubkit.fetcher;

import lombok.RequiredArgsConstructor;
import org.pubkit.model.Link;

import java.io.IOException;

@RequiredArgsConstructor
public class FailureResource implements Resource {

    private final Link link;
    private final IOException error;

    @Override
    public Link getLink() {
        return link;
    }

    @Override
    public long length() throws IOException {
        throw error;
    }

    @Override
    public byte[] read() throws IOException {
        throw error;
    }
}
