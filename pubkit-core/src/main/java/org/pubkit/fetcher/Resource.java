package org.pubkit.fetcher;

import org.pubkit.model.Link;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Lazily read content of one publication resource. Failures to locate or read the resource surface from the
 * read methods, never from {@link Fetcher#get(Link)}.
 */
public interface Resource extends Closeable {

    Link getLink();

    long length() throws IOException;

    byte[] read() throws IOException;

    default String readAsString() throws IOException {
        return new String(read(), StandardCharsets.UTF_8);
    }

    default XmlDocument readAsXml(Map<String, String> prefixBindings) throws IOException {
        return XmlDocument.parse(read(), prefixBindings);
    }

    @Override
    default void close() throws IOException {
    }
}
