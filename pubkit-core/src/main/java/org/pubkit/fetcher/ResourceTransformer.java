package org.pubkit.fetcher;

@FunctionalInterface
public interface ResourceTransformer {

    Resource transform(Resource resource);
}
