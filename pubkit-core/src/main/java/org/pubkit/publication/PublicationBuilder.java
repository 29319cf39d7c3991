package org.pubkit.publication;

import lombok.Getter;
import org.pubkit.fetcher.Fetcher;
import org.pubkit.model.Manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a parser hands back: the manifest, the (possibly wrapped) fetcher and the service factories to wire.
 */
@Getter
public class PublicationBuilder {

    private final Manifest manifest;
    private final Fetcher fetcher;
    private final Map<String, ServiceFactory> serviceFactories;

    public PublicationBuilder(Manifest manifest, Fetcher fetcher, Map<String, ServiceFactory> serviceFactories) {
        this.manifest = manifest;
        this.fetcher = fetcher;
        this.serviceFactories = Collections.unmodifiableMap(new LinkedHashMap<>(serviceFactories));
    }

    public Publication build() {
        ServiceContext context = new ServiceContext(manifest, fetcher);
        Map<String, PublicationService> services = new LinkedHashMap<>();
        serviceFactories.forEach((name, factory) -> {
            PublicationService service = factory.create(context);
            if (service != null) {
                services.put(name, service);
            }
        });
        return new Publication(manifest, fetcher, services);
    }
}
