package org.pubkit.publication;

/**
 * Builds a service for an assembled publication, or returns {@code null} when the publication has nothing
 * the service could offer.
 */
@FunctionalInterface
public interface ServiceFactory {

    PublicationService create(ServiceContext context);
}
