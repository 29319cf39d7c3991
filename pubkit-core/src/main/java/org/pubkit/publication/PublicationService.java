package org.pubkit.publication;

/**
 * Marker for capabilities attached to a {@link Publication} at assembly time.
 */
public interface PublicationService {
}
