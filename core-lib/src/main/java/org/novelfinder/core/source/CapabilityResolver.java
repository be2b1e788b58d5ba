package org.novelfinder.core.source;

import java.util.Optional;

/**
 * Maps a source reference (a base URL or a hostname) to the capability able to search it.
 * Implementations must be side-effect free lookups.
 */
@FunctionalInterface
public interface CapabilityResolver {

    Optional<SearchCapability> resolve(String sourceReference);
}
