package tech.footprint.scan_api.client;

import reactor.core.publisher.Mono;

public interface BreachDataProvider {

    /** False when no credential is configured; callers then skip the lookup entirely. */
    boolean isConfigured();

    /**
     * Looks up breach membership of an already normalized email. Never signals an error:
     * failures arrive as {@link BreachLookup#unavailable(LookupFailure)}.
     */
    Mono<BreachLookup> lookupBreaches(String normalizedEmail);
}
