package tech.footprint.scan_api.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import tech.footprint.scan_api.client.BreachDataProvider;
import tech.footprint.scan_api.client.BreachEntry;
import tech.footprint.scan_api.client.BreachLookup;
import tech.footprint.scan_api.client.LookupFailure;
import tech.footprint.scan_api.model.BreachResult;
import tech.footprint.scan_api.model.BreachSource;

import java.util.List;

/**
 * Turns provider answers into a {@link BreachResult}. The returned Mono never errors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BreachLookupService {

    private final BreachDataProvider provider;
    private final BreachSeverityPolicy severityPolicy;

    public Mono<BreachResult> checkBreach(String email) {
        if (!provider.isConfigured()) {
            return Mono.just(BreachResult.unavailable(LookupFailure.NOT_CONFIGURED.note()));
        }
        return Mono.defer(() -> provider.lookupBreaches(email))
                .map(this::toResult)
                .defaultIfEmpty(BreachResult.unavailable(LookupFailure.LOOKUP_ERROR.note()))
                .onErrorResume(e -> {
                    log.warn("Breach lookup failed", e);
                    return Mono.just(BreachResult.unavailable(LookupFailure.LOOKUP_ERROR.note()));
                });
    }

    BreachResult toResult(BreachLookup lookup) {
        if (!lookup.sourceAvailable()) {
            LookupFailure failure = lookup.failure() != null ? lookup.failure() : LookupFailure.UPSTREAM_UNAVAILABLE;
            return BreachResult.unavailable(failure.note());
        }
        if (lookup.entries().isEmpty()) {
            return BreachResult.clean("Email not found in the known breach sources.");
        }
        List<BreachSource> sources = lookup.entries().stream()
                .map(this::toSource)
                .toList();
        return BreachResult.found(sources, severityPolicy.severityOf(sources));
    }

    private BreachSource toSource(BreachEntry entry) {
        return new BreachSource(entry.name(), entry.domain(), entry.breachDate(), entry.dataClasses(), entry.pwnCount());
    }
}
