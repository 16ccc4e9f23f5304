package tech.footprint.scan_api.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.footprint.scan_api.config.ScanProperties;

import java.util.Map;

/**
 * {@link BreachDataProvider} backed by the breach cache service ({@code POST /breach/check-email}).
 */
@Slf4j
@Component
public class BreachServiceClient implements BreachDataProvider {

    private final WebClient webClient;
    private final ScanProperties.Breach settings;

    public BreachServiceClient(@Qualifier("breachWebClient") WebClient breachWebClient,
                               ScanProperties properties) {
        this.webClient = breachWebClient;
        this.settings = properties.getBreach();
    }

    @Override
    public boolean isConfigured() {
        return settings.getApiKey() != null && !settings.getApiKey().isBlank();
    }

    @Override
    public Mono<BreachLookup> lookupBreaches(String normalizedEmail) {
        if (!isConfigured()) {
            return Mono.just(BreachLookup.unavailable(LookupFailure.NOT_CONFIGURED));
        }
        return webClient.post()
                .uri("/breach/check-email")
                .bodyValue(Map.of("email", normalizedEmail))
                .exchangeToMono(resp -> {
                    HttpStatusCode status = resp.statusCode();
                    if (status.is2xxSuccessful()) {
                        return resp.bodyToMono(BreachLookup.class)
                                .defaultIfEmpty(BreachLookup.unavailable(LookupFailure.LOOKUP_ERROR));
                    }
                    LookupFailure failure = classify(status);
                    log.warn("Breach lookup answered {} -> {}", status.value(), failure);
                    return resp.releaseBody().thenReturn(BreachLookup.unavailable(failure));
                })
                .timeout(settings.getTimeout())
                .onErrorResume(e -> {
                    log.warn("Breach lookup error: {}", e.toString());
                    return Mono.just(BreachLookup.unavailable(LookupFailure.LOOKUP_ERROR));
                });
    }

    private LookupFailure classify(HttpStatusCode status) {
        if (status.value() == HttpStatus.UNAUTHORIZED.value() || status.value() == HttpStatus.FORBIDDEN.value()) {
            return LookupFailure.CREDENTIAL_REJECTED;
        }
        if (status.value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return LookupFailure.RATE_LIMITED;
        }
        return LookupFailure.UPSTREAM_UNAVAILABLE;
    }
}
