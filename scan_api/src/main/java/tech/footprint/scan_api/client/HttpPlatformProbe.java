package tech.footprint.scan_api.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.footprint.scan_api.config.ScanProperties;

import java.net.URI;

@Slf4j
@Component
public class HttpPlatformProbe implements PlatformProbe {

    private final WebClient webClient;
    private final String userAgent;

    public HttpPlatformProbe(@Qualifier("probeWebClient") WebClient probeWebClient, ScanProperties properties) {
        this.webClient = probeWebClient;
        this.userAgent = properties.getCorrelation().getUserAgent();
    }

    @Override
    public Mono<ProbeOutcome> probeProfile(String urlTemplate, String identifier) {
        String url = PlatformProbe.profileUrl(urlTemplate, identifier);
        return webClient.head()
                .uri(URI.create(url))
                .header(HttpHeaders.USER_AGENT, userAgent)
                .exchangeToMono(resp -> resp.releaseBody()
                        .thenReturn(ProbeOutcome.status(url, resp.statusCode().value())))
                .doOnNext(outcome -> log.debug("Probe {} -> {}", url, outcome.status()));
    }
}
