package tech.footprint.scan_api.client;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.footprint.scan_api.config.ScanProperties;

import java.net.URI;

@Component
public class HttpImageHeadClient implements ImageAccessibilityChecker {

    private final WebClient webClient;
    private final String userAgent;

    public HttpImageHeadClient(@Qualifier("probeWebClient") WebClient probeWebClient, ScanProperties properties) {
        this.webClient = probeWebClient;
        this.userAgent = properties.getImage().getUserAgent();
    }

    @Override
    public Mono<ImageHead> headRequest(String url) {
        return Mono.defer(() -> webClient.head()
                .uri(URI.create(url))
                .header(HttpHeaders.USER_AGENT, userAgent)
                .exchangeToMono(resp -> {
                    String contentType = resp.headers().contentType()
                            .map(MediaType::toString)
                            .orElse("");
                    return resp.releaseBody().thenReturn(ImageHead.of(resp.statusCode().value(), contentType));
                }));
    }
}
