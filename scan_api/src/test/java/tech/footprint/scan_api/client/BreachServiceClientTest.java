package tech.footprint.scan_api.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import tech.footprint.scan_api.config.ScanProperties;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class BreachServiceClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @Test
    @DisplayName("2xx body is decoded into a lookup")
    void decodesSuccess() {
        String body = """
                {"found":true,"sourceAvailable":true,"checkedSources":15,
                 "entries":[{"name":"Adobe","domain":"adobe.com","breachDate":"2013-10-04",
                             "dataClasses":["Email addresses","Passwords"],"pwnCount":152445165}]}
                """;
        BreachServiceClient client = client(HttpStatus.OK, body, "secret");

        StepVerifier.create(client.lookupBreaches("a@b.com"))
                .assertNext(lookup -> {
                    assertThat(lookup.sourceAvailable()).isTrue();
                    assertThat(lookup.found()).isTrue();
                    assertThat(lookup.entries()).hasSize(1);
                    assertThat(lookup.entries().get(0).dataClasses()).contains("Passwords");
                })
                .verifyComplete();

        assertThat(lastRequest.get().url().getPath()).isEqualTo("/breach/check-email");
        assertThat(lastRequest.get().headers().getFirst("X-API-Key")).isEqualTo("secret");
    }

    @Test
    @DisplayName("Rejected credential, rate limit and server errors map to failures")
    void mapsStatuses() {
        StepVerifier.create(client(HttpStatus.UNAUTHORIZED, "", "secret").lookupBreaches("a@b.com"))
                .assertNext(lookup -> assertThat(lookup.failure()).isEqualTo(LookupFailure.CREDENTIAL_REJECTED))
                .verifyComplete();
        StepVerifier.create(client(HttpStatus.TOO_MANY_REQUESTS, "", "secret").lookupBreaches("a@b.com"))
                .assertNext(lookup -> assertThat(lookup.failure()).isEqualTo(LookupFailure.RATE_LIMITED))
                .verifyComplete();
        StepVerifier.create(client(HttpStatus.BAD_GATEWAY, "", "secret").lookupBreaches("a@b.com"))
                .assertNext(lookup -> {
                    assertThat(lookup.sourceAvailable()).isFalse();
                    assertThat(lookup.failure()).isEqualTo(LookupFailure.UPSTREAM_UNAVAILABLE);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Network error degrades to a lookup error")
    void networkError() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.error(new IOException("connection refused")))
                .build();
        BreachServiceClient client = new BreachServiceClient(webClient, properties("secret"));

        StepVerifier.create(client.lookupBreaches("a@b.com"))
                .assertNext(lookup -> assertThat(lookup.failure()).isEqualTo(LookupFailure.LOOKUP_ERROR))
                .verifyComplete();
    }

    @Test
    @DisplayName("Slow upstream is cut by the timeout")
    void timeout() {
        ScanProperties properties = properties("secret");
        properties.getBreach().setTimeout(Duration.ofMillis(50));
        WebClient webClient = WebClient.builder().exchangeFunction(request -> Mono.never()).build();
        BreachServiceClient client = new BreachServiceClient(webClient, properties);

        StepVerifier.create(client.lookupBreaches("a@b.com"))
                .assertNext(lookup -> assertThat(lookup.failure()).isEqualTo(LookupFailure.LOOKUP_ERROR))
                .verifyComplete();
    }

    @Test
    @DisplayName("Without a key no request is sent")
    void notConfigured() {
        BreachServiceClient client = client(HttpStatus.OK, "{}", "");

        assertThat(client.isConfigured()).isFalse();
        StepVerifier.create(client.lookupBreaches("a@b.com"))
                .assertNext(lookup -> assertThat(lookup.failure()).isEqualTo(LookupFailure.NOT_CONFIGURED))
                .verifyComplete();
        assertThat(lastRequest.get()).isNull();
    }

    private BreachServiceClient client(HttpStatus status, String body, String apiKey) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://breach.test")
                .defaultHeader("X-API-Key", apiKey)
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new BreachServiceClient(webClient, properties(apiKey));
    }

    private static ScanProperties properties(String apiKey) {
        ScanProperties properties = new ScanProperties();
        properties.getBreach().setApiKey(apiKey);
        return properties;
    }
}
