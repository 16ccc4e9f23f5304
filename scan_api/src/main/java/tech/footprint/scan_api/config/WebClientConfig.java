package tech.footprint.scan_api.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;

@Configuration
public class WebClientConfig {

    private static final String API_KEY_HEADER = "X-API-Key";

    @Bean
    public WebClient breachWebClient(ScanProperties properties) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(properties.getBreach().getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        String apiKey = properties.getBreach().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(API_KEY_HEADER, apiKey);
        }
        return builder.build();
    }

    /** Shared by platform probes and image checks: HEAD requests that follow redirects. */
    @Bean
    public WebClient probeWebClient() {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 4000);
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
