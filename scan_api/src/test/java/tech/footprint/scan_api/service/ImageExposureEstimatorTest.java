package tech.footprint.scan_api.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import tech.footprint.scan_api.client.ImageHead;
import tech.footprint.scan_api.config.ScanProperties;
import tech.footprint.scan_api.model.ImageRiskResult;
import tech.footprint.scan_api.model.RiskLevel;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ImageExposureEstimatorTest {

    private static final String URL = "https://cdn.example.com/me.jpg";

    private final ScanProperties properties = new ScanProperties();

    @Test
    @DisplayName("Reachable image is analyzed with a URL-derived hash and no indicators")
    void analyzesReachableImage() {
        ImageExposureEstimator estimator = new ImageExposureEstimator(
                url -> Mono.just(ImageHead.of(200, "image/jpeg")), properties);

        ImageRiskResult result = estimator.analyze(URL).block();

        assertThat(result.analyzed()).isTrue();
        assertThat(result.perceptualHash()).hasSize(32).matches("[0-9a-f]{32}");
        assertThat(result.perceptualHash()).isEqualTo(ImageExposureEstimator.urlDerivedHash(URL));
        assertThat(result.exposureIndicators()).isEmpty();
        assertThat(result.riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(result.limitationNote()).contains("derived from the URL");
        assertThat(result.disclaimer()).isEqualTo(ImageExposureEstimator.DISCLAIMER);
    }

    @Test
    @DisplayName("Non-2xx status is not analyzed and names the status")
    void rejectsErrorStatus() {
        ImageExposureEstimator estimator = new ImageExposureEstimator(
                url -> Mono.just(ImageHead.of(403, "text/html")), properties);

        ImageRiskResult result = estimator.analyze(URL).block();

        assertThat(result.analyzed()).isFalse();
        assertThat(result.perceptualHash()).isNull();
        assertThat(result.limitationNote()).contains("HTTP 403");
        assertThat(result.disclaimer()).isEqualTo(ImageExposureEstimator.DISCLAIMER);
    }

    @Test
    @DisplayName("Non-image content type is not analyzed")
    void rejectsNonImage() {
        ImageExposureEstimator estimator = new ImageExposureEstimator(
                url -> Mono.just(ImageHead.of(200, "text/html; charset=utf-8")), properties);

        ImageRiskResult result = estimator.analyze(URL).block();

        assertThat(result.analyzed()).isFalse();
        assertThat(result.limitationNote()).contains("content-type: text/html");
    }

    @Test
    @DisplayName("Network errors and timeouts degrade without an exception")
    void degradesOnFailure() {
        ImageExposureEstimator failing = new ImageExposureEstimator(
                url -> Mono.error(new IOException("unknown host")), properties);
        assertThat(failing.analyze(URL).block().limitationNote()).startsWith("Failed to analyze image: unknown host");

        ImageExposureEstimator hanging = new ImageExposureEstimator(url -> Mono.never(), properties);
        StepVerifier.withVirtualTime(() -> hanging.analyze(URL))
                .thenAwait(Duration.ofSeconds(10))
                .assertNext(result -> {
                    assertThat(result.analyzed()).isFalse();
                    assertThat(result.limitationNote()).contains("request timed out");
                    assertThat(result.disclaimer()).isNotBlank();
                })
                .verifyComplete();
    }
}
