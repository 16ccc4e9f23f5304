package tech.footprint.scan_api.support;

import io.micrometer.core.instrument.MockClock;
import io.micrometer.core.instrument.simple.SimpleConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.footprint.scan_api.config.ScanProperties;
import tech.footprint.scan_api.model.InputType;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ScanMetricsTest {

    private final MockClock meterClock = new MockClock();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry(SimpleConfig.DEFAULT, meterClock);
    private final MutableClock clock = new MutableClock(Instant.parse("2026-06-01T00:00:00Z"));
    private final ScanMetrics metrics = new ScanMetrics(registry, clock, new ScanProperties());

    @Test
    @DisplayName("Counters are kept per input type and outcome")
    void countsPerType() {
        metrics.started(InputType.EMAIL);
        metrics.started(InputType.EMAIL);
        metrics.started(InputType.USERNAME);
        metrics.finished(InputType.EMAIL, ScanOutcome.COMPLETED, Duration.ofMillis(300));
        metrics.finished(InputType.EMAIL, ScanOutcome.CANCELLED, Duration.ofMillis(50));
        metrics.finished(InputType.USERNAME, ScanOutcome.COMPLETED, Duration.ofMillis(100));

        ScanMetrics.Snapshot snapshot = metrics.snapshot();

        assertThat(snapshot.started()).containsEntry("email", 2L).containsEntry("username", 1L);
        assertThat(snapshot.outcomes().get("email")).containsEntry("completed", 1L).containsEntry("cancelled", 1L);
        assertThat(snapshot.completed()).isEqualTo(2);
        assertThat(snapshot.averageDurationMs()).isEqualTo(200);
        assertThat(snapshot.maxDurationMs()).isEqualTo(300);
        assertThat(snapshot.generatedAt()).isEqualTo(Instant.parse("2026-06-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Meters are registered under scan.* with type and outcome tags")
    void registersMeters() {
        metrics.started(InputType.IMAGE_URL);
        metrics.finished(InputType.IMAGE_URL, ScanOutcome.FAILED, Duration.ofMillis(10));

        assertThat(registry.get("scan.started").tag("type", "image_url").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("scan.finished").tags("type", "image_url", "outcome", "failed").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("scan.duration").timer()).isNull();
    }

    @Test
    @DisplayName("Maximum duration decays once the window has passed")
    void maxDecaysAfterWindow() {
        metrics.finished(InputType.EMAIL, ScanOutcome.COMPLETED, Duration.ofMillis(500));
        meterClock.add(Duration.ofMinutes(61));
        metrics.finished(InputType.EMAIL, ScanOutcome.COMPLETED, Duration.ofMillis(100));

        ScanMetrics.Snapshot snapshot = metrics.snapshot();

        assertThat(snapshot.maxDurationMs()).isEqualTo(100);
        assertThat(snapshot.completed()).isEqualTo(2);
        assertThat(snapshot.outcomes().get("email")).containsEntry("completed", 2L);
    }

    @Test
    @DisplayName("Reset removes the scan meters")
    void reset() {
        metrics.started(InputType.IMAGE_URL);
        metrics.finished(InputType.IMAGE_URL, ScanOutcome.COMPLETED, Duration.ofMillis(20));
        metrics.reset();

        ScanMetrics.Snapshot snapshot = metrics.snapshot();
        assertThat(snapshot.started()).isEmpty();
        assertThat(snapshot.completed()).isZero();
        assertThat(registry.find("scan.started").counter()).isNull();
    }
}
