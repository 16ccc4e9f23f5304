package tech.footprint.scan_api.support;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;
import tech.footprint.scan_api.config.ScanProperties;
import tech.footprint.scan_api.model.InputType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Scan counters per input type and outcome, plus completed-scan durations, kept in the Micrometer
 * registry. The duration maximum decays over the configured window.
 */
@Component
public class ScanMetrics {

    static final String STARTED = "scan.started";
    static final String FINISHED = "scan.finished";
    static final String DURATION = "scan.duration";
    private static final int MAX_BUFFERS = 3;

    private final MeterRegistry registry;
    private final Clock clock;
    private final Duration window;

    public ScanMetrics(MeterRegistry registry, Clock clock, ScanProperties properties) {
        this.registry = registry;
        this.clock = clock;
        this.window = properties.getMetrics().getWindow();
    }

    public void started(InputType type) {
        Counter.builder(STARTED)
                .description("Scans accepted by the pipeline")
                .tag("type", type.wireName())
                .register(registry)
                .increment();
    }

    public void finished(InputType type, ScanOutcome outcome, Duration elapsed) {
        Counter.builder(FINISHED)
                .description("Scans that reached a terminal state")
                .tags("type", type.wireName(), "outcome", outcome.wireName())
                .register(registry)
                .increment();
        if (outcome == ScanOutcome.COMPLETED) {
            Timer.builder(DURATION)
                    .description("Wall time of completed scans")
                    .tag("type", type.wireName())
                    .distributionStatisticExpiry(window.dividedBy(MAX_BUFFERS))
                    .distributionStatisticBufferLength(MAX_BUFFERS)
                    .register(registry)
                    .record(elapsed);
        }
    }

    public Snapshot snapshot() {
        Map<String, Long> startedByType = new LinkedHashMap<>();
        Map<String, Map<String, Long>> outcomesByType = new LinkedHashMap<>();
        for (InputType type : InputType.values()) {
            Counter started = registry.find(STARTED).tag("type", type.wireName()).counter();
            if (started != null) {
                startedByType.put(type.wireName(), (long) started.count());
            }
            Map<String, Long> counts = new LinkedHashMap<>();
            for (ScanOutcome outcome : ScanOutcome.values()) {
                Counter finished = registry.find(FINISHED)
                        .tags("type", type.wireName(), "outcome", outcome.wireName())
                        .counter();
                if (finished != null) {
                    counts.put(outcome.wireName(), (long) finished.count());
                }
            }
            if (!counts.isEmpty()) {
                outcomesByType.put(type.wireName(), counts);
            }
        }

        long completed = 0;
        double totalMillis = 0;
        double maxMillis = 0;
        for (Timer timer : registry.find(DURATION).timers()) {
            completed += timer.count();
            totalMillis += timer.totalTime(TimeUnit.MILLISECONDS);
            maxMillis = Math.max(maxMillis, timer.max(TimeUnit.MILLISECONDS));
        }
        long average = completed == 0 ? 0 : Math.round(totalMillis / completed);
        return new Snapshot(startedByType, outcomesByType, completed, average, Math.round(maxMillis),
                window.toString(), clock.instant());
    }

    public void reset() {
        registry.find(STARTED).meters().forEach(registry::remove);
        registry.find(FINISHED).meters().forEach(registry::remove);
        registry.find(DURATION).meters().forEach(registry::remove);
    }

    /**
     * Counts are cumulative since start-up (or the last reset); {@code maxDurationMs} covers
     * roughly the last {@code window}.
     */
    public record Snapshot(
            Map<String, Long> started,
            Map<String, Map<String, Long>> outcomes,
            long completed,
            long averageDurationMs,
            long maxDurationMs,
            String window,
            Instant generatedAt
    ) {}
}
