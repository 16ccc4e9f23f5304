package tech.footprint.scan_api.support;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.footprint.scan_api.config.ScanProperties;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-window scan budget per client key. Each client owns a token bucket refilled in full once
 * per window; buckets live in a size-bounded cache and expire after a window without requests.
 */
@Slf4j
@Component
public class ScanRateLimiter {

    private final ScanProperties.RateLimit settings;
    private final TimeMeter timeMeter;
    private final Cache<String, Bucket> buckets;

    public ScanRateLimiter(Clock clock, ScanProperties properties) {
        this.settings = properties.getRateLimit();
        this.timeMeter = new ClockTimeMeter(clock);
        this.buckets = Caffeine.newBuilder()
                .maximumSize(settings.getMaxClients())
                .expireAfterAccess(settings.getWindow())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    public Decision tryAcquire(String clientKey) {
        if (!settings.isEnabled()) {
            return new Decision(true, settings.getLimit(), 0);
        }
        ConsumptionProbe outcome = buckets.get(clientKey, key -> newBucket()).tryConsumeAndReturnRemaining(1);
        long retryAfter = TimeUnit.NANOSECONDS.toMillis(outcome.getNanosToWaitForRefill());
        if (!outcome.isConsumed()) {
            log.debug("Scan rate limit reached for {}, retry in {} ms", clientKey, retryAfter);
            return new Decision(false, 0, retryAfter);
        }
        return new Decision(true, (int) outcome.getRemainingTokens(), retryAfter);
    }

    public long trackedClients() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }

    public void reset() {
        buckets.invalidateAll();
        buckets.cleanUp();
    }

    private Bucket newBucket() {
        Bandwidth limit = Bandwidth.classic(settings.getLimit(),
                Refill.intervally(settings.getLimit(), settings.getWindow()));
        return Bucket.builder()
                .addLimit(limit)
                .withCustomTimePrecision(timeMeter)
                .build();
    }

    public record Decision(boolean allowed, int remaining, long retryAfterMillis) {}

    private record ClockTimeMeter(Clock clock) implements TimeMeter {

        @Override
        public long currentTimeNanos() {
            return TimeUnit.MILLISECONDS.toNanos(clock.millis());
        }

        @Override
        public boolean isWallClockBased() {
            return true;
        }
    }
}
