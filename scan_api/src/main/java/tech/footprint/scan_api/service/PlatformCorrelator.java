package tech.footprint.scan_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import tech.footprint.scan_api.client.PlatformProbe;
import tech.footprint.scan_api.client.ProbeOutcome;
import tech.footprint.scan_api.config.ScanProperties;
import tech.footprint.scan_api.model.CorrelationResult;
import tech.footprint.scan_api.model.PlatformMatch;
import tech.footprint.scan_api.model.RiskLevel;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Probes a bounded panel of platforms for a username. Probes run concurrently, each bounded by
 * the probe timeout; the whole fan-in is bounded by the deadline. A platform without an answer
 * at that point gets the failure default instead of holding up the scan.
 */
@Slf4j
@Service
public class PlatformCorrelator {

    static final double FOUND_CONFIDENCE = 0.8;
    static final double NOT_FOUND_CONFIDENCE = 0.7;
    static final double UNCERTAIN_CONFIDENCE = 0.3;
    static final double FAILED_CONFIDENCE = 0.2;
    static final double RISK_CONFIDENCE_THRESHOLD = 0.5;

    private static final Pattern LOCAL_PART = Pattern.compile("^[A-Za-z0-9._-]{3,}$");
    private static final String PROBE_NOTE = "Platform checks use basic HTTP requests. Some platforms may block "
            + "automated access, leading to false negatives. Results should be verified manually for critical decisions.";

    private final PlatformProbe probe;
    private final ScanProperties.Correlation settings;

    public PlatformCorrelator(PlatformProbe probe, ScanProperties properties) {
        this.probe = probe;
        this.settings = properties.getCorrelation();
    }

    public Mono<CorrelationResult> correlate(String identifier) {
        return correlate(identifier, match -> { });
    }

    /**
     * @param listener called once per platform as its probe settles, in completion order
     */
    public Mono<CorrelationResult> correlate(String identifier, Consumer<PlatformMatch> listener) {
        List<ScanProperties.Platform> panel = settings.panel();
        List<String> checked = panel.stream().map(ScanProperties.Platform::getName).toList();

        return Flux.fromIterable(panel)
                .flatMap(platform -> probeOne(platform, identifier), Math.max(1, panel.size()))
                .doOnNext(listener)
                .take(settings.getDeadline())
                .collectMap(PlatformMatch::platform)
                .map(settled -> {
                    List<PlatformMatch> matches = panel.stream()
                            .map(p -> settled.getOrDefault(p.getName(), failed(p)))
                            .toList();
                    if (settled.size() < panel.size()) {
                        log.info("Correlation deadline reached with {}/{} probes settled", settled.size(), panel.size());
                    }
                    return new CorrelationResult(matches, riskOf(matches), checked, PROBE_NOTE);
                });
    }

    public Mono<CorrelationResult> correlateEmail(String email, Consumer<PlatformMatch> listener) {
        int at = email.indexOf('@');
        if (at < 0) {
            return Mono.just(CorrelationResult.notChecked("Invalid email format for username extraction."));
        }
        String username = email.substring(0, at);
        if (!LOCAL_PART.matcher(username).matches()) {
            return Mono.just(CorrelationResult.notChecked(
                    "Email username part is too short or contains invalid characters for platform correlation."));
        }
        return correlate(username, listener)
                .map(result -> result.withLimitationNote(
                        "Checked username \"" + username + "\" extracted from email. " + result.limitationNote()));
    }

    public static RiskLevel riskOf(List<PlatformMatch> matches) {
        long confident = matches.stream()
                .filter(m -> !m.available() && m.confidence() >= RISK_CONFIDENCE_THRESHOLD)
                .count();
        if (confident >= 4) {
            return RiskLevel.HIGH;
        }
        if (confident >= 2) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private Mono<PlatformMatch> probeOne(ScanProperties.Platform platform, String identifier) {
        return Mono.defer(() -> probe.probeProfile(platform.getUrlTemplate(), identifier))
                .timeout(settings.getProbeTimeout())
                .map(outcome -> interpret(platform, outcome))
                .defaultIfEmpty(failed(platform))
                .onErrorResume(e -> {
                    log.debug("Probe {} failed: {}", platform.getName(), e.toString());
                    return Mono.just(failed(platform));
                });
    }

    static PlatformMatch interpret(ScanProperties.Platform platform, ProbeOutcome outcome) {
        if (outcome.isFailure()) {
            return failed(platform);
        }
        return switch (outcome.status()) {
            case 200 -> new PlatformMatch(platform.getName(), outcome.url(), false, FOUND_CONFIDENCE);
            case 404 -> new PlatformMatch(platform.getName(), null, true, NOT_FOUND_CONFIDENCE);
            default -> new PlatformMatch(platform.getName(), null, true, UNCERTAIN_CONFIDENCE);
        };
    }

    private static PlatformMatch failed(ScanProperties.Platform platform) {
        return new PlatformMatch(platform.getName(), null, true, FAILED_CONFIDENCE);
    }
}
