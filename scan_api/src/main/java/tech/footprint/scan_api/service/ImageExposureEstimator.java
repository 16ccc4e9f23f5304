package tech.footprint.scan_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import tech.footprint.scan_api.client.ImageAccessibilityChecker;
import tech.footprint.scan_api.client.ImageHead;
import tech.footprint.scan_api.config.ScanProperties;
import tech.footprint.scan_api.model.ImageRiskResult;
import tech.footprint.scan_api.model.RiskLevel;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Checks that an image URL is reachable and serves an image. No content analysis or reverse
 * search is performed, so exposure indicators are always empty.
 */
@Slf4j
@Service
public class ImageExposureEstimator {

    public static final String DISCLAIMER =
            "This does not confirm misuse. It estimates public exposure risk based on image accessibility analysis.";

    private static final String ANALYZED_NOTE = "Full reverse image search requires a dedicated provider. Without it, "
            + "we can only verify image accessibility. The perceptual hash shown is derived from the URL, "
            + "not the actual image content.";

    private final ImageAccessibilityChecker checker;
    private final Duration timeout;

    public ImageExposureEstimator(ImageAccessibilityChecker checker, ScanProperties properties) {
        this.checker = checker;
        this.timeout = properties.getImage().getTimeout();
    }

    public Mono<ImageRiskResult> analyze(String url) {
        return Mono.defer(() -> checker.headRequest(url))
                .timeout(timeout)
                .map(head -> interpret(url, head))
                .defaultIfEmpty(failed("no response"))
                .onErrorResume(e -> {
                    log.warn("Image check failed: {}", e.toString());
                    return Mono.just(failed(describe(e)));
                });
    }

    ImageRiskResult interpret(String url, ImageHead head) {
        if (!head.reachable()) {
            return failed(head.error() != null ? head.error() : "no response");
        }
        if (head.status() < 200 || head.status() > 299) {
            return notAnalyzed("Unable to access the image (HTTP " + head.status()
                    + "). The URL may be invalid, expired, or access-restricted.");
        }
        String contentType = head.contentType() == null ? "" : head.contentType();
        if (!contentType.toLowerCase(Locale.ROOT).startsWith("image/")) {
            return notAnalyzed("The URL does not appear to point to an image (content-type: "
                    + (contentType.isEmpty() ? "unknown" : contentType) + ").");
        }
        return new ImageRiskResult(true, urlDerivedHash(url), List.of(), RiskLevel.LOW, DISCLAIMER, ANALYZED_NOTE);
    }

    static String urlDerivedHash(String url) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(url.getBytes(StandardCharsets.UTF_8))).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static ImageRiskResult failed(String reason) {
        return notAnalyzed("Failed to analyze image: " + reason
                + ". The URL may be inaccessible or the request timed out.");
    }

    private static ImageRiskResult notAnalyzed(String note) {
        return new ImageRiskResult(false, null, List.of(), RiskLevel.LOW, DISCLAIMER, note);
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "request timed out";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
