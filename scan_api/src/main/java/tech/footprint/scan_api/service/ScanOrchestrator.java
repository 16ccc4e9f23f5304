package tech.footprint.scan_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import tech.footprint.scan_api.config.ScanProperties;
import tech.footprint.scan_api.model.BreachResult;
import tech.footprint.scan_api.model.CorrelationResult;
import tech.footprint.scan_api.model.Guidance;
import tech.footprint.scan_api.model.ImageRiskResult;
import tech.footprint.scan_api.model.InputClassification;
import tech.footprint.scan_api.model.InputType;
import tech.footprint.scan_api.model.PlatformMatch;
import tech.footprint.scan_api.model.ScanMessage;
import tech.footprint.scan_api.model.ScanResult;
import tech.footprint.scan_api.model.ScanStage;
import tech.footprint.scan_api.model.Transparency;
import tech.footprint.scan_api.model.Verdict;
import tech.footprint.scan_api.support.ScanMetrics;
import tech.footprint.scan_api.support.ScanOutcome;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Runs one scan as a stream of {@link ScanMessage}s: progress events while the stages run,
 * then exactly one result message, then completion. An invalid input ends the stream after an
 * error event without a result. Cancelling the subscription disposes all in-flight lookups.
 */
@Slf4j
@Service
public class ScanOrchestrator {

    private final InputClassifier classifier;
    private final BreachLookupService breachLookup;
    private final PlatformCorrelator correlator;
    private final ImageExposureEstimator imageEstimator;
    private final VerdictScorer scorer;
    private final GuidanceGenerator guidanceGenerator;
    private final TransparencyReporter transparencyReporter;
    private final ScanMetrics metrics;
    private final ScanProperties properties;
    private final Clock clock;

    public ScanOrchestrator(InputClassifier classifier,
                            BreachLookupService breachLookup,
                            PlatformCorrelator correlator,
                            ImageExposureEstimator imageEstimator,
                            VerdictScorer scorer,
                            GuidanceGenerator guidanceGenerator,
                            TransparencyReporter transparencyReporter,
                            ScanMetrics metrics,
                            ScanProperties properties,
                            Clock clock) {
        this.classifier = classifier;
        this.breachLookup = breachLookup;
        this.correlator = correlator;
        this.imageEstimator = imageEstimator;
        this.scorer = scorer;
        this.guidanceGenerator = guidanceGenerator;
        this.transparencyReporter = transparencyReporter;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    public Flux<ScanMessage> scan(String input) {
        return Flux.create(sink -> {
            String scanId = UUID.randomUUID().toString();
            ScanProgress progress = new ScanProgress(scanId, sink, clock);
            AtomicReference<InputType> type = new AtomicReference<>(InputType.UNKNOWN);
            Instant startedAt = clock.instant();

            Disposable run = execute(scanId, input, progress, type).subscribe(
                    result -> {
                        progress.result(result);
                        metrics.finished(type.get(), ScanOutcome.COMPLETED, elapsedSince(startedAt));
                        log.info("Scan {} complete: score {} ({})", scanId,
                                result.verdict().exposureScore(), result.verdict().riskLevel().wireName());
                    },
                    error -> {
                        log.error("Scan {} failed", scanId, error);
                        progress.systemError("An error occurred", Map.of("error", String.valueOf(error.getMessage())));
                        metrics.finished(type.get(), ScanOutcome.FAILED, elapsedSince(startedAt));
                        sink.complete();
                    },
                    sink::complete);

            sink.onCancel(() -> {
                log.info("Scan {} cancelled by client", scanId);
                metrics.finished(type.get(), ScanOutcome.CANCELLED, elapsedSince(startedAt));
            });
            sink.onDispose(run);
        });
    }

    private Mono<ScanResult> execute(String scanId, String input, ScanProgress progress,
                                     AtomicReference<InputType> typeRef) {
        return Mono.defer(() -> {
            progress.processing(ScanStage.CLASSIFYING, "Classifying input type...");
            InputClassification classification = classifier.classify(input);
            typeRef.set(classification.type());
            metrics.started(classification.type());

            if (!classification.isValid()) {
                log.info("Scan {} aborted: input could not be classified", scanId);
                progress.error(ScanStage.CLASSIFYING, classification.validationMessage());
                metrics.finished(classification.type(), ScanOutcome.ABORTED, Duration.ZERO);
                return Mono.empty();
            }

            InputType type = classification.type();
            log.info("Scan {} started for {} input", scanId, type.wireName());
            progress.complete(ScanStage.CLASSIFYING, "Input classified as " + type.wireName(),
                    details("type", type.wireName(), "confidence", classification.confidence()));

            Mono<Optional<BreachResult>> breach = type == InputType.EMAIL
                    ? checkBreach(classification, progress)
                    : skip(progress, ScanStage.BREACH_CHECKING, "Breach check skipped (requires email)");
            Mono<Optional<CorrelationResult>> correlation = type == InputType.EMAIL || type == InputType.USERNAME
                    ? correlate(classification, progress)
                    : skip(progress, ScanStage.CORRELATING, "Correlation check skipped (requires username)");
            Mono<Optional<ImageRiskResult>> image = type == InputType.IMAGE_URL
                    ? analyzeImage(classification, progress)
                    : skip(progress, ScanStage.IMAGE_ANALYZING, "Image analysis skipped (requires image URL)");

            return Mono.zip(breach, correlation, image)
                    .map(stages -> assemble(scanId, classification,
                            stages.getT1().orElse(null),
                            stages.getT2().orElse(null),
                            stages.getT3().orElse(null),
                            progress));
        });
    }

    private Mono<Optional<BreachResult>> checkBreach(InputClassification classification, ScanProgress progress) {
        return Mono.defer(() -> {
                    progress.processing(ScanStage.BREACH_CHECKING, "Querying breach databases...");
                    return breachLookup.checkBreach(classification.value());
                })
                .doOnNext(result -> progress.complete(ScanStage.BREACH_CHECKING, breachMessage(result),
                        details("found", result.found(), "breachCount", result.breachCount(),
                                "severity", result.severity().name().toLowerCase(), "apiAvailable", result.apiAvailable())))
                .map(Optional::of);
    }

    private Mono<Optional<CorrelationResult>> correlate(InputClassification classification, ScanProgress progress) {
        int panelSize = properties.getCorrelation().panel().size();
        return Mono.defer(() -> {
                    progress.processing(ScanStage.CORRELATING, "Checking username across " + panelSize + " platforms...");
                    AtomicInteger settled = new AtomicInteger();
                    Consumer<PlatformMatch> listener = match -> progress.processing(ScanStage.CORRELATING,
                            "Checked " + settled.incrementAndGet() + "/" + panelSize + " platforms",
                            details("platform", match.platform(), "available", match.available(),
                                    "confidence", match.confidence()));
                    return classification.type() == InputType.EMAIL
                            ? correlator.correlateEmail(classification.value(), listener)
                            : correlator.correlate(classification.value(), listener);
                })
                .doOnNext(result -> progress.complete(ScanStage.CORRELATING, correlationMessage(result),
                        details("checked", result.checkedPlatforms().size(), "found", result.foundCount(),
                                "risk", result.risk().wireName())))
                .map(Optional::of);
    }

    private Mono<Optional<ImageRiskResult>> analyzeImage(InputClassification classification, ScanProgress progress) {
        return Mono.defer(() -> {
                    progress.processing(ScanStage.IMAGE_ANALYZING, "Checking image accessibility...");
                    return imageEstimator.analyze(classification.value());
                })
                .doOnNext(result -> progress.complete(ScanStage.IMAGE_ANALYZING,
                        result.analyzed() ? "Image accessible, no exposure indicators found" : "Image could not be analyzed",
                        details("analyzed", result.analyzed(), "indicators", result.exposureIndicators().size())))
                .map(Optional::of);
    }

    private <T> Mono<Optional<T>> skip(ScanProgress progress, ScanStage stage, String message) {
        return Mono.fromSupplier(() -> {
            progress.skipped(stage, message);
            return Optional.empty();
        });
    }

    private ScanResult assemble(String scanId, InputClassification classification, BreachResult breach,
                                CorrelationResult correlation, ImageRiskResult imageRisk, ScanProgress progress) {
        progress.processing(ScanStage.VERDICT_COMPUTING, "Computing exposure score...");
        Verdict verdict = scorer.score(classification, breach, correlation, imageRisk);
        progress.complete(ScanStage.VERDICT_COMPUTING,
                "Exposure score: " + verdict.exposureScore() + "/100 (" + verdict.riskLevel().wireName() + " risk)",
                details("exposureScore", verdict.exposureScore(), "riskLevel", verdict.riskLevel().wireName()));

        progress.processing(ScanStage.GUIDANCE_GENERATING, "Generating recommendations...");
        Guidance guidance = guidanceGenerator.guide(classification, breach, correlation, imageRisk);
        progress.complete(ScanStage.GUIDANCE_GENERATING,
                guidance.recommendations().size() + " recommendations generated",
                details("count", guidance.recommendations().size()));

        progress.processing(ScanStage.TRANSPARENCY_GENERATING, "Compiling transparency report...");
        Transparency transparency = transparencyReporter.report(classification, breach, correlation, imageRisk);
        progress.complete(ScanStage.TRANSPARENCY_GENERATING, "Transparency report ready",
                details("checked", transparency.whatWasChecked().size(),
                        "notChecked", transparency.whatWasNotChecked().size()));

        return new ScanResult(scanId, classification, breach, correlation, imageRisk,
                verdict, guidance, transparency, clock.instant());
    }

    private static String breachMessage(BreachResult result) {
        if (result.found()) {
            return "Found in " + VerdictScorer.plural(result.breachCount(), "breach", "breaches");
        }
        return result.apiAvailable() ? "No breaches found" : "Breach check unavailable";
    }

    private static String correlationMessage(CorrelationResult result) {
        if (result.checkedPlatforms().isEmpty()) {
            return "Correlation not performed";
        }
        return "Checked " + result.checkedPlatforms().size() + " platforms, found " + result.foundCount() + " matches";
    }

    private Duration elapsedSince(Instant startedAt) {
        return Duration.between(startedAt, clock.instant());
    }

    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> details = new HashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return details;
    }
}
