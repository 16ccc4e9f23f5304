package tech.footprint.scan_api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import tech.footprint.scan_api.model.ScanMessage;
import tech.footprint.scan_api.model.ScanRequest;
import tech.footprint.scan_api.service.ScanOrchestrator;
import tech.footprint.scan_api.support.ClientKeyResolver;
import tech.footprint.scan_api.support.ScanMetrics;
import tech.footprint.scan_api.support.ScanRateLimiter;

@Slf4j
@RestController
@RequestMapping("/api/scan")
public class ScanController {

    private final ScanOrchestrator orchestrator;
    private final ScanRateLimiter rateLimiter;
    private final ScanMetrics metrics;
    private final ClientKeyResolver clientKeys;

    public ScanController(ScanOrchestrator orchestrator, ScanRateLimiter rateLimiter, ScanMetrics metrics,
                          ClientKeyResolver clientKeys) {
        this.orchestrator = orchestrator;
        this.rateLimiter = rateLimiter;
        this.metrics = metrics;
        this.clientKeys = clientKeys;
    }

    @Tag(name = "Scan")
    @Operation(summary = "Scan an email, username or image URL", description = "Streams progress events followed by one result")
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ScanMessage>> scan(@Valid @RequestBody ScanRequest request, ServerHttpRequest httpReq) {
        ScanRateLimiter.Decision decision = rateLimiter.tryAcquire(clientKeys.resolve(httpReq));
        if (!decision.allowed()) {
            throw new ScanRateLimitedException(decision.retryAfterMillis());
        }
        return orchestrator.scan(request.input())
                .map(message -> ServerSentEvent.builder(message).build())
                .doOnCancel(() -> log.info("Scan stream closed by client"));
    }

    @Tag(name = "Metrics")
    @GetMapping(value = "/metrics", produces = MediaType.APPLICATION_JSON_VALUE)
    public ScanMetrics.Snapshot metrics() {
        return metrics.snapshot();
    }
}
