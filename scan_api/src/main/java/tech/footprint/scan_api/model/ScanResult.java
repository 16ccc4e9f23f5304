package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScanResult(
        String id,
        InputClassification input,
        BreachResult breach,
        CorrelationResult correlation,
        ImageRiskResult imageRisk,
        Verdict verdict,
        Guidance guidance,
        Transparency transparency,
        Instant completedAt
) {}
