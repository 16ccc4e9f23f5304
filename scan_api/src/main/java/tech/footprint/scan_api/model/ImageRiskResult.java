package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImageRiskResult(
        boolean analyzed,
        String perceptualHash,
        List<ExposureIndicator> exposureIndicators,
        RiskLevel riskLevel,
        String disclaimer,
        String limitationNote
) {
    public ImageRiskResult {
        exposureIndicators = exposureIndicators == null ? List.of() : List.copyOf(exposureIndicators);
        Objects.requireNonNull(disclaimer, "disclaimer");
    }
}
