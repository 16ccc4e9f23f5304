package tech.footprint.scan_api.model;

import java.util.List;

public record Verdict(
        int exposureScore,         // 0..100
        RiskLevel riskLevel,
        String summary,
        List<VerdictFactor> factors
) {
    public Verdict {
        if (exposureScore < 0 || exposureScore > 100) {
            throw new IllegalArgumentException("exposureScore out of range: " + exposureScore);
        }
        factors = factors == null ? List.of() : List.copyOf(factors);
    }
}
