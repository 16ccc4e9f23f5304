package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CorrelationResult(
        List<PlatformMatch> matches,
        RiskLevel risk,
        List<String> checkedPlatforms,
        String limitationNote
) {
    public CorrelationResult {
        matches = matches == null ? List.of() : List.copyOf(matches);
        checkedPlatforms = checkedPlatforms == null ? List.of() : List.copyOf(checkedPlatforms);
        for (PlatformMatch match : matches) {
            if (!checkedPlatforms.contains(match.platform())) {
                throw new IllegalArgumentException("Match for unchecked platform: " + match.platform());
            }
        }
    }

    public static CorrelationResult notChecked(String limitationNote) {
        return new CorrelationResult(List.of(), RiskLevel.LOW, List.of(), limitationNote);
    }

    /** Platforms where the identifier appears to exist, regardless of confidence. */
    @JsonIgnore
    public int foundCount() {
        return (int) matches.stream().filter(PlatformMatch::profileFound).count();
    }

    public CorrelationResult withLimitationNote(String note) {
        return new CorrelationResult(matches, risk, checkedPlatforms, note);
    }
}
