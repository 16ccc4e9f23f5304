package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ordinal breach severity. Declaration order is the ranking, lowest first.
 */
public enum BreachSeverity {
    @JsonProperty("low") LOW(10),
    @JsonProperty("medium") MEDIUM(20),
    @JsonProperty("high") HIGH(35),
    @JsonProperty("critical") CRITICAL(50);

    private final int baseScore;

    BreachSeverity(int baseScore) {
        this.baseScore = baseScore;
    }

    /** Base contribution of this severity to the exposure score. */
    public int baseScore() {
        return baseScore;
    }

    public boolean atLeast(BreachSeverity other) {
        return compareTo(other) >= 0;
    }
}
