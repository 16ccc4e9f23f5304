package tech.footprint.breach_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PasswordSeverity {
    @JsonProperty("low") LOW,
    @JsonProperty("medium") MEDIUM,
    @JsonProperty("high") HIGH,
    @JsonProperty("critical") CRITICAL;

    /** Severity by how often the password has been seen in breaches. */
    public static PasswordSeverity ofCount(long count) {
        if (count > 10_000) return CRITICAL;
        if (count > 1_000) return HIGH;
        if (count > 100) return MEDIUM;
        return LOW;
    }
}
