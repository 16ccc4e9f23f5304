package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Urgency {
    @JsonProperty("immediate") IMMEDIATE,
    @JsonProperty("soon") SOON,
    @JsonProperty("when_possible") WHEN_POSSIBLE
}
