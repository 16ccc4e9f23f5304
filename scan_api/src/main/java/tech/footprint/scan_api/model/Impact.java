package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Impact {
    @JsonProperty("positive") POSITIVE,
    @JsonProperty("negative") NEGATIVE,
    @JsonProperty("neutral") NEUTRAL
}
