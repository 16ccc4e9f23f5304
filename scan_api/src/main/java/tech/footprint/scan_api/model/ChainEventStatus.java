package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ChainEventStatus {
    @JsonProperty("pending") PENDING,
    @JsonProperty("processing") PROCESSING,
    @JsonProperty("complete") COMPLETE,
    @JsonProperty("error") ERROR,
    @JsonProperty("skipped") SKIPPED
}
