package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DataSourceType {
    @JsonProperty("api") API,
    @JsonProperty("public_check") PUBLIC_CHECK,
    @JsonProperty("heuristic") HEURISTIC
}
