package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RecommendationCategory {
    @JsonProperty("account_security") ACCOUNT_SECURITY,
    @JsonProperty("privacy") PRIVACY,
    @JsonProperty("platform_action") PLATFORM_ACTION,
    @JsonProperty("monitoring") MONITORING
}
