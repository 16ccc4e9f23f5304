package tech.footprint.scan_api.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BreachEntry(
        String name,
        String domain,
        String breachDate,         // yyyy-MM-dd, may be absent
        List<String> dataClasses,
        Long pwnCount
) {}
