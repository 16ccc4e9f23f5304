package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BreachSource(
        String name,
        String domain,
        String breachDate,         // ISO yyyy-MM-dd
        List<String> dataClasses,
        Long pwnCount
) {
    public BreachSource {
        dataClasses = dataClasses == null ? null : List.copyOf(dataClasses);
    }
}
