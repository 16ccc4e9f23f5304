package tech.footprint.scan_api.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Answer of a {@link BreachDataProvider}. When {@code sourceAvailable} is false the
 * {@code failure} says why and {@code entries} is empty.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BreachLookup(
        boolean found,
        List<BreachEntry> entries,
        boolean sourceAvailable,
        LookupFailure failure
) {
    public BreachLookup {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static BreachLookup unavailable(LookupFailure failure) {
        return new BreachLookup(false, List.of(), false, failure);
    }

    public static BreachLookup of(List<BreachEntry> entries) {
        return new BreachLookup(!entries.isEmpty(), entries, true, null);
    }
}
