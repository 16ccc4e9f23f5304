package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BreachResult(
        boolean found,
        int breachCount,
        List<BreachSource> sources,
        BreachSeverity severity,
        boolean apiAvailable,
        String limitationNote
) {
    public BreachResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
        if (!found && (breachCount != 0 || !sources.isEmpty())) {
            throw new IllegalArgumentException("A result without breaches cannot carry breach sources");
        }
        if (breachCount < 0) {
            throw new IllegalArgumentException("breachCount must not be negative");
        }
    }

    public static BreachResult unavailable(String limitationNote) {
        return new BreachResult(false, 0, List.of(), BreachSeverity.LOW, false, limitationNote);
    }

    public static BreachResult clean(String limitationNote) {
        return new BreachResult(false, 0, List.of(), BreachSeverity.LOW, true, limitationNote);
    }

    public static BreachResult found(List<BreachSource> sources, BreachSeverity severity) {
        return new BreachResult(true, sources.size(), sources, severity, true, null);
    }
}
