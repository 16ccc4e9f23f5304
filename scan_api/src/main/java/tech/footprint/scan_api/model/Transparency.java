package tech.footprint.scan_api.model;

import java.time.Instant;
import java.util.List;

public record Transparency(
        List<String> whatWasChecked,
        List<String> whatWasNotChecked,
        List<DataSource> dataSources,
        String legalScope,
        Instant timestamp
) {
    public Transparency {
        whatWasChecked = List.copyOf(whatWasChecked);
        whatWasNotChecked = List.copyOf(whatWasNotChecked);
        dataSources = List.copyOf(dataSources);
    }
}
