package tech.footprint.scan_api.model;

import java.util.List;

public record Guidance(List<Recommendation> recommendations) {
    public Guidance {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
