package tech.footprint.scan_api.model;

public record VerdictFactor(
        String factor,
        Impact impact,
        int weight
) {}
