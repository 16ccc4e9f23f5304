package tech.footprint.scan_api.model;

public record DataSource(
        String name,
        DataSourceType type,
        String description
) {}
