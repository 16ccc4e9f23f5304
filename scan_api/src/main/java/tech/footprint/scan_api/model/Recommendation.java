package tech.footprint.scan_api.model;

public record Recommendation(
        int priority,              // 1-based, ascending display order
        RecommendationCategory category,
        String title,
        String description,
        Urgency urgency
) {}
