package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExposureIndicator(
        String source,
        double matchConfidence,
        String url
) {}
