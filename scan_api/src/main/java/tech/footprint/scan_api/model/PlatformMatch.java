package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Probe verdict for one platform. {@code available=false} means the identifier
 * appears to be taken there.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlatformMatch(
        String platform,
        String url,
        boolean available,
        double confidence
) {
    public boolean profileFound() {
        return !available;
    }
}
