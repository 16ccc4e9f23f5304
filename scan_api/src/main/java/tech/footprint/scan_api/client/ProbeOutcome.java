package tech.footprint.scan_api.client;

/**
 * Result of one profile probe: either an HTTP status or a failure (network error, timeout).
 */
public record ProbeOutcome(
        String url,
        Integer status,            // null when the probe failed
        String error
) {
    public static ProbeOutcome status(String url, int status) {
        return new ProbeOutcome(url, status, null);
    }

    public static ProbeOutcome failed(String url, String error) {
        return new ProbeOutcome(url, null, error);
    }

    public boolean isFailure() {
        return status == null;
    }
}
