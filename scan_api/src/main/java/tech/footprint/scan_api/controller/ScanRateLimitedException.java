package tech.footprint.scan_api.controller;

public class ScanRateLimitedException extends RuntimeException {

    private final long retryAfterMillis;

    public ScanRateLimitedException(long retryAfterMillis) {
        super("Too many scans, please wait before trying again");
        this.retryAfterMillis = retryAfterMillis;
    }

    public long getRetryAfterMillis() {
        return retryAfterMillis;
    }
}
