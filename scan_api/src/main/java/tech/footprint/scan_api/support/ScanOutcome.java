package tech.footprint.scan_api.support;

import java.util.Locale;

public enum ScanOutcome {
    COMPLETED,
    ABORTED,
    FAILED,
    CANCELLED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
