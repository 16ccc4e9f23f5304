package tech.footprint.scan_api.client;

/**
 * Why a breach lookup could not be answered. Each constant carries the note shown to the user.
 */
public enum LookupFailure {
    NOT_CONFIGURED("Breach database credential is not configured, so no breach lookup was performed."),
    CREDENTIAL_REJECTED("The breach database rejected the configured credential."),
    RATE_LIMITED("The breach database is rate limiting requests, try the scan again later."),
    UPSTREAM_UNAVAILABLE("The breach database is currently unavailable."),
    LOOKUP_ERROR("An error occurred while checking the breach database.");

    private final String note;

    LookupFailure(String note) {
        this.note = note;
    }

    public String note() {
        return note;
    }
}
