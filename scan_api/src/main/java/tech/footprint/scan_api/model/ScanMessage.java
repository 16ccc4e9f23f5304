package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope written to the scan stream: either {@code {type:"event"}} or the single
 * terminal {@code {type:"result"}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScanMessage(
        String type,
        ChainEvent event,
        ScanResult result
) {
    public static final String EVENT = "event";
    public static final String RESULT = "result";

    public static ScanMessage event(ChainEvent event) {
        return new ScanMessage(EVENT, event, null);
    }

    public static ScanMessage result(ScanResult result) {
        return new ScanMessage(RESULT, null, result);
    }

    public boolean hasResult() {
        return RESULT.equals(type);
    }
}
