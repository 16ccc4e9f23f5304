package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Progress event of one pipeline stage. Events sharing an {@code id} describe the same
 * step; a later one replaces the earlier one on the client.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChainEvent(
        String id,
        String module,
        String message,
        ChainEventStatus status,
        Instant timestamp,
        Map<String, Object> details
) {}
