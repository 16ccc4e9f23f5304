package tech.footprint.breach_api.model;

import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BreachStats {
    private long totalBreaches;
    private long totalEmails;
    private long totalPasswords;
    private long totalScans;
    private Instant lastUpdated;
}
