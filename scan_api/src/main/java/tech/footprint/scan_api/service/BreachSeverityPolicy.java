package tech.footprint.scan_api.service;

import org.springframework.stereotype.Component;
import tech.footprint.scan_api.config.ScanProperties;
import tech.footprint.scan_api.model.BreachSeverity;
import tech.footprint.scan_api.model.BreachSource;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ranked severity policy. Each tier's condition is checked before the next lower one:
 * critical, high, medium, then low.
 */
@Component
public class BreachSeverityPolicy {

    private final Clock clock;
    private final Set<String> sensitiveClasses;
    private final int recentYears;

    public BreachSeverityPolicy(Clock clock, ScanProperties properties) {
        this.clock = clock;
        this.sensitiveClasses = properties.getBreach().getSensitiveDataClasses().stream()
                .map(c -> c.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.recentYears = properties.getBreach().getRecentYears();
    }

    public BreachSeverity severityOf(List<BreachSource> sources) {
        int count = sources.size();
        boolean sensitive = sources.stream().anyMatch(this::carriesSensitiveData);
        boolean recent = sources.stream().anyMatch(this::isRecent);

        if (count >= 10 || (sensitive && recent)) {
            return BreachSeverity.CRITICAL;
        }
        if (count >= 5 || sensitive) {
            return BreachSeverity.HIGH;
        }
        if (count >= 2 || recent) {
            return BreachSeverity.MEDIUM;
        }
        return BreachSeverity.LOW;
    }

    boolean carriesSensitiveData(BreachSource source) {
        if (source.dataClasses() == null) {
            return false;
        }
        return source.dataClasses().stream()
                .anyMatch(c -> c != null && sensitiveClasses.contains(c.toLowerCase(Locale.ROOT)));
    }

    boolean isRecent(BreachSource source) {
        if (source.breachDate() == null || source.breachDate().isBlank()) {
            return false;
        }
        try {
            LocalDate date = LocalDate.parse(source.breachDate().trim());
            return date.isAfter(LocalDate.now(clock).minusYears(recentYears));
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
