package tech.footprint.scan_api.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.footprint.scan_api.config.ScanProperties;
import tech.footprint.scan_api.model.BreachSeverity;
import tech.footprint.scan_api.model.BreachSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BreachSeverityPolicyTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-06-01T00:00:00Z"), ZoneOffset.UTC);
    private final BreachSeverityPolicy policy = new BreachSeverityPolicy(clock, new ScanProperties());

    @Test
    @DisplayName("Single old breach without sensitive data is low")
    void singleOldBreachIsLow() {
        assertThat(policy.severityOf(List.of(source("2015-03-01", "Email addresses")))).isEqualTo(BreachSeverity.LOW);
    }

    @Test
    @DisplayName("Recent breach alone is medium")
    void recentIsMedium() {
        assertThat(policy.severityOf(List.of(source("2025-01-15", "Email addresses")))).isEqualTo(BreachSeverity.MEDIUM);
    }

    @Test
    @DisplayName("Two old breaches are medium")
    void twoBreachesAreMedium() {
        assertThat(policy.severityOf(repeat(source("2012-01-01", "Usernames"), 2))).isEqualTo(BreachSeverity.MEDIUM);
    }

    @Test
    @DisplayName("Sensitive category without recency is high")
    void sensitiveIsHigh() {
        assertThat(policy.severityOf(List.of(source("2012-06-05", "Email addresses", "Passwords"))))
                .isEqualTo(BreachSeverity.HIGH);
    }

    @Test
    @DisplayName("Five breaches are high")
    void fiveBreachesAreHigh() {
        assertThat(policy.severityOf(repeat(source("2012-01-01", "Usernames"), 5))).isEqualTo(BreachSeverity.HIGH);
    }

    @Test
    @DisplayName("Sensitive and recent is critical even across different breaches")
    void sensitiveAndRecentIsCritical() {
        List<BreachSource> sources = List.of(
                source("2013-10-04", "passwords"),
                source("2025-11-20", "Email addresses"));

        assertThat(policy.severityOf(sources)).isEqualTo(BreachSeverity.CRITICAL);
    }

    @Test
    @DisplayName("Ten breaches are critical")
    void tenBreachesAreCritical() {
        assertThat(policy.severityOf(repeat(source("2010-01-01", "Usernames"), 10))).isEqualTo(BreachSeverity.CRITICAL);
    }

    @Test
    @DisplayName("Date exactly two years back is not recent")
    void twoYearBoundary() {
        assertThat(policy.isRecent(source("2024-06-01", "Usernames"))).isFalse();
        assertThat(policy.isRecent(source("2024-06-02", "Usernames"))).isTrue();
    }

    @Test
    @DisplayName("Missing or malformed dates are never recent")
    void malformedDates() {
        assertThat(policy.isRecent(source(null, "Usernames"))).isFalse();
        assertThat(policy.isRecent(source("June 2025", "Usernames"))).isFalse();
    }

    @Test
    @DisplayName("Adding breaches never lowers severity")
    void monotonicInCount() {
        for (BreachSource template : List.of(
                source("2012-01-01", "Usernames"),
                source("2025-12-01", "Usernames"),
                source("2012-01-01", "Credit cards"),
                source("2025-12-01", "Bank account numbers"))) {
            BreachSeverity previous = BreachSeverity.LOW;
            for (int count = 1; count <= 12; count++) {
                BreachSeverity current = policy.severityOf(repeat(template, count));
                assertThat(current.atLeast(previous)).as("count %d", count).isTrue();
                previous = current;
            }
        }
    }

    private static BreachSource source(String date, String... dataClasses) {
        return new BreachSource("Example", "example.com", date, List.of(dataClasses), 1000L);
    }

    private static List<BreachSource> repeat(BreachSource source, int count) {
        return new ArrayList<>(Collections.nCopies(count, source));
    }
}
