package tech.footprint.scan_api.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanModelJsonTest {

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    @DisplayName("Enums use lower-case wire names")
    void enumWireNames() throws Exception {
        Recommendation recommendation = new Recommendation(1, RecommendationCategory.ACCOUNT_SECURITY,
                "Use a password manager", "...", Urgency.WHEN_POSSIBLE);
        InputClassification classification = InputClassification.valid(InputType.IMAGE_URL, "https://x/y.png", 0.9);
        DataSource source = new DataSource("Platform Availability Checks", DataSourceType.PUBLIC_CHECK, "...");

        JsonNode rec = mapper.readTree(mapper.writeValueAsString(recommendation));
        JsonNode cls = mapper.readTree(mapper.writeValueAsString(classification));
        JsonNode src = mapper.readTree(mapper.writeValueAsString(source));

        assertThat(rec.get("category").asText()).isEqualTo("account_security");
        assertThat(rec.get("urgency").asText()).isEqualTo("when_possible");
        assertThat(cls.get("type").asText()).isEqualTo("image_url");
        assertThat(cls.get("isValid").asBoolean()).isTrue();
        assertThat(cls.has("validationMessage")).isFalse();
        assertThat(src.get("type").asText()).isEqualTo("public_check");
    }

    @Test
    @DisplayName("Envelope carries only the populated side")
    void envelope() throws Exception {
        ChainEvent event = new ChainEvent("s:breach", "breach", "Querying breach databases...",
                ChainEventStatus.PROCESSING, Instant.parse("2026-06-01T00:00:00Z"), null);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(ScanMessage.event(event)));

        assertThat(json.get("type").asText()).isEqualTo("event");
        assertThat(json.has("result")).isFalse();
        assertThat(json.get("event").get("timestamp").asText()).isEqualTo("2026-06-01T00:00:00Z");
        assertThat(json.get("event").has("details")).isFalse();
    }

    @Test
    @DisplayName("Correlation result helper values stay out of the JSON")
    void correlationJson() throws Exception {
        CorrelationResult result = new CorrelationResult(
                List.of(new PlatformMatch("GitHub", "https://github.com/jdoe", false, 0.8)),
                RiskLevel.LOW, List.of("GitHub"), null);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        assertThat(json.has("foundCount")).isFalse();
        assertThat(json.get("risk").asText()).isEqualTo("low");
        assertThat(json.get("matches").get(0).has("profileFound")).isFalse();
    }

    @Test
    @DisplayName("Breach result without breaches cannot carry sources")
    void breachInvariant() {
        BreachSource source = new BreachSource("Adobe", "adobe.com", "2013-10-04", List.of("Passwords"), 1L);

        assertThatThrownBy(() -> new BreachResult(false, 1, List.of(), BreachSeverity.LOW, true, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BreachResult(false, 0, List.of(source), BreachSeverity.LOW, true, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(BreachResult.found(List.of(source), BreachSeverity.HIGH).breachCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Correlation matches must belong to checked platforms")
    void correlationInvariant() {
        assertThatThrownBy(() -> new CorrelationResult(
                List.of(new PlatformMatch("Reddit", null, true, 0.7)), RiskLevel.LOW, List.of("GitHub"), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
