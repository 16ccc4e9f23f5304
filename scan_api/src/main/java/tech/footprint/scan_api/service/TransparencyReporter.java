package tech.footprint.scan_api.service;

import org.springframework.stereotype.Component;
import tech.footprint.scan_api.config.ScanProperties;
import tech.footprint.scan_api.model.BreachResult;
import tech.footprint.scan_api.model.CorrelationResult;
import tech.footprint.scan_api.model.DataSource;
import tech.footprint.scan_api.model.DataSourceType;
import tech.footprint.scan_api.model.ImageRiskResult;
import tech.footprint.scan_api.model.InputClassification;
import tech.footprint.scan_api.model.Transparency;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Component
public class TransparencyReporter {

    public static final List<String> FIXED_EXCLUSIONS = List.of(
            "Dark web or hidden services",
            "Private or password-protected databases",
            "Encrypted or access-restricted systems",
            "Social media private messages or posts",
            "Non-public company databases"
    );

    public static final String LEGAL_SCOPE = "This scan analyzes only publicly accessible information. "
            + "No private systems, restricted databases, or confidential data sources were accessed. "
            + "This analysis provides exposure awareness, not forensic proof. "
            + "Results should be verified independently for critical security decisions.";

    static final DataSource SCORING_SOURCE = new DataSource("Risk Scoring Algorithm", DataSourceType.HEURISTIC,
            "Weighted algorithm combining breach severity, platform presence, and exposure indicators");

    private final Clock clock;
    private final ScanProperties.Breach breachSettings;

    public TransparencyReporter(Clock clock, ScanProperties properties) {
        this.clock = clock;
        this.breachSettings = properties.getBreach();
    }

    public Transparency report(InputClassification input, BreachResult breach,
                               CorrelationResult correlation, ImageRiskResult imageRisk) {
        List<String> checked = new ArrayList<>();
        List<String> notChecked = new ArrayList<>();
        List<DataSource> sources = new ArrayList<>();

        checked.add("Input type classification (" + input.type().wireName() + ")");

        if (breach == null) {
            notChecked.add("Data breach databases (not applicable to " + input.type().label() + " input)");
        } else if (breach.apiAvailable()) {
            checked.add("Known data breach databases via " + breachSettings.getSourceName());
            sources.add(new DataSource(breachSettings.getSourceName(), DataSourceType.API,
                    breachSettings.getSourceDescription()));
        } else {
            notChecked.add(breach.limitationNote() != null
                    ? "Data breach databases (" + stripPeriod(breach.limitationNote()) + ")"
                    : "Data breach databases (API key not configured or unavailable)");
        }

        if (correlation != null && !correlation.checkedPlatforms().isEmpty()) {
            checked.add("Username availability on " + correlation.checkedPlatforms().size() + " platforms");
            sources.add(new DataSource("Platform Availability Checks", DataSourceType.PUBLIC_CHECK,
                    "HTTP requests to check if usernames exist on major platforms"));
        }

        if (imageRisk != null) {
            if (imageRisk.analyzed()) {
                checked.add("Image URL accessibility and content type verification");
                if (imageRisk.perceptualHash() != null) {
                    checked.add("Perceptual hash generation (URL-based)");
                }
            } else {
                notChecked.add("Image content analysis (unable to access image)");
            }
        }

        notChecked.addAll(FIXED_EXCLUSIONS);
        sources.add(SCORING_SOURCE);

        return new Transparency(checked, notChecked, sources, LEGAL_SCOPE, Instant.now(clock));
    }

    private static String stripPeriod(String note) {
        return note.endsWith(".") ? note.substring(0, note.length() - 1) : note;
    }
}
