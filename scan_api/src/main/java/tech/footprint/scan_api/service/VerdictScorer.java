package tech.footprint.scan_api.service;

import org.springframework.stereotype.Component;
import tech.footprint.scan_api.model.BreachResult;
import tech.footprint.scan_api.model.BreachSeverity;
import tech.footprint.scan_api.model.CorrelationResult;
import tech.footprint.scan_api.model.ImageRiskResult;
import tech.footprint.scan_api.model.Impact;
import tech.footprint.scan_api.model.InputClassification;
import tech.footprint.scan_api.model.InputType;
import tech.footprint.scan_api.model.RiskLevel;
import tech.footprint.scan_api.model.Verdict;
import tech.footprint.scan_api.model.VerdictFactor;

import java.util.ArrayList;
import java.util.List;

/**
 * Weighted exposure score. Every signal that was evaluated adds to the maximum weight; only
 * negative signals add to the score, so clean signals dilute the percentage. A found breach
 * never scores below {@link #BREACH_FLOOR}.
 */
@Component
public class VerdictScorer {

    static final int BREACH_WEIGHT = 50;
    static final int SENSITIVE_WEIGHT = 15;
    static final int CLEAN_BREACH_WEIGHT = 20;
    static final int CORRELATION_WEIGHT = 25;
    static final int UNIQUE_USERNAME_WEIGHT = 10;
    static final int IMAGE_WEIGHT = 30;
    static final int CLEAN_IMAGE_WEIGHT = 10;
    static final int BREACH_FLOOR = 20;

    public Verdict score(InputClassification input, BreachResult breach,
                         CorrelationResult correlation, ImageRiskResult imageRisk) {
        List<VerdictFactor> factors = new ArrayList<>();
        int total = 0;
        int maxWeight = 0;

        if (breach != null) {
            if (breach.found()) {
                int breachScore = breach.severity().baseScore() + Math.min(breach.breachCount() * 2, 20);
                total += breachScore;
                maxWeight += BREACH_WEIGHT;
                factors.add(new VerdictFactor("Found in " + plural(breach.breachCount(), "data breach", "data breaches"),
                        Impact.NEGATIVE, BREACH_WEIGHT));
                if (breach.severity() == BreachSeverity.CRITICAL) {
                    total += SENSITIVE_WEIGHT;
                    maxWeight += SENSITIVE_WEIGHT;
                    factors.add(new VerdictFactor("Contains sensitive data types (passwords, financial info)",
                            Impact.NEGATIVE, SENSITIVE_WEIGHT));
                }
            } else if (breach.apiAvailable()) {
                maxWeight += CLEAN_BREACH_WEIGHT;
                factors.add(new VerdictFactor("No known breaches detected", Impact.POSITIVE, CLEAN_BREACH_WEIGHT));
            }
        }

        if (correlation != null) {
            int found = correlation.foundCount();
            if (found > 0) {
                int correlationScore = Math.min(found * 5, 25);
                total += correlationScore;
                maxWeight += CORRELATION_WEIGHT;
                factors.add(new VerdictFactor("Username found on " + plural(found, "platform", "platforms"),
                        found >= 3 ? Impact.NEGATIVE : Impact.NEUTRAL, correlationScore));
            } else if (!correlation.checkedPlatforms().isEmpty()) {
                maxWeight += UNIQUE_USERNAME_WEIGHT;
                factors.add(new VerdictFactor("Username appears unique across checked platforms",
                        Impact.POSITIVE, UNIQUE_USERNAME_WEIGHT));
            }
        }

        if (imageRisk != null && imageRisk.analyzed()) {
            int indicators = imageRisk.exposureIndicators().size();
            if (indicators > 0) {
                int imageScore = Math.min(indicators * 10, 30);
                total += imageScore;
                maxWeight += IMAGE_WEIGHT;
                factors.add(new VerdictFactor("Image found on " + plural(indicators, "external site", "external sites"),
                        Impact.NEGATIVE, imageScore));
            } else {
                maxWeight += CLEAN_IMAGE_WEIGHT;
                factors.add(new VerdictFactor("No widespread image exposure detected", Impact.POSITIVE, CLEAN_IMAGE_WEIGHT));
            }
        }

        int exposureScore = maxWeight == 0
                ? 0
                : clamp((int) Math.round(100.0 * total / Math.max(maxWeight, 1)));
        if (breach != null && breach.found() && exposureScore < BREACH_FLOOR) {
            exposureScore = BREACH_FLOOR;
        }
        RiskLevel tier = tierOf(exposureScore);
        return new Verdict(exposureScore, tier, summarize(input, breach, correlation, exposureScore, tier, factors), factors);
    }

    public static RiskLevel tierOf(int exposureScore) {
        if (exposureScore >= 60) {
            return RiskLevel.HIGH;
        }
        if (exposureScore >= 30) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private String summarize(InputClassification input, BreachResult breach, CorrelationResult correlation,
                             int score, RiskLevel tier, List<VerdictFactor> factors) {
        if (score == 0 && factors.isEmpty()) {
            return "We couldn't gather enough information about " + subjectOf(input.type())
                    + " to calculate an exposure score. This may be due to unavailable data sources "
                    + "or the input being genuinely unexposed.";
        }

        String label = input.type().label();
        boolean breachFound = breach != null && breach.found();
        StringBuilder summary = new StringBuilder();
        switch (tier) {
            case HIGH -> {
                summary.append("This ").append(label).append(" shows significant public exposure. ");
                if (breachFound) {
                    summary.append("It appears in ")
                            .append(plural(breach.breachCount(), "known data breach", "known data breaches"))
                            .append(", which means credentials or personal information may have been compromised. ");
                }
                if (correlation != null && correlation.foundCount() > 0) {
                    summary.append("The associated username appears on multiple platforms, ")
                            .append("which could enable account correlation. ");
                }
                summary.append("We recommend taking immediate action to secure associated accounts.");
            }
            case MEDIUM -> {
                summary.append("This ").append(label).append(" has moderate public exposure. ");
                if (breachFound) {
                    summary.append("It was found in ")
                            .append(plural(breach.breachCount(), "data breach", "data breaches"))
                            .append(". ");
                }
                if (correlation != null && correlation.foundCount() > 0) {
                    summary.append("The associated username appears on multiple platforms, ")
                            .append("which could enable account correlation. ");
                }
                summary.append("Consider reviewing your security settings and enabling additional protections.");
            }
            default -> {
                summary.append("This ").append(label).append(" shows minimal public exposure based on our analysis. ");
                if (breachFound) {
                    summary.append("It was found in ")
                            .append(plural(breach.breachCount(), "data breach", "data breaches"))
                            .append(" of lower severity. ");
                } else if (breach != null && breach.apiAvailable()) {
                    summary.append("No known breaches were detected. ");
                }
                summary.append("Continue practicing good security hygiene to maintain this status.");
            }
        }
        return summary.toString();
    }

    private static String subjectOf(InputType type) {
        return switch (type) {
            case EMAIL -> "this email";
            case USERNAME -> "this username";
            case IMAGE_URL -> "this image";
            default -> "this input";
        };
    }

    private static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }

    static String plural(int count, String singular, String pluralForm) {
        return count + " " + (count == 1 ? singular : pluralForm);
    }
}
