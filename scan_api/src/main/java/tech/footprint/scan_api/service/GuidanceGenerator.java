package tech.footprint.scan_api.service;

import org.springframework.stereotype.Component;
import tech.footprint.scan_api.model.BreachResult;
import tech.footprint.scan_api.model.BreachSeverity;
import tech.footprint.scan_api.model.CorrelationResult;
import tech.footprint.scan_api.model.Guidance;
import tech.footprint.scan_api.model.ImageRiskResult;
import tech.footprint.scan_api.model.InputClassification;
import tech.footprint.scan_api.model.Recommendation;
import tech.footprint.scan_api.model.RecommendationCategory;
import tech.footprint.scan_api.model.Urgency;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the action list. Emission order is display order; priorities start at 1.
 */
@Component
public class GuidanceGenerator {

    static final String PASSWORD_MANAGER_THEME = "password manager";

    public Guidance guide(InputClassification input, BreachResult breach,
                          CorrelationResult correlation, ImageRiskResult imageRisk) {
        Items items = new Items();

        if (breach != null && breach.found()) {
            if (breach.severity().atLeast(BreachSeverity.HIGH)) {
                items.add(RecommendationCategory.ACCOUNT_SECURITY, "Change passwords immediately",
                        "Your credentials may have been exposed in a data breach. Change passwords for all accounts "
                                + "using this email, especially financial and primary email accounts. "
                                + "Use unique, strong passwords for each.",
                        Urgency.IMMEDIATE);
                items.add(RecommendationCategory.ACCOUNT_SECURITY, "Enable two-factor authentication",
                        "Add an extra layer of security by enabling 2FA on all important accounts. "
                                + "Use an authenticator app rather than SMS when possible.",
                        Urgency.IMMEDIATE);
            } else {
                items.add(RecommendationCategory.ACCOUNT_SECURITY, "Review and update passwords",
                        "Your email was found in data breaches. While the severity is lower, you should still "
                                + "update passwords for accounts using this email.",
                        Urgency.SOON);
            }
            items.add(RecommendationCategory.MONITORING, "Monitor for suspicious activity",
                    "Watch for unusual login attempts, password reset emails, or unfamiliar transactions. "
                            + "Set up login notifications where available.",
                    Urgency.SOON);
        }

        if (correlation != null) {
            int found = correlation.foundCount();
            if (found >= 3) {
                items.add(RecommendationCategory.PRIVACY, "Vary usernames across platforms",
                        "Using the same username across many platforms makes it easier to track your online presence. "
                                + "Consider using different usernames for different types of accounts.",
                        Urgency.WHEN_POSSIBLE);
            }
            if (found >= 1) {
                items.add(RecommendationCategory.PRIVACY, "Review privacy settings on found platforms",
                        "Your username was found on " + VerdictScorer.plural(found, "platform", "platforms")
                                + ". Review the privacy settings on these accounts to control what information "
                                + "is publicly visible.",
                        Urgency.SOON);
            }
        }

        if (imageRisk != null && imageRisk.analyzed() && !imageRisk.exposureIndicators().isEmpty()) {
            items.add(RecommendationCategory.PLATFORM_ACTION, "Review image sharing settings",
                    "Your image appears on multiple sites. If any use is unauthorized, you may be able to request "
                            + "removal through the platform's reporting tools.",
                    Urgency.SOON);
        }

        if (items.isEmpty()) {
            items.add(RecommendationCategory.MONITORING, "Stay vigilant",
                    "While no major exposures were found, continue practicing good security hygiene. "
                            + "Use unique passwords, enable 2FA, and be cautious of phishing attempts.",
                    Urgency.WHEN_POSSIBLE);
            items.add(RecommendationCategory.PRIVACY, "Periodic security check-ups",
                    "Run periodic exposure checks to stay informed about your digital footprint. "
                            + "New breaches are discovered regularly.",
                    Urgency.WHEN_POSSIBLE);
        }

        if (!items.hasTitleContaining(PASSWORD_MANAGER_THEME)) {
            items.add(RecommendationCategory.ACCOUNT_SECURITY, "Use a password manager",
                    "A password manager helps you create and store unique, strong passwords for every account, "
                            + "making it easier to maintain good security practices.",
                    Urgency.WHEN_POSSIBLE);
        }

        return new Guidance(items.list);
    }

    private static final class Items {
        private final List<Recommendation> list = new ArrayList<>();

        void add(RecommendationCategory category, String title, String description, Urgency urgency) {
            list.add(new Recommendation(list.size() + 1, category, title, description, urgency));
        }

        boolean isEmpty() {
            return list.isEmpty();
        }

        boolean hasTitleContaining(String theme) {
            return list.stream().anyMatch(r -> r.title().toLowerCase(Locale.ROOT).contains(theme));
        }
    }
}
