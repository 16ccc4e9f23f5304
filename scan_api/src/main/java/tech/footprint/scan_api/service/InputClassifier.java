package tech.footprint.scan_api.service;

import org.springframework.stereotype.Component;
import tech.footprint.scan_api.model.InputClassification;
import tech.footprint.scan_api.model.InputType;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Classifies raw scan input. Rules are tried in a fixed order and the first match wins,
 * so an email is never taken for a username and a URL never for either.
 */
@Component
public class InputClassifier {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern IMAGE_URL = Pattern.compile(
            "^https?://.+\\.(jpg|jpeg|png|gif|webp|svg|bmp)(\\?.*)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern URL = Pattern.compile("^https?://.+", Pattern.CASE_INSENSITIVE);
    private static final Pattern USERNAME = Pattern.compile("^[A-Za-z0-9_.-]{3,30}$");
    private static final Pattern USERNAME_CHARS = Pattern.compile("^[A-Za-z0-9_.-]+$");

    private static final List<String> IMAGE_HINTS = List.of("image", "photo", "avatar", "img");

    public InputClassification classify(String raw) {
        String trimmed = raw == null ? "" : raw.trim();

        if (trimmed.isEmpty()) {
            return InputClassification.invalid(trimmed, "Input is required");
        }
        if (EMAIL.matcher(trimmed).matches()) {
            return InputClassification.valid(InputType.EMAIL, trimmed.toLowerCase(Locale.ROOT), 0.95);
        }
        if (IMAGE_URL.matcher(trimmed).matches()) {
            return InputClassification.valid(InputType.IMAGE_URL, trimmed, 0.9);
        }
        if (URL.matcher(trimmed).matches()) {
            String lower = trimmed.toLowerCase(Locale.ROOT);
            boolean looksLikeImage = IMAGE_HINTS.stream().anyMatch(lower::contains);
            return looksLikeImage
                    ? InputClassification.valid(InputType.IMAGE_URL, trimmed, 0.7)
                    : InputClassification.valid(InputType.IMAGE_URL, trimmed, 0.5,
                            "URL detected, treating as potential image URL");
        }
        if (USERNAME.matcher(trimmed).matches()) {
            return InputClassification.valid(InputType.USERNAME, trimmed, 0.85);
        }
        if (USERNAME_CHARS.matcher(trimmed).matches()) {
            return InputClassification.valid(InputType.USERNAME, trimmed, 0.6, "Treating as username");
        }
        return InputClassification.invalid(trimmed,
                "Unable to classify input. Please enter a valid email, username, or image URL.");
    }
}
