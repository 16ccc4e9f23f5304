package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InputClassification(
        InputType type,
        String value,
        double confidence,         // 0..1
        @JsonProperty("isValid")
        boolean isValid,
        String validationMessage
) {
    public static InputClassification valid(InputType type, String value, double confidence) {
        return new InputClassification(type, value, confidence, true, null);
    }

    public static InputClassification valid(InputType type, String value, double confidence, String message) {
        return new InputClassification(type, value, confidence, true, message);
    }

    public static InputClassification invalid(String value, String message) {
        return new InputClassification(InputType.UNKNOWN, value, 0, false, message);
    }
}
