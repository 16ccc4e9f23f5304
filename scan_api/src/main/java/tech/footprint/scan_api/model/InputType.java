package tech.footprint.scan_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum InputType {
    @JsonProperty("email") EMAIL("email"),
    @JsonProperty("username") USERNAME("username"),
    @JsonProperty("image_url") IMAGE_URL("image URL"),
    @JsonProperty("unknown") UNKNOWN("unknown input");

    private final String label;

    InputType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
