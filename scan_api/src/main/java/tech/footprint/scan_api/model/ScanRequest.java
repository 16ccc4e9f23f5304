package tech.footprint.scan_api.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ScanRequest(
        @NotBlank(message = "Input is required")
        @Size(max = 2048, message = "Input is too long")
        String input
) {}
