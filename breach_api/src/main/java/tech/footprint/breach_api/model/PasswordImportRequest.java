package tech.footprint.breach_api.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PasswordImportRequest {
    private String breachName;

    @NotEmpty(message = "hashes must not be empty")
    @Valid
    private List<HashCount> hashes;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HashCount {
        @NotBlank
        @Pattern(regexp = "^[A-Fa-f0-9]{40}$", message = "hash must be a 40 character SHA-1 hex digest")
        private String hash;

        @Positive
        private long count = 1L;
    }
}
