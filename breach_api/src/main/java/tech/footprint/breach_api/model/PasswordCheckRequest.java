package tech.footprint.breach_api.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.*;

/**
 * Only the SHA-1 hex digest of a password is accepted, never the password itself.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PasswordCheckRequest {
    @NotBlank(message = "hash is required")
    @Pattern(regexp = "^[A-Fa-f0-9]{40}$", message = "hash must be a 40 character SHA-1 hex digest")
    private String hash;

    private boolean live;
}
