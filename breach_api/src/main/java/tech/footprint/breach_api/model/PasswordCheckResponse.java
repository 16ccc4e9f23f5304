package tech.footprint.breach_api.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PasswordCheckResponse {
    private boolean found;
    private long count;
    private PasswordSeverity severity;
    private String prefix;
}
