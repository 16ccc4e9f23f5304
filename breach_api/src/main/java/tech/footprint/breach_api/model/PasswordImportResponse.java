package tech.footprint.breach_api.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PasswordImportResponse {
    private int passwordsAdded;
    private int passwordsUpdated;
}
