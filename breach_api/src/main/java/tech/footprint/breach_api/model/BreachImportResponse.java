package tech.footprint.breach_api.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BreachImportResponse {
    private Long breachId;
    private String name;
    private boolean created;
    private int emailsAdded;
}
