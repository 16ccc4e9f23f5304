package tech.footprint.breach_api.model;

import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BreachListResponse {
    private int count;
    private List<BreachSummary> breaches;
}
