package tech.footprint.breach_api.model;

import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmailCheckResponse {
    private boolean found;
    private List<BreachEntryView> entries;
    private boolean sourceAvailable;
    private long checkedSources;
}
