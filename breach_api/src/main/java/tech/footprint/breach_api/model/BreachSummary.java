package tech.footprint.breach_api.model;

import lombok.*;

import java.time.LocalDate;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BreachSummary {
    private Long id;
    private String name;
    private String domain;
    private LocalDate breachDate;
    private String description;
    private long pwnCount;
    private List<String> dataClasses;
    private boolean verified;
    private boolean sensitive;

    public static BreachSummary of(BreachSource source) {
        return BreachSummary.builder()
                .id(source.getId())
                .name(source.getName())
                .domain(source.getDomain())
                .breachDate(source.getBreachDate())
                .description(source.getDescription())
                .pwnCount(source.getPwnCount())
                .dataClasses(List.copyOf(source.getDataClasses()))
                .verified(source.isVerified())
                .sensitive(source.isSensitive())
                .build();
    }
}
