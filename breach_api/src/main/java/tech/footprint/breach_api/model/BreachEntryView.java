package tech.footprint.breach_api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BreachEntryView {
    private String name;
    private String domain;
    private String breachDate;    // yyyy-MM-dd
    private List<String> dataClasses;
    private Long pwnCount;

    public static BreachEntryView of(BreachSource source) {
        return BreachEntryView.builder()
                .name(source.getName())
                .domain(source.getDomain())
                .breachDate(source.getBreachDate() != null ? source.getBreachDate().toString() : null)
                .dataClasses(List.copyOf(source.getDataClasses()))
                .pwnCount(source.getPwnCount())
                .build();
    }
}
