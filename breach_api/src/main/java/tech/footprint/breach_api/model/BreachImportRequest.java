package tech.footprint.breach_api.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.time.LocalDate;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BreachImportRequest {
    @NotBlank(message = "name is required")
    @Size(max = 200)
    private String name;

    private String domain;
    private LocalDate breachDate;
    private String description;
    private List<String> dataClasses;

    @PositiveOrZero
    private Long pwnCount;

    private Boolean verified;
    private Boolean sensitive;

    private List<String> emails;
}
