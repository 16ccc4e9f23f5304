package tech.footprint.breach_api.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "breach_sources")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BreachSource {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", length = 200, nullable = false, unique = true)
    private String name;

    @Column(name = "domain", length = 255)
    private String domain;

    @Column(name = "breach_date")
    private LocalDate breachDate;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Convert(converter = StringListConverter.class)
    @Column(name = "data_classes", columnDefinition = "text")
    @Builder.Default
    private List<String> dataClasses = new ArrayList<>();

    @Column(name = "pwn_count", nullable = false)
    @Builder.Default
    private long pwnCount = 0L;

    @Column(name = "is_verified", nullable = false)
    @Builder.Default
    private boolean verified = true;

    @Column(name = "is_sensitive", nullable = false)
    @Builder.Default
    private boolean sensitive = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }
}
