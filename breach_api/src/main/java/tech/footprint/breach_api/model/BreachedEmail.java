package tech.footprint.breach_api.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Membership of a hashed email in a breach. Raw addresses are never stored.
 */
@Entity
@Table(name = "breached_emails",
        uniqueConstraints = @UniqueConstraint(name = "uk_breached_email_source",
                columnNames = {"email_hash", "breach_source_id"}),
        indexes = @Index(name = "idx_breached_email_hash", columnList = "email_hash"))
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BreachedEmail {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "email_hash", length = 64, nullable = false)
    private String emailHash;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "breach_source_id", nullable = false)
    private BreachSource breachSource;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
