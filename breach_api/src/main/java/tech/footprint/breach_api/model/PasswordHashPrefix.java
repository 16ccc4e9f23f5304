package tech.footprint.breach_api.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * One SHA-1 hash split at the k-anonymity boundary: 5 hex chars of prefix, 35 of suffix.
 */
@Entity
@Table(name = "password_hash_prefixes",
        uniqueConstraints = @UniqueConstraint(name = "uk_password_prefix_suffix",
                columnNames = {"prefix", "suffix"}),
        indexes = @Index(name = "idx_password_prefix", columnList = "prefix"))
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PasswordHashPrefix {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "prefix", length = 5, nullable = false)
    private String prefix;

    @Column(name = "suffix", length = 35, nullable = false)
    private String suffix;

    @Column(name = "seen_count", nullable = false)
    @Builder.Default
    private long count = 1L;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "breach_source_id")
    private BreachSource breachSource;
}
