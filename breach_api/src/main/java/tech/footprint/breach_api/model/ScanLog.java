package tech.footprint.breach_api.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "scan_logs")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScanLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "input_type", length = 20, nullable = false)
    private String inputType; // "email" or "password"

    @Column(name = "input_hash_prefix", length = 8)
    private String inputHashPrefix;

    @Column(name = "result_found", nullable = false)
    private boolean resultFound;

    @Column(name = "ip_hash", length = 64)
    private String ipHash;

    @Column(name = "scanned_at", nullable = false, updatable = false)
    private Instant scannedAt;

    @PrePersist
    public void prePersist() {
        if (scannedAt == null) scannedAt = Instant.now();
    }
}
