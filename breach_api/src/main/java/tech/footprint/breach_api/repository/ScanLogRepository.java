package tech.footprint.breach_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.footprint.breach_api.model.ScanLog;

public interface ScanLogRepository extends JpaRepository<ScanLog, Long> {
}
