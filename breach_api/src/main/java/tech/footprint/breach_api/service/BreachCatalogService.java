package tech.footprint.breach_api.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tech.footprint.breach_api.model.BreachStats;
import tech.footprint.breach_api.model.BreachSummary;
import tech.footprint.breach_api.repository.BreachSourceRepository;
import tech.footprint.breach_api.repository.BreachedEmailRepository;
import tech.footprint.breach_api.repository.PasswordHashPrefixRepository;
import tech.footprint.breach_api.repository.ScanLogRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
public class BreachCatalogService {

    private final BreachSourceRepository breachSourceRepository;
    private final BreachedEmailRepository breachedEmailRepository;
    private final PasswordHashPrefixRepository passwordHashPrefixRepository;
    private final ScanLogRepository scanLogRepository;
    private final Clock clock;

    /** All known breaches, largest first. */
    @Transactional(readOnly = true)
    public List<BreachSummary> listBreaches() {
        return breachSourceRepository.findAllByOrderByPwnCountDesc().stream()
                .map(BreachSummary::of)
                .toList();
    }

    @Transactional(readOnly = true)
    public BreachSummary findBreach(String name) {
        return breachSourceRepository.findByName(name)
                .map(BreachSummary::of)
                .orElseThrow(() -> new BreachNotFoundException(name));
    }

    public BreachStats stats() {
        return BreachStats.builder()
                .totalBreaches(breachSourceRepository.count())
                .totalEmails(breachedEmailRepository.count())
                .totalPasswords(passwordHashPrefixRepository.count())
                .totalScans(scanLogRepository.count())
                .lastUpdated(Instant.now(clock))
                .build();
    }
}
