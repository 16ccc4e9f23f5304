package tech.footprint.breach_api.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tech.footprint.breach_api.model.BreachEntryView;
import tech.footprint.breach_api.model.EmailCheckResponse;
import tech.footprint.breach_api.repository.BreachSourceRepository;
import tech.footprint.breach_api.repository.BreachedEmailRepository;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class BreachCheckService {

    private final BreachedEmailRepository breachedEmailRepository;
    private final BreachSourceRepository breachSourceRepository;
    private final ScanLogService scanLogService;

    /**
     * Looks the hashed email up in the cache. Database failures propagate so the caller
     * sees the source as unavailable rather than as a clean result.
     */
    @Transactional(readOnly = true)
    public EmailCheckResponse checkEmail(String email, String clientIp) {
        String emailHash = Hashes.hashEmail(email);

        List<BreachEntryView> entries = breachedEmailRepository.findSourcesByEmailHash(emailHash).stream()
                .map(BreachEntryView::of)
                .toList();
        long checkedSources = breachSourceRepository.count();

        log.info("Email check {}...: {} breach(es) across {} sources",
                emailHash.substring(0, 8), entries.size(), checkedSources);
        scanLogService.recordLookup("email", emailHash, !entries.isEmpty(), clientIp);

        return EmailCheckResponse.builder()
                .found(!entries.isEmpty())
                .entries(entries)
                .sourceAvailable(true)
                .checkedSources(checkedSources)
                .build();
    }
}
