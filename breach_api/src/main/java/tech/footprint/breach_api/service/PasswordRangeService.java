package tech.footprint.breach_api.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientResponseException;
import tech.footprint.breach_api.client.PwnedPasswordsClient;
import tech.footprint.breach_api.model.PasswordCheckResponse;
import tech.footprint.breach_api.model.PasswordRangeEntry;
import tech.footprint.breach_api.model.PasswordSeverity;
import tech.footprint.breach_api.repository.PasswordHashPrefixRepository;

import java.util.List;
import java.util.Locale;

/**
 * k-anonymity password lookups: callers send a 5 character SHA-1 prefix and match the
 * suffix themselves, or send the full digest to {@link #checkHash}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordRangeService {

    private final PasswordHashPrefixRepository passwordHashPrefixRepository;
    private final PwnedPasswordsClient pwnedPasswordsClient;
    private final BreachImportService breachImportService;
    private final ScanLogService scanLogService;

    /**
     * Cached entries for {@code prefix}. On a miss with {@code live} the range is fetched
     * upstream and cached. An upstream HTTP error leaves the answer empty; a timeout propagates.
     */
    public List<PasswordRangeEntry> range(String prefix, boolean live) {
        if (!Hashes.isRangePrefix(prefix)) {
            throw new IllegalArgumentException("Prefix must be exactly 5 hexadecimal characters");
        }
        String upper = prefix.toUpperCase(Locale.ROOT);

        List<PasswordRangeEntry> cached = passwordHashPrefixRepository.findByPrefixOrderBySuffixAsc(upper).stream()
                .map(p -> new PasswordRangeEntry(p.getSuffix(), p.getCount()))
                .toList();
        if (!cached.isEmpty() || !live) {
            return cached;
        }

        log.info("No cached hashes for prefix {}, fetching live range", upper);
        List<PasswordRangeEntry> fetched;
        try {
            fetched = pwnedPasswordsClient.fetchRange(upper);
        } catch (RestClientResponseException e) {
            log.warn("Live range fetch for {} answered {}", upper, e.getStatusCode().value());
            return List.of();
        }
        int written = breachImportService.cacheRange(upper, fetched);
        log.info("Cached {} password hashes for prefix {}", written, upper);
        return fetched;
    }

    public PasswordCheckResponse checkHash(String sha1Hex, boolean live) {
        if (!Hashes.isSha1Hex(sha1Hex)) {
            throw new IllegalArgumentException("hash must be a 40 character SHA-1 hex digest");
        }
        String prefix = Hashes.prefixOf(sha1Hex);
        String suffix = Hashes.suffixOf(sha1Hex);

        long count = range(prefix, live).stream()
                .filter(e -> e.suffix().equals(suffix))
                .mapToLong(PasswordRangeEntry::count)
                .findFirst()
                .orElse(0L);
        boolean found = count > 0;
        scanLogService.recordLookup("password", prefix, found, null);

        return PasswordCheckResponse.builder()
                .found(found)
                .count(count)
                .severity(found ? PasswordSeverity.ofCount(count) : PasswordSeverity.LOW)
                .prefix(prefix)
                .build();
    }
}
