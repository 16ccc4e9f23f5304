package tech.footprint.breach_api.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import tech.footprint.breach_api.model.ScanLog;
import tech.footprint.breach_api.repository.ScanLogRepository;

import java.util.concurrent.CompletableFuture;

/**
 * Records that a lookup happened. Only an 8 character prefix of the input hash and a hash
 * of the caller address are kept.
 */
@Service
public class ScanLogService {

    private static final Logger logger = LoggerFactory.getLogger(ScanLogService.class);

    static final int HASH_PREFIX_LENGTH = 8;

    @Autowired
    private ScanLogRepository scanLogRepository;

    @Async("taskExecutor")
    public CompletableFuture<Void> recordLookup(String inputType, String inputHash, boolean found, String clientIp) {
        try {
            ScanLog entry = ScanLog.builder()
                    .inputType(inputType)
                    .inputHashPrefix(truncate(inputHash))
                    .resultFound(found)
                    .ipHash(clientIp != null && !clientIp.isBlank() ? Hashes.sha256(clientIp) : null)
                    .build();
            scanLogRepository.save(entry);
            logger.debug("Scan logged: type={} prefix={} found={}", inputType, entry.getInputHashPrefix(), found);
        } catch (Exception e) {
            logger.error("Error recording {} lookup: {}", inputType, e.getMessage(), e);
        }

        return CompletableFuture.completedFuture(null);
    }

    private static String truncate(String hash) {
        if (hash == null) return null;
        return hash.substring(0, Math.min(HASH_PREFIX_LENGTH, hash.length()));
    }
}
