package tech.footprint.breach_api.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import tech.footprint.breach_api.model.*;
import tech.footprint.breach_api.repository.BreachSourceRepository;
import tech.footprint.breach_api.repository.BreachedEmailRepository;
import tech.footprint.breach_api.repository.PasswordHashPrefixRepository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Idempotent writes into the cache. Every row is checked before it is inserted and each
 * insert is flushed in its own repository transaction, so a unique-key collision with a
 * concurrent writer only skips that row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BreachImportService {

    public enum Upsert { ADDED, UPDATED, UNCHANGED }

    private final BreachSourceRepository breachSourceRepository;
    private final BreachedEmailRepository breachedEmailRepository;
    private final PasswordHashPrefixRepository passwordHashPrefixRepository;

    public BreachImportResponse importBreach(BreachImportRequest request) {
        boolean created = breachSourceRepository.findByName(request.getName()).isEmpty();
        BreachSource source = upsertSource(request);

        int emailsAdded = 0;
        if (request.getEmails() != null) {
            Set<String> hashes = new LinkedHashSet<>();
            for (String email : request.getEmails()) {
                if (email != null && !email.isBlank()) {
                    hashes.add(Hashes.hashEmail(email));
                }
            }
            for (String hash : hashes) {
                if (addEmailHash(hash, source)) {
                    emailsAdded++;
                }
            }
        }

        log.info("Imported breach {} (created={}), emails added: {}", source.getName(), created, emailsAdded);
        return BreachImportResponse.builder()
                .breachId(source.getId())
                .name(source.getName())
                .created(created)
                .emailsAdded(emailsAdded)
                .build();
    }

    public PasswordImportResponse importPasswords(PasswordImportRequest request) {
        BreachSource source = request.getBreachName() == null ? null
                : breachSourceRepository.findByName(request.getBreachName()).orElse(null);
        if (request.getBreachName() != null && source == null) {
            log.warn("Password import references unknown breach {}, storing without a source", request.getBreachName());
        }

        int added = 0;
        int updated = 0;
        for (PasswordImportRequest.HashCount item : request.getHashes()) {
            Upsert result = upsertPasswordHash(
                    Hashes.prefixOf(item.getHash()), Hashes.suffixOf(item.getHash()), item.getCount(), source);
            if (result == Upsert.ADDED) added++;
            else if (result == Upsert.UPDATED) updated++;
        }

        log.info("Imported password hashes: {} added, {} updated", added, updated);
        return new PasswordImportResponse(added, updated);
    }

    /**
     * Caches a range fetched from the upstream API.
     */
    public int cacheRange(String prefix, Collection<PasswordRangeEntry> entries) {
        int written = 0;
        for (PasswordRangeEntry entry : entries) {
            if (upsertPasswordHash(prefix, entry.suffix(), entry.count(), null) != Upsert.UNCHANGED) {
                written++;
            }
        }
        return written;
    }

    BreachSource upsertSource(BreachImportRequest request) {
        BreachSource entity = breachSourceRepository.findByName(request.getName())
                .orElseGet(BreachSource::new);
        apply(entity, request);
        try {
            return breachSourceRepository.saveAndFlush(entity);
        } catch (DataIntegrityViolationException e) {
            // created concurrently under the same name
            log.debug("Breach {} inserted concurrently, updating instead", request.getName());
            BreachSource existing = breachSourceRepository.findByName(request.getName()).orElseThrow(() -> e);
            apply(existing, request);
            return breachSourceRepository.saveAndFlush(existing);
        }
    }

    boolean addEmailHash(String emailHash, BreachSource source) {
        if (breachedEmailRepository.existsByEmailHashAndBreachSource(emailHash, source)) {
            return false;
        }
        try {
            breachedEmailRepository.saveAndFlush(BreachedEmail.builder()
                    .emailHash(emailHash)
                    .breachSource(source)
                    .build());
            return true;
        } catch (DataIntegrityViolationException e) {
            return false;
        }
    }

    Upsert upsertPasswordHash(String prefix, String suffix, long count, BreachSource source) {
        PasswordHashPrefix existing = passwordHashPrefixRepository.findByPrefixAndSuffix(prefix, suffix).orElse(null);
        if (existing != null) {
            boolean changed = existing.getCount() != count
                    || (source != null && existing.getBreachSource() == null);
            if (!changed) {
                return Upsert.UNCHANGED;
            }
            existing.setCount(count);
            if (existing.getBreachSource() == null) {
                existing.setBreachSource(source);
            }
            passwordHashPrefixRepository.save(existing);
            return Upsert.UPDATED;
        }
        try {
            passwordHashPrefixRepository.saveAndFlush(PasswordHashPrefix.builder()
                    .prefix(prefix)
                    .suffix(suffix)
                    .count(count)
                    .breachSource(source)
                    .build());
            return Upsert.ADDED;
        } catch (DataIntegrityViolationException e) {
            return Upsert.UNCHANGED;
        }
    }

    private static void apply(BreachSource entity, BreachImportRequest request) {
        entity.setName(request.getName());
        entity.setDomain(request.getDomain());
        entity.setBreachDate(request.getBreachDate());
        entity.setDescription(request.getDescription());
        entity.setDataClasses(request.getDataClasses() != null ? new ArrayList<>(request.getDataClasses()) : new ArrayList<>());
        entity.setPwnCount(request.getPwnCount() != null ? request.getPwnCount() : 0L);
        entity.setVerified(request.getVerified() == null || request.getVerified());
        entity.setSensitive(request.getSensitive() != null && request.getSensitive());
    }
}
