package tech.footprint.breach_api.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import tech.footprint.breach_api.model.BreachImportRequest;
import tech.footprint.breach_api.repository.BreachSourceRepository;
import tech.footprint.breach_api.service.BreachImportService;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads the catalogue of well-known public breaches (metadata only) into an empty cache.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "breach.seed.enabled", havingValue = "true", matchIfMissing = true)
public class BreachSeeder implements CommandLineRunner {

    static final String SEED_RESOURCE = "seed/breaches.json";

    private final BreachSourceRepository breachSourceRepository;
    private final BreachImportService breachImportService;
    private final ObjectMapper objectMapper;

    @Override
    public void run(String... args) throws IOException {
        long existing = breachSourceRepository.count();
        if (existing > 0) {
            log.info("Breach cache already has {} sources, skipping seed", existing);
            return;
        }

        List<BreachImportRequest> catalogue;
        try (InputStream in = new ClassPathResource(SEED_RESOURCE).getInputStream()) {
            catalogue = objectMapper.readValue(in, new TypeReference<>() {});
        }
        catalogue.forEach(breachImportService::importBreach);
        log.info("Seeded {} breach sources", catalogue.size());
    }
}
