package tech.footprint.breach_api.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import tech.footprint.breach_api.model.PasswordRangeEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Client for the public Pwned Passwords range API. Only the 5 character hash prefix
 * leaves this service.
 */
@Component
public class PwnedPasswordsClient {

    private static final Logger logger = LoggerFactory.getLogger(PwnedPasswordsClient.class);

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public PwnedPasswordsClient(RestTemplate restTemplate,
                                @Value("${breach.pwned.url:https://api.pwnedpasswords.com}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    /**
     * Fetches the range for {@code prefix}. Padding entries (count 0) are dropped.
     *
     * @throws org.springframework.web.client.RestClientException when the upstream fails
     */
    public List<PasswordRangeEntry> fetchRange(String prefix) {
        String upper = prefix.toUpperCase(Locale.ROOT);
        HttpHeaders headers = new HttpHeaders();
        headers.add("Add-Padding", "true");

        ResponseEntity<String> response = restTemplate.exchange(
                baseUrl + "/range/{prefix}", HttpMethod.GET, new HttpEntity<>(headers), String.class, upper);

        List<PasswordRangeEntry> entries = parse(response.getBody());
        logger.info("Fetched {} password hashes for prefix {}", entries.size(), upper);
        return entries;
    }

    static List<PasswordRangeEntry> parse(String body) {
        List<PasswordRangeEntry> entries = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return entries;
        }
        for (String line : body.split("\\r?\\n")) {
            int colon = line.indexOf(':');
            if (colon <= 0) continue;
            String suffix = line.substring(0, colon).trim().toUpperCase(Locale.ROOT);
            try {
                long count = Long.parseLong(line.substring(colon + 1).trim());
                if (count > 0) {
                    entries.add(new PasswordRangeEntry(suffix, count));
                }
            } catch (NumberFormatException e) {
                logger.debug("Skipping malformed range line: {}", line);
            }
        }
        return entries;
    }
}
