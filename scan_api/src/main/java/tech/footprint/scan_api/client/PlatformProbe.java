package tech.footprint.scan_api.client;

import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

public interface PlatformProbe {

    /**
     * Probes the profile URL obtained by substituting {@code {username}} in the template.
     * The returned Mono may signal an error on network failure; callers bound and recover it.
     */
    Mono<ProbeOutcome> probeProfile(String urlTemplate, String identifier);

    static String profileUrl(String urlTemplate, String identifier) {
        return urlTemplate.replace("{username}", UriUtils.encodePathSegment(identifier, StandardCharsets.UTF_8));
    }
}
