package tech.footprint.scan_api.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the scan pipeline, bound from {@code scan.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "scan", ignoreUnknownFields = false)
@Data
public class ScanProperties {

    private Breach breach = new Breach();
    private Correlation correlation = new Correlation();
    private Image image = new Image();
    private RateLimit rateLimit = new RateLimit();
    private Metrics metrics = new Metrics();

    @Data
    public static class Breach {
        private String baseUrl = "http://localhost:8090";
        /** Empty means no provider credential: lookups are reported unavailable without I/O. */
        private String apiKey = "";
        private Duration timeout = Duration.ofSeconds(5);
        private String sourceName = "Breach Cache";
        private String sourceDescription = "Local cache of publicly disclosed data breaches";
        private List<String> sensitiveDataClasses = new ArrayList<>(List.of(
                "Passwords",
                "Credit cards",
                "Social security numbers",
                "Bank account numbers",
                "Financial data",
                "Passport numbers"
        ));
        private int recentYears = 2;
    }

    @Data
    public static class Correlation {
        private List<Platform> platforms = new ArrayList<>(List.of(
                new Platform("GitHub", "https://github.com/{username}"),
                new Platform("Twitter/X", "https://twitter.com/{username}"),
                new Platform("Instagram", "https://instagram.com/{username}"),
                new Platform("Reddit", "https://reddit.com/user/{username}"),
                new Platform("LinkedIn", "https://linkedin.com/in/{username}"),
                new Platform("Medium", "https://medium.com/@{username}"),
                new Platform("YouTube", "https://youtube.com/@{username}"),
                new Platform("TikTok", "https://tiktok.com/@{username}"),
                new Platform("Pinterest", "https://pinterest.com/{username}"),
                new Platform("Twitch", "https://twitch.tv/{username}")
        ));
        private int panelSize = 6;
        private Duration probeTimeout = Duration.ofSeconds(5);
        private Duration deadline = Duration.ofSeconds(6);
        private String userAgent = "Mozilla/5.0 (compatible; FootprintScanner/1.0)";

        public List<Platform> panel() {
            return platforms.subList(0, Math.min(Math.max(panelSize, 0), platforms.size()));
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Platform {
        private String name;
        private String urlTemplate;
    }

    @Data
    public static class Image {
        private Duration timeout = Duration.ofSeconds(10);
        private String userAgent = "Mozilla/5.0 (compatible; FootprintScanner/1.0)";
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        private int limit = 10;
        private Duration window = Duration.ofMinutes(1);
        private int maxClients = 10_000;
        /** Remote addresses allowed to supply X-Forwarded-For / X-Real-IP; empty trusts no proxy. */
        private List<String> trustedProxies = new ArrayList<>();
    }

    @Data
    public static class Metrics {
        /** Span over which the reported maximum scan duration decays. */
        private Duration window = Duration.ofHours(1);
    }
}
