package tech.footprint.scan_api.support;

import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import tech.footprint.scan_api.config.ScanProperties;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Set;

/**
 * Picks the address a scan request is rate limited under. Forwarding headers are only honoured
 * when the direct peer is a configured trusted proxy; otherwise the peer address is used.
 */
@Component
public class ClientKeyResolver {

    static final String UNKNOWN = "unknown";

    private final Set<String> trustedProxies;

    public ClientKeyResolver(ScanProperties properties) {
        this.trustedProxies = Set.copyOf(properties.getRateLimit().getTrustedProxies());
    }

    public String resolve(ServerHttpRequest request) {
        String peer = peerAddress(request);
        if (peer == null) {
            return UNKNOWN;
        }
        if (!trustedProxies.contains(peer)) {
            return peer;
        }

        String xForwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            String client = firstUntrustedHop(List.of(xForwardedFor.split(",")));
            if (client != null) {
                return client;
            }
        }

        String xRealIp = request.getHeaders().getFirst("X-Real-IP");
        if (xRealIp != null && !xRealIp.isBlank()) {
            return xRealIp.trim();
        }
        return peer;
    }

    // Walks right to left; hops appended by our own proxies are skipped.
    private String firstUntrustedHop(List<String> hops) {
        String leftmost = null;
        for (int i = hops.size() - 1; i >= 0; i--) {
            String hop = hops.get(i).trim();
            if (hop.isEmpty()) {
                continue;
            }
            if (!trustedProxies.contains(hop)) {
                return hop;
            }
            leftmost = hop;
        }
        return leftmost;
    }

    private static String peerAddress(ServerHttpRequest request) {
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote == null || remote.getAddress() == null) {
            return null;
        }
        return remote.getAddress().getHostAddress();
    }
}
