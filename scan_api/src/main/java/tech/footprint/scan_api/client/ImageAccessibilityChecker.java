package tech.footprint.scan_api.client;

import reactor.core.publisher.Mono;

public interface ImageAccessibilityChecker {

    /** HEAD request against the URL. May signal an error on network failure. */
    Mono<ImageHead> headRequest(String url);
}
