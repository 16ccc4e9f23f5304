package tech.footprint.breach_api;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Requires {@code X-API-Key} on every {@code /breach/**} call once {@code breach.api.key} is set.
 * With no key configured the service is open, which suits local development only.
 */
@Component
@Order(1)
public class ApiKeyFilter implements Filter {

    private static final Logger logger = LoggerFactory.getLogger(ApiKeyFilter.class);

    static final String HEADER = "X-API-Key";
    private static final String PROTECTED_PREFIX = "/breach/";

    private final byte[] expectedKey;

    public ApiKeyFilter(@Value("${breach.api.key:}") String apiKey) {
        this.expectedKey = apiKey == null || apiKey.isBlank() ? null : apiKey.getBytes(StandardCharsets.UTF_8);
        if (expectedKey == null) {
            logger.warn("breach.api.key is not set, breach endpoints accept unauthenticated calls");
        }
    }

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) req;
        if (expectedKey == null || !httpRequest.getRequestURI().startsWith(PROTECTED_PREFIX)) {
            chain.doFilter(req, res);
            return;
        }

        String presented = httpRequest.getHeader(HEADER);
        if (presented != null && MessageDigest.isEqual(expectedKey, presented.getBytes(StandardCharsets.UTF_8))) {
            chain.doFilter(req, res);
            return;
        }

        logger.warn("Rejected {} {} from {}: {} API key",
                httpRequest.getMethod(), httpRequest.getRequestURI(), ClientAddresses.of(httpRequest),
                presented == null ? "missing" : "invalid");

        HttpServletResponse httpResponse = (HttpServletResponse) res;
        httpResponse.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        httpResponse.setContentType(MediaType.APPLICATION_JSON_VALUE);
        httpResponse.setCharacterEncoding(StandardCharsets.UTF_8.name());
        httpResponse.getWriter().write("{\"code\":\"UNAUTHORIZED\",\"error\":\"Invalid or missing API key\"}");
    }
}
