package com.jreinhal.docqa.security;

import jakarta.annotation.PostConstruct;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Resolves the address rate limits are keyed on. Forwarding headers are honoured only when the
 * direct peer is a configured proxy, otherwise any client could pick its own bucket.
 */
@Component
public class ClientIpResolver {
    private static final Logger log = LoggerFactory.getLogger(ClientIpResolver.class);
    static final String UNKNOWN = "UNKNOWN";
    @Value("${app.security.trusted-proxies:}")
    private String trustedProxyList;
    private Set<String> trustedProxies = Set.of();

    @PostConstruct
    public void init() {
        if (this.trustedProxyList == null || this.trustedProxyList.isBlank()) {
            this.trustedProxies = Set.of();
            return;
        }
        this.trustedProxies = Arrays.stream(this.trustedProxyList.split(","))
                .map(String::trim)
                .filter(value -> !value.isBlank())
                .collect(Collectors.toUnmodifiableSet());
        log.info("Rate limiting behind trusted proxies: {}", this.trustedProxies);
    }

    public String resolveClientIp(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        String remoteAddr = request.getRemoteAddr();
        if (remoteAddr == null) {
            return UNKNOWN;
        }
        if (!this.trustedProxies.contains(remoteAddr)) {
            return remoteAddr;
        }
        String forwarded = firstHop(request.getHeader("X-Forwarded-For"));
        if (forwarded != null) {
            return forwarded;
        }
        String realIp = request.getHeader("X-Real-IP");
        return realIp != null && !realIp.isBlank() ? realIp.trim() : remoteAddr;
    }

    private static String firstHop(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String candidate = header.split(",")[0].trim();
        return candidate.isEmpty() ? null : candidate;
    }
}
