package com.jreinhal.docqa.filter;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.docqa.security.ClientIpResolver;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Per-client, per-endpoint request budgets. Uploads and generation calls are expensive, so each
 * gets its own bucket; paths without a budget pass straight through.
 */
@Component
@Order(value=4)
public class RateLimitFilter
implements Filter {
    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);
    private final ClientIpResolver clientIpResolver;
    @Value("${app.rate-limit.enabled:true}")
    private boolean enabled = true;
    @Value("${app.rate-limit.window-minutes:15}")
    private long windowMinutes = 15L;
    @Value("${app.rate-limit.upload:10}")
    private int uploadLimit = 10;
    @Value("${app.rate-limit.ask:60}")
    private int askLimit = 60;
    @Value("${app.rate-limit.summarize:15}")
    private int summarizeLimit = 15;
    @Value("${app.rate-limit.compare:10}")
    private int compareLimit = 10;
    private final Cache<String, Bucket> bucketCache = Caffeine.newBuilder().maximumSize(10000L).expireAfterAccess(1L, TimeUnit.HOURS).build();

    public RateLimitFilter(ClientIpResolver clientIpResolver) {
        this.clientIpResolver = clientIpResolver;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain) throws IOException, ServletException {
        if (!this.enabled) {
            chain.doFilter(request, response);
            return;
        }
        HttpServletRequest httpRequest = (HttpServletRequest)request;
        HttpServletResponse httpResponse = (HttpServletResponse)response;
        String path = httpRequest.getRequestURI();
        String endpoint = endpointFor(path);
        if (endpoint == null) {
            chain.doFilter(request, response);
            return;
        }
        int limit = this.limitFor(endpoint);
        String rateLimitKey = endpoint + ":" + this.clientIpResolver.resolveClientIp(httpRequest);
        Bucket bucket = this.bucketCache.get(rateLimitKey, k -> this.createBucket(limit));
        httpResponse.setHeader("X-RateLimit-Limit", String.valueOf(limit));
        if (bucket.tryConsume(1L)) {
            httpResponse.setHeader("X-RateLimit-Remaining", String.valueOf(bucket.getAvailableTokens()));
            chain.doFilter(request, response);
            return;
        }
        long retryAfter = Duration.ofMinutes(this.windowMinutes).toSeconds();
        log.warn("Rate limit exceeded for key: {} on path: {}", rateLimitKey, path);
        httpResponse.setStatus(429);
        httpResponse.setContentType("application/json");
        httpResponse.setHeader("Retry-After", String.valueOf(retryAfter));
        httpResponse.setHeader("X-RateLimit-Remaining", "0");
        httpResponse.getWriter().write("{\"error\": \"Too many " + endpoint + " requests. Please wait before trying again.\", \"retryAfter\": " + retryAfter + "}");
    }

    private Bucket createBucket(int capacity) {
        Bandwidth limit = Bandwidth.builder().capacity(capacity).refillGreedy(capacity, Duration.ofMinutes(this.windowMinutes)).build();
        return Bucket.builder().addLimit(limit).build();
    }

    private int limitFor(String endpoint) {
        switch (endpoint) {
            case "upload":
                return this.uploadLimit;
            case "ask":
                return this.askLimit;
            case "summarize":
                return this.summarizeLimit;
            default:
                return this.compareLimit;
        }
    }

    static String endpointFor(String path) {
        if (path == null) {
            return null;
        }
        if (path.equals("/api/upload") || path.startsWith("/api/upload/")) {
            return "upload";
        }
        if (path.equals("/api/ask")) {
            return "ask";
        }
        if (path.equals("/api/summarize")) {
            return "summarize";
        }
        // similarity is priced like compare: both touch every selected session
        if (path.equals("/api/compare") || path.equals("/api/similarity")) {
            return "compare";
        }
        return null;
    }
}
