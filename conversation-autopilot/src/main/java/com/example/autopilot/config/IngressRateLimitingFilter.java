package com.example.autopilot.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Token-bucket limiter per client and path in front of the REST API. A connector replaying a
 * backlog too quickly gets 429 and retries later; duplicates are harmless downstream.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class IngressRateLimitingFilter extends OncePerRequestFilter {

    private static final Duration FALLBACK_REFILL_PERIOD = Duration.ofSeconds(60);

    private final IngressSecurityProperties securityProperties;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public IngressRateLimitingFilter(IngressSecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        if (!securityProperties.isRateLimitingEnabled() || "OPTIONS".equalsIgnoreCase(request.getMethod())) {
            filterChain.doFilter(request, response);
            return;
        }

        Bucket bucket = buckets.computeIfAbsent(clientKey(request), key -> newBucket());
        if (bucket.tryConsume(1)) {
            filterChain.doFilter(request, response);
            return;
        }
        reject(response);
    }

    private Bucket newBucket() {
        IngressSecurityProperties.RateLimit limit = securityProperties.getRateLimit();
        Duration period = refillPeriod();
        Bandwidth bandwidth = Bandwidth.classic(
                Math.max(limit.getCapacity(), 1),
                Refill.greedy(Math.max(limit.getRefillTokens(), 1), period));
        return Bucket.builder().addLimit(bandwidth).build();
    }

    private Duration refillPeriod() {
        Duration period = securityProperties.getRateLimit().getRefillPeriod();
        if (period == null || period.isZero() || period.isNegative()) {
            return FALLBACK_REFILL_PERIOD;
        }
        return period;
    }

    private void reject(HttpServletResponse response) throws IOException {
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setHeader("Retry-After", String.valueOf(Math.max(refillPeriod().toSeconds(), 1)));
        response.getWriter()
                .write("{\"error\":\"too_many_requests\",\"code\":\"rate_limited\"}");
    }

    private String clientKey(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        String clientIp = forwardedFor != null && !forwardedFor.isBlank()
                ? forwardedFor.split(",")[0].trim()
                : request.getRemoteAddr();
        return clientIp + ":" + request.getMethod() + ":" + request.getRequestURI();
    }
}
