package sovereignvpn.gateway.security;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import jakarta.annotation.Nonnull;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import sovereignvpn.gateway.util.LogSanitizer;

/**
 * Per-IP token bucket on the unauthenticated endpoints that do real work:
 * challenge issuance and signature verification, and peer provisioning.
 */
@Component
@Order(1)
@Slf4j
public class PublicEndpointRateLimitFilter extends OncePerRequestFilter {

    @Value("${rate.limit.auth.requests.per.minute:30}")
    private int authRequestsPerMinute;

    @Value("${rate.limit.auth.requests.burst:10}")
    private int authRequestsBurst;

    @Value("${rate.limit.connect.requests.per.minute:10}")
    private int connectRequestsPerMinute;

    @Value("${rate.limit.enabled:true}")
    private boolean rateLimitEnabled;

    private final Map<String, Bucket> authBuckets = new ConcurrentHashMap<>();
    private final Map<String, Bucket> connectBuckets = new ConcurrentHashMap<>();

    // Upper bound on tracked clients
    private static final int MAX_BUCKETS = 50000;

    @Override
    protected void doFilterInternal(
            @Nonnull HttpServletRequest request,
            @Nonnull HttpServletResponse response,
            @Nonnull FilterChain filterChain
    ) throws ServletException, IOException {

        if (!rateLimitEnabled) {
            filterChain.doFilter(request, response);
            return;
        }

        String path = request.getRequestURI();
        String clientIp = getClientIp(request);

        if (isAuthEndpoint(path)) {
            if (!tryConsume(authBuckets, clientIp, this::createAuthBucket)) {
                log.warn("Rate limit exceeded for auth endpoint: path={}, ip={}", LogSanitizer.sanitize(path), maskIp(clientIp));
                sendRateLimitResponse(response);
                return;
            }
        } else if (isConnectEndpoint(path)) {
            if (!tryConsume(connectBuckets, clientIp, this::createConnectBucket)) {
                log.warn("Rate limit exceeded for connect endpoint: ip={}", maskIp(clientIp));
                sendRateLimitResponse(response);
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    private boolean isAuthEndpoint(String path) {
        return path.equals("/auth/challenge") || path.equals("/auth/verify");
    }

    private boolean isConnectEndpoint(String path) {
        return path.equals("/vpn/connect");
    }

    private boolean tryConsume(Map<String, Bucket> buckets, String clientIp, Supplier<Bucket> factory) {
        cleanupBucketsIfNeeded(buckets);
        Bucket bucket = buckets.computeIfAbsent(clientIp, k -> factory.get());
        return bucket.tryConsume(1);
    }

    private Bucket createAuthBucket() {
        return Bucket.builder()
                .addLimit(Bandwidth.builder()
                        .capacity(authRequestsBurst)
                        .refillGreedy(authRequestsPerMinute, Duration.ofMinutes(1))
                        .build())
                .build();
    }

    private Bucket createConnectBucket() {
        return Bucket.builder()
                .addLimit(Bandwidth.builder()
                        .capacity(connectRequestsPerMinute)
                        .refillGreedy(connectRequestsPerMinute, Duration.ofMinutes(1))
                        .build())
                .build();
    }

    private void sendRateLimitResponse(HttpServletResponse response) throws IOException {
        response.setStatus(429);
        response.setContentType("application/json");
        response.setHeader("Retry-After", "60");
        response.getWriter().write("{\"error\":\"too many requests, try again later\"}");
    }

    private String getClientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            // First entry is the original client
            return xForwardedFor.split(",")[0].trim();
        }

        String xRealIp = request.getHeader("X-Real-IP");
        if (xRealIp != null && !xRealIp.isEmpty()) {
            return xRealIp.trim();
        }

        return request.getRemoteAddr();
    }

    private String maskIp(String ip) {
        if (ip == null) return "unknown";
        int lastDot = ip.lastIndexOf('.');
        if (lastDot > 0) {
            return ip.substring(0, lastDot) + ".***";
        }
        if (ip.length() > 8) {
            return ip.substring(0, ip.length() - 4) + "****";
        }
        return ip;
    }

    private void cleanupBucketsIfNeeded(Map<String, Bucket> buckets) {
        if (buckets.size() > MAX_BUCKETS) {
            log.info("Cleaning up rate limit buckets, current size: {}", buckets.size());
            buckets.clear();
        }
    }
}
