package sovereignvpn.gateway.service.auth;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import sovereignvpn.gateway.config.GatewayProperties;

/**
 * Pending SIWE nonces with their expiry. A nonce can be consumed exactly once.
 */
@Service
@Slf4j
public class NonceStore {

    private final SecureRandom random = new SecureRandom();
    private final Map<String, Instant> pending = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int nonceLength;
    private final Duration ttl;

    public NonceStore(GatewayProperties properties, Clock clock) {
        this.clock = clock;
        this.nonceLength = properties.getSiwe().getNonceLength();
        this.ttl = properties.getSiwe().getChallengeTtl();
        if (nonceLength < GatewayProperties.MIN_NONCE_LENGTH) {
            throw new IllegalStateException("nonce length must be at least " + GatewayProperties.MIN_NONCE_LENGTH);
        }
    }

    /**
     * Generates a hex nonce and records it as pending.
     */
    public String issue() {
        byte[] bytes = new byte[nonceLength];
        random.nextBytes(bytes);
        String nonce = HexFormat.of().formatHex(bytes);
        pending.put(nonce, clock.instant().plus(ttl));
        return nonce;
    }

    /**
     * Atomically removes the nonce. Returns true only for a pending, unexpired nonce;
     * of two concurrent callers at most one sees true.
     */
    public boolean consume(String nonce) {
        if (nonce == null || nonce.isEmpty()) {
            return false;
        }
        Instant expiresAt = pending.remove(nonce);
        return expiresAt != null && clock.instant().isBefore(expiresAt);
    }

    @Scheduled(fixedDelayString = "${gateway.siwe.cleanup-interval-ms:60000}")
    public int cleanupExpired() {
        Instant now = clock.instant();
        int before = pending.size();
        pending.entrySet().removeIf(entry -> !now.isBefore(entry.getValue()));
        int removed = before - pending.size();
        if (removed > 0) {
            log.debug("Removed {} expired SIWE nonces", removed);
        }
        return removed;
    }

    public int getPendingCount() {
        return pending.size();
    }
}
