package sovereignvpn.gateway.service.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.service.tier.AccessTier;
import sovereignvpn.gateway.util.EthereumAddressValidator;
import sovereignvpn.gateway.util.LogSanitizer;

/**
 * Live sessions keyed by wallet. One session per wallet: creating a new one replaces the old.
 */
@Service
@Slf4j
public class SessionGate {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Duration credentialTtl;

    public SessionGate(ApplicationEventPublisher eventPublisher, GatewayProperties properties, Clock clock) {
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.credentialTtl = properties.getSession().getCredentialTtl();
    }

    public Session createSession(String wallet, AccessTier tier) {
        return createSession(wallet, tier, null);
    }

    /**
     * Opens a session whose tier was granted through {@code vault}'s holdings; a transfer out of
     * the vault revokes it for as long as it lives.
     */
    public Session createSession(String wallet, AccessTier tier, String vault) {
        if (tier == null || !tier.grantsAccess()) {
            throw new IllegalArgumentException("cannot open a session for tier " + tier);
        }
        String key = EthereumAddressValidator.toChecksumAddress(wallet);
        String backingVault = vault != null ? EthereumAddressValidator.toChecksumAddress(vault) : null;
        Instant now = clock.instant();
        Session session = new Session(key, tier, now, now.plus(credentialTtl), backingVault);
        sessions.put(key, session);
        log.info("Session opened for {} (tier={}, expires={})", LogSanitizer.maskIdentifier(key), tier,
            session.expiresAt());
        return session;
    }

    /**
     * Returns the live session, removing it if it has expired.
     */
    public Optional<Session> getSession(String wallet) {
        if (!EthereumAddressValidator.isValidAddress(wallet)) {
            return Optional.empty();
        }
        String key = EthereumAddressValidator.toChecksumAddress(wallet);
        Session session = sessions.get(key);
        if (session == null) {
            return Optional.empty();
        }
        if (session.isExpiredAt(clock.instant())) {
            sessions.remove(key, session);
            return Optional.empty();
        }
        return Optional.of(session);
    }

    /**
     * Removes the wallet's session and announces the revocation so dependent tunnel state is torn down.
     * The event is published even without a live session, since a peer may outlive its session.
     */
    public void revoke(String wallet, String reason) {
        String key = EthereumAddressValidator.toChecksumAddress(wallet);
        Session removed = sessions.remove(key);
        if (removed != null) {
            log.info("Session revoked for {}: {}", LogSanitizer.maskIdentifier(key), reason);
        }
        eventPublisher.publishEvent(new SessionRevokedEvent(key, reason));
    }

    /**
     * @return wallets whose live session was granted through {@code vault}
     */
    public Set<String> findSessionsBackedBy(String vault) {
        String key = EthereumAddressValidator.toChecksumAddress(vault);
        Instant now = clock.instant();
        return sessions.values().stream()
            .filter(session -> session.isBackedBy(key) && !session.isExpiredAt(now))
            .map(Session::wallet)
            .collect(Collectors.toSet());
    }

    @Scheduled(fixedDelayString = "${gateway.session.sweep-interval-ms:60000}")
    public int sweepExpired() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.entrySet().removeIf(entry -> entry.getValue().isExpiredAt(now));
        int removed = before - sessions.size();
        if (removed > 0) {
            log.debug("Swept {} expired sessions", removed);
        }
        return removed;
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }
}
