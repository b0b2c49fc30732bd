package sovereignvpn.gateway.service.access;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.dto.auth.ChallengeResponse;
import sovereignvpn.gateway.dto.auth.VerifyResponse;
import sovereignvpn.gateway.dto.vpn.ConnectResponse;
import sovereignvpn.gateway.dto.vpn.StatusResponse;
import sovereignvpn.gateway.exception.PaymentRequiredException;
import sovereignvpn.gateway.exception.PeerNotFoundException;
import sovereignvpn.gateway.exception.ReputationLookupException;
import sovereignvpn.gateway.exception.SessionNotFoundException;
import sovereignvpn.gateway.exception.TierDeniedException;
import sovereignvpn.gateway.service.auth.Challenge;
import sovereignvpn.gateway.service.auth.SiweService;
import sovereignvpn.gateway.service.node.ReputationClient;
import sovereignvpn.gateway.service.onchain.OnChainSession;
import sovereignvpn.gateway.service.onchain.SessionManagerClient;
import sovereignvpn.gateway.service.peer.PeerConfig;
import sovereignvpn.gateway.service.peer.PeerManager;
import sovereignvpn.gateway.service.session.Session;
import sovereignvpn.gateway.service.session.SessionGate;
import sovereignvpn.gateway.service.tier.AccessTier;
import sovereignvpn.gateway.service.tier.TierResult;
import sovereignvpn.gateway.service.tier.TierResolver;
import sovereignvpn.gateway.util.EthereumAddressValidator;
import sovereignvpn.gateway.util.LogSanitizer;
import sovereignvpn.gateway.util.WireGuardKeys;

/**
 * Challenge, verify and connect flow behind the public HTTP API.
 *
 * <p>The session token handed to clients is the wallet address itself.</p>
 */
@Service
@Slf4j
public class GatewayAccessService {

    static final String SESSION_MISSING = "session expired or not found, re-authenticate via /auth/verify";
    static final String PAYMENT_REQUIRED = "on-chain payment required for paid tier";
    static final String PAYMENT_NOT_FOUND = "on-chain payment not found";
    static final String PAYMENT_EXPIRED = "on-chain session expired";
    static final String NO_TOKEN = "wallet holds no qualifying token";
    static final String BANNED = "wallet banned: negative reputation in %s category";

    private final SiweService siweService;
    private final TierResolver tierResolver;
    private final SessionGate sessionGate;
    private final PeerManager peerManager;
    private final SessionManagerClient sessionManagerClient;
    private final ReputationClient reputationClient;
    private final GatewayProperties properties;
    private final Clock clock;

    public GatewayAccessService(SiweService siweService, TierResolver tierResolver, SessionGate sessionGate,
                                PeerManager peerManager, SessionManagerClient sessionManagerClient,
                                ReputationClient reputationClient, GatewayProperties properties, Clock clock) {
        this.siweService = siweService;
        this.tierResolver = tierResolver;
        this.sessionGate = sessionGate;
        this.peerManager = peerManager;
        this.sessionManagerClient = sessionManagerClient;
        this.reputationClient = reputationClient;
        this.properties = properties;
        this.clock = clock;
    }

    public ChallengeResponse issueChallenge(String address) {
        if (!EthereumAddressValidator.isValidAddress(address)) {
            throw new IllegalArgumentException("invalid Ethereum address");
        }
        Challenge challenge = siweService.issueChallenge();
        String wallet = EthereumAddressValidator.toChecksumAddress(address);
        return new ChallengeResponse(siweService.render(challenge, wallet), challenge.nonce());
    }

    /**
     * Verifies the signed challenge, resolves the tier and opens a session.
     *
     * @throws TierDeniedException when neither the wallet nor its vaults qualify, or the wallet is banned
     */
    public VerifyResponse verify(String message, String signature) {
        String wallet = siweService.verify(message, signature).wallet();

        TierResult result = tierResolver.resolve(wallet);
        if (!result.tier().grantsAccess()) {
            throw new TierDeniedException(wallet, NO_TOKEN);
        }
        checkUserBan(wallet);

        Session session = sessionGate.createSession(wallet, result.tier(), result.vault());
        if (result.tier() == AccessTier.FREE && sessionManagerClient.canWrite()) {
            sessionManagerClient.openFreeSession(wallet, properties.getSession().getCredentialTtl());
        }

        log.info("Access granted: {} tier={}{}", LogSanitizer.maskIdentifier(wallet), result.tier(),
            result.viaDelegation() ? " via vault " + LogSanitizer.maskIdentifier(result.vault()) : "");
        return new VerifyResponse(wallet, session.tier(), timestamp(session.expiresAt()));
    }

    /**
     * Provisions a tunnel peer for the session's wallet. Paid sessions need an active, paid
     * on-chain session when the session manager is configured; the peer then lives as long as it.
     */
    public ConnectResponse connect(String sessionToken, String publicKey) {
        if (!WireGuardKeys.isValidPublicKey(publicKey)) {
            throw new IllegalArgumentException("invalid WireGuard public key");
        }
        Session session = sessionGate.getSession(sessionToken)
            .orElseThrow(() -> new SessionNotFoundException(SESSION_MISSING));
        if (!session.tier().grantsAccess()) {
            throw new TierDeniedException(session.wallet(), "access denied");
        }

        Instant now = clock.instant();
        Duration ttl;
        if (session.tier() == AccessTier.PAID && sessionManagerClient.isEnabled()) {
            ttl = remainingPaidTime(session.wallet(), now);
        } else {
            ttl = Duration.between(now, session.expiresAt());
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new SessionNotFoundException(SESSION_MISSING);
        }

        PeerConfig config = peerManager.addPeer(session.wallet(), publicKey, ttl);
        // A revocation that landed before the peer existed had nothing to tear down
        Optional<Session> current = sessionGate.getSession(session.wallet());
        if (current.isEmpty() || !current.get().createdAt().equals(session.createdAt())) {
            peerManager.removePeersOwnedBy(session.wallet());
            log.warn("Session of {} ended while connecting; peer withdrawn",
                LogSanitizer.maskIdentifier(session.wallet()));
            throw new SessionNotFoundException(SESSION_MISSING);
        }
        log.info("VPN connected ({}): {} -> {}", session.tier(), LogSanitizer.maskIdentifier(session.wallet()),
            config.clientAddress());
        return new ConnectResponse(
            config.serverPublicKey(),
            config.serverEndpoint(),
            config.clientAddress(),
            config.dns(),
            config.allowedIps(),
            timestamp(config.expiresAt()),
            session.tier());
    }

    /**
     * Removes the caller's peer and closes its on-chain session when this node can write.
     *
     * @throws PeerNotFoundException when the key is unknown or belongs to another wallet
     */
    public void disconnect(String sessionToken, String publicKey) {
        if (!EthereumAddressValidator.isValidAddress(sessionToken)) {
            throw new PeerNotFoundException("peer not found");
        }
        String wallet = EthereumAddressValidator.toChecksumAddress(sessionToken);
        peerManager.removePeer(publicKey, wallet);
        log.info("VPN disconnected: {}", LogSanitizer.maskIdentifier(wallet));
        if (sessionManagerClient.canWrite()) {
            sessionManagerClient.closeActiveSession(wallet);
        }
    }

    public StatusResponse status(String sessionToken) {
        return sessionGate.getSession(sessionToken)
            .map(session -> StatusResponse.active(session.tier(), timestamp(session.expiresAt())))
            .orElseGet(() -> StatusResponse.inactive("no active session"));
    }

    private Duration remainingPaidTime(String wallet, Instant now) {
        BigInteger sessionId = sessionManagerClient.getActiveSessionId(wallet);
        if (sessionId.signum() == 0) {
            throw new PaymentRequiredException(PAYMENT_REQUIRED);
        }
        OnChainSession onChain = sessionManagerClient.getSession(sessionId);
        if (onChain.payment().signum() == 0 || !onChain.active()) {
            throw new PaymentRequiredException(PAYMENT_NOT_FOUND);
        }
        Instant end = Instant.ofEpochSecond(onChain.startedAt().longValueExact())
            .plusSeconds(onChain.duration().longValueExact());
        Duration remaining = Duration.between(now, end);
        if (remaining.isNegative() || remaining.isZero()) {
            throw new PaymentRequiredException(PAYMENT_EXPIRED);
        }
        return remaining;
    }

    private void checkUserBan(String wallet) {
        GatewayProperties.Reputation reputation = properties.getReputation();
        if (!reputation.isUserBanCheck()) {
            return;
        }
        try {
            long rating = reputationClient.fetchRating(wallet, reputation.getUserBanCategory());
            if (rating < 0) {
                log.warn("Access denied (banned): {} rep={} in '{}'", LogSanitizer.maskIdentifier(wallet), rating,
                    reputation.getUserBanCategory());
                throw new TierDeniedException(wallet, String.format(BANNED, reputation.getUserBanCategory()));
            }
        } catch (ReputationLookupException e) {
            log.warn("User rep check failed for {}, allowing access: {}", LogSanitizer.maskIdentifier(wallet),
                LogSanitizer.sanitize(e.getMessage()));
        }
    }

    static String timestamp(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
