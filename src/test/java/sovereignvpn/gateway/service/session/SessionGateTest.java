package sovereignvpn.gateway.service.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static sovereignvpn.gateway.testsupport.Wallets.HOT;
import static sovereignvpn.gateway.testsupport.Wallets.OTHER;
import static sovereignvpn.gateway.testsupport.Wallets.VAULT_A;

import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.service.tier.AccessTier;
import sovereignvpn.gateway.testsupport.MutableClock;

@ExtendWith(MockitoExtension.class)
@DisplayName("SessionGate Tests")
class SessionGateTest {

    private static final String CHECKSUMMED = "0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed";

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private MutableClock clock;
    private SessionGate sessionGate;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getSession().setCredentialTtl(Duration.ofHours(24));
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        sessionGate = new SessionGate(eventPublisher, properties, clock);
    }

    @Test
    @DisplayName("Sessions live for the credential TTL")
    void createAndExpire() {
        Session session = sessionGate.createSession(HOT, AccessTier.FREE);

        assertThat(session.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofHours(24)));
        assertThat(sessionGate.getSession(HOT)).contains(session);

        clock.advance(Duration.ofHours(24));
        assertThat(sessionGate.getSession(HOT)).isEmpty();
        assertThat(sessionGate.getActiveSessionCount()).isZero();
    }

    @Test
    @DisplayName("Lookup is case-insensitive on the wallet address")
    void caseInsensitiveLookup() {
        sessionGate.createSession(CHECKSUMMED.toLowerCase(), AccessTier.PAID);

        assertThat(sessionGate.getSession(CHECKSUMMED)).get()
            .extracting(Session::wallet).isEqualTo(CHECKSUMMED);
        assertThat(sessionGate.getSession(CHECKSUMMED.toLowerCase())).isPresent();
    }

    @Test
    @DisplayName("Invalid tokens find nothing")
    void invalidToken() {
        assertThat(sessionGate.getSession("not-an-address")).isEmpty();
        assertThat(sessionGate.getSession(null)).isEmpty();
    }

    @Test
    @DisplayName("A second session replaces the first")
    void replaces() {
        sessionGate.createSession(HOT, AccessTier.PAID);
        clock.advance(Duration.ofHours(1));
        Session second = sessionGate.createSession(HOT, AccessTier.FREE);

        assertThat(sessionGate.getSession(HOT)).contains(second);
        assertThat(sessionGate.getActiveSessionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Denied tier never gets a session")
    void deniedRejected() {
        assertThatThrownBy(() -> sessionGate.createSession(HOT, AccessTier.DENIED))
            .isInstanceOf(IllegalArgumentException.class);
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("Revoke removes the session and publishes the event")
    void revoke() {
        sessionGate.createSession(HOT, AccessTier.FREE);

        sessionGate.revoke(HOT, "gated token transferred out");

        assertThat(sessionGate.getSession(HOT)).isEmpty();
        verify(eventPublisher).publishEvent(new SessionRevokedEvent(HOT, "gated token transferred out"));
    }

    @Test
    @DisplayName("Revoke without a session still publishes so stray peers are removed")
    void revokeWithoutSession() {
        sessionGate.revoke(OTHER, "gated token transferred out");

        verify(eventPublisher).publishEvent(new SessionRevokedEvent(OTHER, "gated token transferred out"));
    }

    @Test
    @DisplayName("Sessions granted through a vault are found by that vault for their whole lifetime")
    void backedByVault() {
        Session delegated = sessionGate.createSession(HOT, AccessTier.FREE, VAULT_A.toLowerCase());
        sessionGate.createSession(OTHER, AccessTier.PAID);

        assertThat(delegated.vault()).isEqualTo(VAULT_A);
        clock.advance(Duration.ofHours(23));
        assertThat(sessionGate.findSessionsBackedBy(VAULT_A)).containsExactly(HOT);
        assertThat(sessionGate.findSessionsBackedBy(OTHER)).isEmpty();

        clock.advance(Duration.ofHours(1));
        assertThat(sessionGate.findSessionsBackedBy(VAULT_A)).isEmpty();
    }

    @Test
    @DisplayName("Sweep drops expired sessions only")
    void sweep() {
        sessionGate.createSession(HOT, AccessTier.FREE);
        clock.advance(Duration.ofHours(12));
        sessionGate.createSession(OTHER, AccessTier.PAID);
        clock.advance(Duration.ofHours(12));

        assertThat(sessionGate.sweepExpired()).isEqualTo(1);
        assertThat(sessionGate.getSession(OTHER)).isPresent();
    }
}
