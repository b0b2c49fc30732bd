package sovereignvpn.gateway.service.peer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static sovereignvpn.gateway.testsupport.TunnelKeys.key;
import static sovereignvpn.gateway.testsupport.Wallets.HOT;
import static sovereignvpn.gateway.testsupport.Wallets.OTHER;
import static sovereignvpn.gateway.testsupport.Wallets.VAULT_A;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.exception.AddressPoolExhaustedException;
import sovereignvpn.gateway.exception.PeerConflictException;
import sovereignvpn.gateway.exception.PeerNotFoundException;
import sovereignvpn.gateway.exception.TunnelCommandException;
import sovereignvpn.gateway.service.session.SessionRevokedEvent;
import sovereignvpn.gateway.testsupport.MutableClock;

@ExtendWith(MockitoExtension.class)
@DisplayName("PeerManager Tests")
class PeerManagerTest {

    private static final Duration HOUR = Duration.ofHours(1);

    @Mock
    private TunnelConfigurator tunnel;

    private GatewayProperties properties;
    private MutableClock clock;
    private PeerManager peerManager;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getTunnel().setSubnet("10.8.0.0/29");
        properties.getTunnel().setServerPublicKey(key(99));
        properties.getTunnel().setServerEndpoint("vpn.example.org:51820");
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        peerManager = new PeerManager(tunnel, properties, clock);
    }

    private static String wallet(int n) {
        return String.format("0x%040d", n);
    }

    private void assertBijection() {
        PeerManager.AllocationSnapshot snapshot = peerManager.allocationSnapshot();
        assertThat(snapshot.poolAddresses()).isEqualTo(snapshot.peerAddresses());
    }

    @Nested
    @DisplayName("Adding peers")
    class AddPeer {

        @Test
        @DisplayName("Returns the client config with the subnet prefix")
        void returnsConfig() {
            PeerConfig config = peerManager.addPeer(HOT, key(1), HOUR);

            assertThat(config.clientAddress()).isEqualTo("10.8.0.2/29");
            assertThat(config.serverPublicKey()).isEqualTo(key(99));
            assertThat(config.serverEndpoint()).isEqualTo("vpn.example.org:51820");
            assertThat(config.dns()).isEqualTo("1.1.1.1");
            assertThat(config.allowedIps()).isEqualTo("0.0.0.0/0, ::/0");
            assertThat(config.expiresAt()).isEqualTo(clock.instant().plus(HOUR));
            verify(tunnel).addPeer(key(1), "10.8.0.2");
            assertBijection();
        }

        @Test
        @DisplayName("Rejects malformed keys and non-positive lifetimes")
        void rejectsInvalidInput() {
            assertThatThrownBy(() -> peerManager.addPeer(HOT, "not-a-key", HOUR))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("invalid WireGuard public key");
            assertThatThrownBy(() -> peerManager.addPeer(HOT, key(1), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
            verify(tunnel, never()).addPeer(anyString(), anyString());
        }

        @Test
        @DisplayName("Key owned by another wallet is a conflict")
        void conflict() {
            peerManager.addPeer(HOT, key(1), HOUR);

            assertThatThrownBy(() -> peerManager.addPeer(OTHER, key(1), HOUR))
                .isInstanceOf(PeerConflictException.class);
            assertThat(peerManager.getPeer(key(1))).get().extracting(Peer::getOwner).isEqualTo(HOT);
            assertBijection();
        }

        @Test
        @DisplayName("Reconnecting with the same key replaces the peer")
        void sameKeyReplaces() {
            peerManager.addPeer(HOT, key(1), HOUR);
            clock.advance(Duration.ofMinutes(10));
            PeerConfig config = peerManager.addPeer(HOT, key(1), HOUR);

            assertThat(peerManager.getPeerCount()).isEqualTo(1);
            assertThat(config.expiresAt()).isEqualTo(clock.instant().plus(HOUR));
            verify(tunnel).removePeer(key(1));
            assertBijection();
        }

        @Test
        @DisplayName("A new key from the same wallet replaces the old peer")
        void newKeyReplacesOld() {
            peerManager.addPeer(HOT, key(1), HOUR);
            peerManager.addPeer(HOT, key(2), HOUR);

            assertThat(peerManager.getPeerCount()).isEqualTo(1);
            assertThat(peerManager.getPeer(key(1))).isEmpty();
            assertThat(peerManager.findPeerByOwner(HOT)).get().extracting(Peer::getPublicKey).isEqualTo(key(2));
            verify(tunnel).removePeer(key(1));
            assertBijection();
        }

        @Test
        @DisplayName("A failed tunnel command releases the address")
        void failedCommandReleasesAddress() {
            doThrow(new TunnelCommandException("wg set exited with 1"))
                .when(tunnel).addPeer(eq(key(1)), anyString());

            assertThatThrownBy(() -> peerManager.addPeer(HOT, key(1), HOUR))
                .isInstanceOf(TunnelCommandException.class);
            assertThat(peerManager.getPoolAvailable()).isEqualTo(peerManager.getPoolCapacity());
            assertThat(peerManager.getPeerCount()).isZero();
            assertBijection();
        }

        @Test
        @DisplayName("Pool exhaustion leaves existing peers untouched")
        void exhaustion() {
            for (int i = 1; i <= 5; i++) {
                peerManager.addPeer(wallet(i), key(i), HOUR);
            }

            assertThatThrownBy(() -> peerManager.addPeer(wallet(6), key(6), HOUR))
                .isInstanceOf(AddressPoolExhaustedException.class);
            assertThat(peerManager.getPeerCount()).isEqualTo(5);
            assertThat(peerManager.getPoolAvailable()).isZero();
            assertBijection();
        }

        @Test
        @DisplayName("Concurrent connects never hand out the same address twice")
        void concurrentConnects() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<String>> results = new ArrayList<>();
            for (int i = 1; i <= 8; i++) {
                int n = i;
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        return peerManager.addPeer(wallet(n), key(n), HOUR).clientAddress();
                    } catch (AddressPoolExhaustedException e) {
                        return null;
                    }
                }));
            }
            start.countDown();
            List<String> addresses = new ArrayList<>();
            for (Future<String> result : results) {
                String address = result.get(5, TimeUnit.SECONDS);
                if (address != null) {
                    addresses.add(address);
                }
            }
            executor.shutdown();

            assertThat(addresses).hasSize(5).doesNotHaveDuplicates();
            assertBijection();
        }
    }

    @Nested
    @DisplayName("Removing peers")
    class RemovePeer {

        @Test
        @DisplayName("Unknown key is not found")
        void unknownKey() {
            assertThatThrownBy(() -> peerManager.removePeer(key(1)))
                .isInstanceOf(PeerNotFoundException.class);
        }

        @Test
        @DisplayName("Another wallet's peer is reported as not found")
        void otherOwner() {
            peerManager.addPeer(HOT, key(1), HOUR);

            assertThatThrownBy(() -> peerManager.removePeer(key(1), OTHER))
                .isInstanceOf(PeerNotFoundException.class);
            assertThat(peerManager.getPeerCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Owner removal frees the address")
        void ownerRemoves() {
            peerManager.addPeer(HOT, key(1), HOUR);
            peerManager.removePeer(key(1), HOT);

            assertThat(peerManager.getPeerCount()).isZero();
            assertThat(peerManager.getPoolAvailable()).isEqualTo(5);
            assertBijection();
        }

        @Test
        @DisplayName("Session revocation tears down the wallet's peer")
        void revocationCascade() {
            peerManager.addPeer(HOT, key(1), HOUR);
            peerManager.addPeer(VAULT_A, key(2), HOUR);

            peerManager.onSessionRevoked(new SessionRevokedEvent(HOT, "gated token transferred out"));

            assertThat(peerManager.findPeerByOwner(HOT)).isEmpty();
            assertThat(peerManager.findPeerByOwner(VAULT_A)).isPresent();
            assertBijection();
        }

        @Test
        @DisplayName("A failed revocation teardown is retried by the sweep")
        void failedRevocationRetried() {
            peerManager.addPeer(HOT, key(1), HOUR);
            doThrow(new TunnelCommandException("wg set timed out"))
                .doNothing()
                .when(tunnel).removePeer(key(1));

            assertThat(peerManager.removePeersOwnedBy(HOT)).isZero();
            assertThat(peerManager.getPeer(key(1))).get().extracting(Peer::isRevoked).isEqualTo(true);

            assertThat(peerManager.sweepExpired()).isEqualTo(1);
            assertThat(peerManager.getPeerCount()).isZero();
            assertBijection();
        }
    }

    @Nested
    @DisplayName("Sweeping and stats")
    class Sweep {

        @Test
        @DisplayName("Expired peers are removed, live ones stay")
        void sweepsExpired() {
            peerManager.addPeer(HOT, key(1), Duration.ofMinutes(5));
            peerManager.addPeer(OTHER, key(2), HOUR);
            clock.advance(Duration.ofMinutes(5));

            assertThat(peerManager.sweepExpired()).isEqualTo(1);
            assertThat(peerManager.getPeer(key(1))).isEmpty();
            assertThat(peerManager.getPeer(key(2))).isPresent();
            verify(tunnel, times(1)).removePeer(key(1));
            assertBijection();
        }

        @Test
        @DisplayName("A peer whose removal fails stays for the next sweep")
        void failedSweepKeepsPeer() {
            peerManager.addPeer(HOT, key(1), Duration.ofMinutes(5));
            clock.advance(Duration.ofMinutes(6));
            doThrow(new TunnelCommandException("wg set exited with 1")).when(tunnel).removePeer(key(1));

            assertThat(peerManager.sweepExpired()).isZero();
            assertThat(peerManager.getPeerCount()).isEqualTo(1);
            assertBijection();
        }

        @Test
        @DisplayName("Transfer counters are copied onto known peers")
        void refreshesStats() {
            peerManager.addPeer(HOT, key(1), HOUR);
            when(tunnel.readTransferStats()).thenReturn(Map.of(
                key(1), new TunnelConfigurator.TransferStats(100, 200),
                key(7), new TunnelConfigurator.TransferStats(1, 1)));

            peerManager.refreshTransferStats();

            Peer peer = peerManager.getPeer(key(1)).orElseThrow();
            assertThat(peer.getBytesReceived()).isEqualTo(100);
            assertThat(peer.getBytesSent()).isEqualTo(200);
        }
    }
}
