package sovereignvpn.gateway.service.revocation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static sovereignvpn.gateway.testsupport.Wallets.HOT;
import static sovereignvpn.gateway.testsupport.Wallets.TOKEN;
import static sovereignvpn.gateway.testsupport.Wallets.VAULT_A;

import io.reactivex.Flowable;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.response.Log;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.testsupport.MutableClock;

@ExtendWith(MockitoExtension.class)
@DisplayName("TransferEventWatcher Tests")
class TransferEventWatcherTest {

    private static final String SINGLE_TOPIC = "0xc3d58168c5ae7397731d063d5bbf3d657854427343f4c083240f7aacaa2d0f62";
    private static final String BATCH_TOPIC = "0x4a39dc06d4c0dbc64b70af90fd698a233a518aa5d07e595d983b8c0526c8f7fb";
    private static final String ZERO_TOPIC = "0x" + "0".repeat(64);

    @Mock
    private Web3j web3j;

    @Mock
    private SessionRevoker sessionRevoker;

    private MutableClock clock;
    private GatewayProperties properties;
    private TransferEventWatcher watcher;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        properties = new GatewayProperties();
        properties.getTier().setTokenContract(TOKEN);
        properties.getRevocation().setRetryDelay(Duration.ofHours(1));
        watcher = new TransferEventWatcher(web3j, sessionRevoker, properties, clock);
    }

    @AfterEach
    void tearDown() {
        watcher.stop();
    }

    private static String topic(String address) {
        return "0x000000000000000000000000" + address.substring(2);
    }

    private static Log transferLog(String eventTopic, String fromTopic, String toTopic, String txHash, String index) {
        Log eventLog = new Log();
        eventLog.setTopics(List.of(eventTopic, topic(HOT), fromTopic, toTopic));
        eventLog.setTransactionHash(txHash);
        eventLog.setLogIndex(index);
        return eventLog;
    }

    @Test
    @DisplayName("Event signatures hash to the ERC-1155 topics")
    void topicHashes() {
        assertThat(TransferEventWatcher.TRANSFER_SINGLE_TOPIC).isEqualTo(SINGLE_TOPIC);
        assertThat(TransferEventWatcher.TRANSFER_BATCH_TOPIC).isEqualTo(BATCH_TOPIC);
    }

    @Nested
    @DisplayName("Handling logs")
    class HandleLog {

        @Test
        @DisplayName("Sender loses access and receiver is refreshed")
        void routesFromAndTo() {
            watcher.handleLog(transferLog(SINGLE_TOPIC, topic(VAULT_A), topic(HOT), "0xaa", "0x1"));

            verify(sessionRevoker).onTransferOut(VAULT_A);
            verify(sessionRevoker).onTransferIn(HOT);
        }

        @Test
        @DisplayName("Batch transfers are handled the same way")
        void batch() {
            watcher.handleLog(transferLog(BATCH_TOPIC, topic(VAULT_A), topic(HOT), "0xbb", "0x0"));

            verify(sessionRevoker).onTransferOut(VAULT_A);
            verify(sessionRevoker).onTransferIn(HOT);
        }

        @Test
        @DisplayName("Mint has no sender and burn has no receiver")
        void mintAndBurn() {
            watcher.handleLog(transferLog(SINGLE_TOPIC, ZERO_TOPIC, topic(HOT), "0xcc", "0x0"));
            watcher.handleLog(transferLog(SINGLE_TOPIC, topic(VAULT_A), ZERO_TOPIC, "0xdd", "0x0"));

            verify(sessionRevoker).onTransferIn(HOT);
            verify(sessionRevoker).onTransferOut(VAULT_A);
            verify(sessionRevoker, times(1)).onTransferIn(anyString());
            verify(sessionRevoker, times(1)).onTransferOut(anyString());
        }

        @Test
        @DisplayName("The same log delivered twice is applied once")
        void deduplicates() {
            Log eventLog = transferLog(SINGLE_TOPIC, topic(VAULT_A), topic(HOT), "0xee", "0x3");

            watcher.handleLog(eventLog);
            watcher.handleLog(eventLog);

            verify(sessionRevoker, times(1)).onTransferOut(VAULT_A);
        }

        @Test
        @DisplayName("A log is applied again once its dedup entry has aged out")
        void dedupExpires() {
            Log eventLog = transferLog(SINGLE_TOPIC, topic(VAULT_A), topic(HOT), "0xef", "0x4");
            watcher.handleLog(eventLog);

            clock.advance(Duration.ofMinutes(9));
            assertThat(watcher.cleanupDeduplicationCache()).isZero();
            watcher.handleLog(eventLog);
            verify(sessionRevoker, times(1)).onTransferOut(VAULT_A);

            clock.advance(Duration.ofMinutes(2));
            assertThat(watcher.cleanupDeduplicationCache()).isEqualTo(1);
            watcher.handleLog(eventLog);
            verify(sessionRevoker, times(2)).onTransferOut(VAULT_A);
        }

        @Test
        @DisplayName("Unrelated or truncated logs are ignored")
        void ignoresOtherLogs() {
            watcher.handleLog(transferLog("0x" + "ab".repeat(32), topic(VAULT_A), topic(HOT), "0xff", "0x0"));
            Log truncated = new Log();
            truncated.setTopics(List.of(SINGLE_TOPIC, topic(HOT)));
            watcher.handleLog(truncated);

            verifyNoInteractions(sessionRevoker);
        }

        @Test
        @DisplayName("A failing revocation does not escape the handler")
        void revocationFailureContained() {
            doThrow(new IllegalStateException("boom")).when(sessionRevoker).onTransferOut(VAULT_A);

            watcher.handleLog(transferLog(SINGLE_TOPIC, topic(VAULT_A), topic(HOT), "0x11", "0x0"));

            verify(sessionRevoker).onTransferOut(VAULT_A);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Disabled watcher never subscribes")
        void disabled() {
            properties.getRevocation().setEnabled(false);
            TransferEventWatcher disabled = new TransferEventWatcher(web3j, sessionRevoker, properties, clock);

            disabled.start();

            assertThat(disabled.getState()).isEqualTo(TransferEventWatcher.State.DISCONNECTED);
            verifyNoInteractions(web3j);
            disabled.stop();
        }

        @Test
        @DisplayName("Subscribes on start and stops cleanly")
        void subscribes() {
            when(web3j.ethLogFlowable(any(EthFilter.class))).thenReturn(Flowable.never());

            watcher.start();
            assertThat(watcher.getState()).isEqualTo(TransferEventWatcher.State.SUBSCRIBED);

            watcher.stop();
            assertThat(watcher.getState()).isEqualTo(TransferEventWatcher.State.STOPPED);
        }

        @Test
        @DisplayName("A subscription error drops back to disconnected")
        void errorDisconnects() {
            when(web3j.ethLogFlowable(any(EthFilter.class))).thenReturn(Flowable.error(new IOException("filter not found")));

            watcher.start();

            assertThat(watcher.getState()).isEqualTo(TransferEventWatcher.State.DISCONNECTED);
            verify(sessionRevoker, never()).onTransferOut(anyString());
        }

        @Test
        @DisplayName("Resubscribes after the retry delay")
        void resubscribesAfterBackoff() {
            properties.getRevocation().setRetryDelay(Duration.ofMillis(50));
            TransferEventWatcher retrying = new TransferEventWatcher(web3j, sessionRevoker, properties, clock);
            when(web3j.ethLogFlowable(any(EthFilter.class)))
                .thenReturn(Flowable.error(new IOException("filter not found")), Flowable.never());

            try {
                retrying.start();

                verify(web3j, timeout(2_000).times(2)).ethLogFlowable(any(EthFilter.class));
                assertThat(retrying.getState()).isEqualTo(TransferEventWatcher.State.SUBSCRIBED);
            } finally {
                retrying.stop();
            }
        }
    }
}
