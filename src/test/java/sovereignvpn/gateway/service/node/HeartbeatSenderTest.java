package sovereignvpn.gateway.service.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.abi.datatypes.Function;
import org.web3j.protocol.Web3j;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.exception.LedgerException;
import sovereignvpn.gateway.service.ledger.TransactionSubmitter;

@ExtendWith(MockitoExtension.class)
@DisplayName("HeartbeatSender Tests")
class HeartbeatSenderTest {

    private static final String REGISTRY = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";

    @Mock
    private TransactionSubmitter submitter;

    private GatewayProperties properties;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getNodeRegistry().setContract(REGISTRY);
        lenient().when(submitter.getFromAddress()).thenReturn("0x9999999999999999999999999999999999999999");
    }

    @Test
    @DisplayName("Sends heartbeat() to the registry")
    void sendsHeartbeat() {
        when(submitter.submit(eq(REGISTRY), any(Function.class), eq(BigInteger.valueOf(100_000L)))).thenReturn("0xbeat");
        HeartbeatSender sender = new HeartbeatSender(properties, submitter);

        assertThat(sender.sendHeartbeat()).isEqualTo("0xbeat");

        ArgumentCaptor<Function> captor = ArgumentCaptor.forClass(Function.class);
        verify(submitter).submit(eq(REGISTRY), captor.capture(), any(BigInteger.class));
        assertThat(captor.getValue().getName()).isEqualTo("heartbeat");
        assertThat(captor.getValue().getInputParameters()).isEmpty();
    }

    @Test
    @DisplayName("A failed send is logged and retried on the next tick")
    void failureSwallowedUntilNextTick() {
        when(submitter.submit(eq(REGISTRY), any(Function.class), any(BigInteger.class)))
            .thenThrow(new LedgerException("heartbeat", "insufficient funds"))
            .thenReturn("0xnext");
        HeartbeatSender sender = new HeartbeatSender(properties, submitter);

        assertThat(sender.sendHeartbeat()).isNull();
        assertThat(sender.sendHeartbeat()).isEqualTo("0xnext");
    }

    @Test
    @DisplayName("Without a heartbeat key nothing is sent")
    void disabledWithoutKey(@Mock Web3j web3j) {
        HeartbeatSender sender = new HeartbeatSender(web3j, properties);

        assertThat(sender.isEnabled()).isFalse();
        assertThat(sender.sendHeartbeat()).isNull();
    }
}
