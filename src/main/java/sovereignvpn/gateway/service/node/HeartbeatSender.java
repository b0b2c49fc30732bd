package sovereignvpn.gateway.service.node;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.web3j.abi.datatypes.Function;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.exception.LedgerException;
import sovereignvpn.gateway.service.ledger.TransactionSubmitter;

/**
 * Keeps this node marked live in the NodeRegistry by sending {@code heartbeat()} periodically.
 * Idle unless both the registry contract and a heartbeat key are configured.
 */
@Component
@Slf4j
public class HeartbeatSender {

    private final TransactionSubmitter submitter;
    private final GatewayProperties.NodeRegistry config;

    @Autowired
    public HeartbeatSender(Web3j web3j, GatewayProperties properties) {
        this(properties, createSubmitter(web3j, properties));
    }

    HeartbeatSender(GatewayProperties properties, TransactionSubmitter submitter) {
        this.config = properties.getNodeRegistry();
        this.submitter = submitter;
        if (submitter != null) {
            log.info("Heartbeat enabled for operator {} every {} ms",
                submitter.getFromAddress(), config.getHeartbeatIntervalMs());
        }
    }

    private static TransactionSubmitter createSubmitter(Web3j web3j, GatewayProperties properties) {
        GatewayProperties.NodeRegistry config = properties.getNodeRegistry();
        if (config.getContract() == null || config.getContract().isBlank()
            || config.getHeartbeatKey() == null || config.getHeartbeatKey().isBlank()) {
            return null;
        }
        return new TransactionSubmitter(web3j, Credentials.create(config.getHeartbeatKey()),
            properties.getEthereum().getChainId());
    }

    public boolean isEnabled() {
        return submitter != null;
    }

    /**
     * @return the transaction hash, or null when disabled or the send failed
     */
    @Scheduled(fixedDelayString = "${gateway.node-registry.heartbeat-interval-ms:1800000}")
    public String sendHeartbeat() {
        if (submitter == null) {
            return null;
        }
        try {
            String txHash = submitter.submit(config.getContract(),
                new Function("heartbeat", List.of(), List.of()), config.getGasLimit());
            log.info("Heartbeat sent: {}", txHash);
            return txHash;
        } catch (LedgerException e) {
            log.error("Heartbeat failed: {}", e.getMessage());
            return null;
        }
    }
}
