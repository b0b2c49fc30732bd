package sovereignvpn.gateway.service.peer;

import java.util.Map;

/**
 * Applies peer changes to the tunnel interface.
 */
public interface TunnelConfigurator {

    /**
     * Adds or updates a peer allowed to use exactly {@code address}/32.
     *
     * @throws sovereignvpn.gateway.exception.TunnelCommandException on failure or timeout
     */
    void addPeer(String publicKey, String address);

    /**
     * @throws sovereignvpn.gateway.exception.TunnelCommandException on failure or timeout
     */
    void removePeer(String publicKey);

    /**
     * Per-peer transfer counters keyed by public key.
     */
    Map<String, TransferStats> readTransferStats();

    record TransferStats(long received, long sent) {
    }
}
