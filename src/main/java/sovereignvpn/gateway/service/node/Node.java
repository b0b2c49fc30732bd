package sovereignvpn.gateway.service.node;

import java.math.BigInteger;
import sovereignvpn.gateway.contract.NodeRecord;

/**
 * A VPN node registered on-chain. Timestamps are unix seconds.
 */
public record Node(
    String operator,
    String endpoint,
    String wgPubKey,
    String region,
    BigInteger stakedAmount,
    long registeredAt,
    long lastHeartbeat,
    boolean active,
    boolean slashed
) {

    static Node from(NodeRecord record) {
        return new Node(
            record.operator,
            record.endpoint,
            record.wgPubKey,
            record.region,
            record.stakedAmount,
            record.registeredAt.longValueExact(),
            record.lastHeartbeat.longValueExact(),
            record.active,
            record.slashed);
    }
}
