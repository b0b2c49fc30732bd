package sovereignvpn.gateway.service.peer;

import java.time.Instant;
import lombok.Getter;

/**
 * A provisioned tunnel peer. Identity fields are fixed; transfer counters are refreshed
 * from the interface, and a peer whose teardown failed is flagged for the next sweep.
 */
@Getter
public class Peer {

    private final String publicKey;
    private final String owner;
    private final String address;
    private final Instant assignedAt;
    private final Instant expiresAt;
    private volatile long bytesReceived;
    private volatile long bytesSent;
    private volatile boolean revoked;

    public Peer(String publicKey, String owner, String address, Instant assignedAt, Instant expiresAt) {
        this.publicKey = publicKey;
        this.owner = owner;
        this.address = address;
        this.assignedAt = assignedAt;
        this.expiresAt = expiresAt;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    void updateTransfer(long received, long sent) {
        this.bytesReceived = received;
        this.bytesSent = sent;
    }

    void markRevoked() {
        this.revoked = true;
    }
}
