package sovereignvpn.gateway.service.peer;

import java.time.Instant;

/**
 * Client-side tunnel parameters returned after a peer is provisioned.
 *
 * @param clientAddress allocated address with the subnet prefix, e.g. {@code 10.8.0.2/24}
 */
public record PeerConfig(
    String serverPublicKey,
    String serverEndpoint,
    String clientAddress,
    String dns,
    String allowedIps,
    Instant expiresAt
) {
}
