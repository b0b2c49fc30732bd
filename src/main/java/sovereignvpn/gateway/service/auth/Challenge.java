package sovereignvpn.gateway.service.auth;

import java.time.Instant;

/**
 * Parameters of an issued Sign-In-With-Ethereum challenge.
 */
public record Challenge(
    String domain,
    String uri,
    String version,
    long chainId,
    String nonce,
    Instant issuedAt,
    String statement
) {
}
