package sovereignvpn.gateway.service.onchain;

import java.math.BigInteger;

/**
 * A session as recorded by the SessionManager contract.
 *
 * @param payment  wei paid; zero for free sessions and for unknown ids
 * @param duration seconds
 */
public record OnChainSession(
    String user,
    String node,
    BigInteger payment,
    BigInteger startedAt,
    BigInteger duration,
    boolean active,
    boolean settled
) {
}
