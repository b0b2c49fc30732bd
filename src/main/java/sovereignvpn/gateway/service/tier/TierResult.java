package sovereignvpn.gateway.service.tier;

import java.time.Instant;

/**
 * @param vault the delegating wallet the tier came from, or null when held directly
 */
public record TierResult(AccessTier tier, Instant checkedAt, String vault) {

    public boolean viaDelegation() {
        return vault != null;
    }
}
