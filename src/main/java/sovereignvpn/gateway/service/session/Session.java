package sovereignvpn.gateway.service.session;

import java.time.Instant;
import sovereignvpn.gateway.service.tier.AccessTier;

/**
 * @param vault the delegating wallet whose holdings granted the tier, or null when held directly
 */
public record Session(String wallet, AccessTier tier, Instant createdAt, Instant expiresAt, String vault) {

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isBackedBy(String wallet) {
        return vault != null && vault.equals(wallet);
    }
}
