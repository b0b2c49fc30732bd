package sovereignvpn.gateway.service.revocation;

import java.util.LinkedHashSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sovereignvpn.gateway.service.delegation.DelegationResolver;
import sovereignvpn.gateway.service.session.SessionGate;
import sovereignvpn.gateway.service.tier.TierResolver;
import sovereignvpn.gateway.util.LogSanitizer;

/**
 * Applies the consequences of a gated-token transfer to caches and sessions.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionRevoker {

    static final String TRANSFER_REASON = "gated token transferred out";

    private final TierResolver tierResolver;
    private final DelegationResolver delegationResolver;
    private final SessionGate sessionGate;

    /**
     * The wallet sent tokens away: its cached answers are dropped and its session, plus the
     * sessions of hot wallets whose tier came from it as a vault, are revoked. Delegated sessions
     * are found through the session itself, so a tier cache entry that has aged out does not
     * hide them.
     */
    public void onTransferOut(String wallet) {
        Set<String> affected = new LinkedHashSet<>(tierResolver.invalidate(wallet));
        affected.addAll(sessionGate.findSessionsBackedBy(wallet));
        delegationResolver.invalidate(wallet);
        for (String affectedWallet : affected) {
            sessionGate.revoke(affectedWallet, TRANSFER_REASON);
        }
        log.info("Transfer out of {} revoked {} session(s)", LogSanitizer.maskIdentifier(wallet), affected.size());
    }

    /**
     * The wallet received tokens: only cached answers are dropped so the next lookup sees the upgrade.
     */
    public void onTransferIn(String wallet) {
        tierResolver.invalidate(wallet);
        delegationResolver.invalidate(wallet);
    }
}
