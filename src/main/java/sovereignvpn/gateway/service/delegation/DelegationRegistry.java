package sovereignvpn.gateway.service.delegation;

import java.util.List;

/**
 * An on-chain delegation registry that maps a hot wallet to the vaults that delegated to it.
 */
public interface DelegationRegistry {

    String name();

    boolean isEnabled();

    /**
     * @return vault addresses, possibly containing duplicates
     * @throws sovereignvpn.gateway.exception.LedgerException when the registry cannot be read
     */
    List<String> findVaults(String hotWallet);
}
