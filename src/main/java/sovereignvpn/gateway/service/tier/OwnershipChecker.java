package sovereignvpn.gateway.service.tier;

/**
 * Reads the tier a wallet holds directly on the ledger, without caching or delegation.
 */
public interface OwnershipChecker {

    /**
     * @throws sovereignvpn.gateway.exception.LedgerException when the ledger cannot be read
     */
    AccessTier checkOwnership(String wallet);
}
