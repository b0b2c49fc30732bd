package sovereignvpn.gateway.service.tier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.service.delegation.DelegationResolver;
import sovereignvpn.gateway.util.EthereumAddressValidator;
import sovereignvpn.gateway.util.LogSanitizer;

/**
 * Resolves a wallet's access tier: cached answer, else a direct ledger read, else the best
 * tier among the vaults that delegated to it.
 *
 * <p>Expired entries are never served. An {@link #invalidate(String)} that happens while a
 * resolution is in flight prevents that resolution from writing its answer to the cache.
 */
@Service
@Slf4j
public class TierResolver {

    private final OwnershipChecker ownershipChecker;
    private final DelegationResolver delegationResolver;
    private final Clock clock;
    private final Duration cacheTtl;

    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();
    private final AtomicLong invalidations = new AtomicLong();

    public TierResolver(OwnershipChecker ownershipChecker, DelegationResolver delegationResolver,
                        GatewayProperties properties, Clock clock) {
        this.ownershipChecker = ownershipChecker;
        this.delegationResolver = delegationResolver;
        this.clock = clock;
        this.cacheTtl = properties.getTier().getCacheTtl();
    }

    /**
     * @throws sovereignvpn.gateway.exception.LedgerException if the wallet's own holdings cannot be read
     */
    public TierResult resolve(String wallet) {
        String key = EthereumAddressValidator.toChecksumAddress(wallet);
        Instant now = clock.instant();
        CacheEntry cached = cache.get(key);
        if (cached != null) {
            if (now.isBefore(cached.expiresAt())) {
                return cached.result();
            }
            cache.remove(key, cached);
        }

        long generation = invalidations.get();
        AccessTier tier = ownershipChecker.checkOwnership(key);
        String vault = null;
        boolean complete = true;

        if (tier == AccessTier.DENIED && delegationResolver.isEnabled()) {
            Set<String> vaults;
            try {
                vaults = delegationResolver.findVaults(key);
            } catch (RuntimeException e) {
                log.warn("Delegation lookup failed for {}: {}", LogSanitizer.maskIdentifier(key), e.getMessage());
                vaults = Set.of();
                complete = false;
            }
            for (String candidate : vaults) {
                AccessTier vaultTier;
                try {
                    vaultTier = ownershipChecker.checkOwnership(candidate);
                } catch (RuntimeException e) {
                    log.warn("Tier check failed for vault {} of {}: {}", LogSanitizer.maskIdentifier(candidate),
                        LogSanitizer.maskIdentifier(key), e.getMessage());
                    complete = false;
                    continue;
                }
                if (vaultTier.compareTo(tier) > 0) {
                    tier = vaultTier;
                    vault = candidate;
                }
                if (tier == AccessTier.FREE) {
                    break;
                }
            }
            if (vault != null) {
                log.info("{} resolved to {} via vault {}", LogSanitizer.maskIdentifier(key), tier,
                    LogSanitizer.maskIdentifier(vault));
            }
        }

        TierResult result = new TierResult(tier, now, vault);
        // A denial built from partial data is not cached
        if (complete || tier == AccessTier.FREE) {
            CacheEntry entry = new CacheEntry(result, now.plus(cacheTtl));
            cache.put(key, entry);
            if (invalidations.get() != generation) {
                cache.remove(key, entry);
            }
        }
        return result;
    }

    /**
     * Drops the cached tier of {@code wallet} and of every hot wallet whose cached tier was
     * derived from {@code wallet} as a vault.
     *
     * @return the affected wallets, {@code wallet} first
     */
    public Set<String> invalidate(String wallet) {
        String key = EthereumAddressValidator.toChecksumAddress(wallet);
        invalidations.incrementAndGet();
        Set<String> affected = new LinkedHashSet<>();
        affected.add(key);
        cache.remove(key);
        for (Map.Entry<String, CacheEntry> entry : cache.entrySet()) {
            if (key.equals(entry.getValue().result().vault()) && cache.remove(entry.getKey(), entry.getValue())) {
                affected.add(entry.getKey());
            }
        }
        return affected;
    }

    @Scheduled(fixedDelayString = "${gateway.tier.cleanup-interval-ms:60000}")
    public int evictExpired() {
        Instant now = clock.instant();
        int before = cache.size();
        cache.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().expiresAt()));
        return before - cache.size();
    }

    public int getCacheSize() {
        return cache.size();
    }

    private record CacheEntry(TierResult result, Instant expiresAt) {
    }
}
