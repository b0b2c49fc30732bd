package sovereignvpn.gateway.service.delegation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.util.EthereumAddressValidator;
import sovereignvpn.gateway.util.LogSanitizer;

/**
 * Finds the vaults that delegated to a hot wallet across every enabled registry.
 * A failing registry is logged and contributes nothing; the others still answer.
 */
@Service
@Slf4j
public class DelegationResolver {

    private final List<DelegationRegistry> registries;
    private final boolean enabled;
    private final Duration cacheTtl;
    private final Clock clock;
    private final Map<String, CachedVaults> cache = new ConcurrentHashMap<>();

    public DelegationResolver(List<DelegationRegistry> registries, GatewayProperties properties, Clock clock) {
        this.registries = registries.stream().filter(DelegationRegistry::isEnabled).toList();
        this.enabled = properties.getDelegation().isEnabled() && !this.registries.isEmpty();
        this.cacheTtl = properties.getDelegation().getCacheTtl();
        this.clock = clock;
        log.info("Delegation lookup {} (registries: {})", enabled ? "enabled" : "disabled",
            this.registries.stream().map(DelegationRegistry::name).toList());
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @return distinct vault addresses in checksum form, in registry order; empty when disabled
     */
    public Set<String> findVaults(String hotWallet) {
        if (!enabled) {
            return Set.of();
        }
        String key = EthereumAddressValidator.toChecksumAddress(hotWallet);
        Instant now = clock.instant();
        CachedVaults cached = cache.get(key);
        if (cached != null) {
            if (now.isBefore(cached.expiresAt())) {
                return cached.vaults();
            }
            cache.remove(key, cached);
        }

        Set<String> vaults = new LinkedHashSet<>();
        boolean complete = true;
        for (DelegationRegistry registry : registries) {
            try {
                for (String vault : registry.findVaults(key)) {
                    String normalized = EthereumAddressValidator.toChecksumAddress(vault);
                    if (!normalized.equals(key)) {
                        vaults.add(normalized);
                    }
                }
            } catch (RuntimeException e) {
                complete = false;
                log.warn("{} delegation lookup failed for {}: {}",
                    registry.name(), LogSanitizer.maskIdentifier(key), e.getMessage());
            }
        }

        Set<String> result = Collections.unmodifiableSet(vaults);
        // Partial answers are returned but never cached
        if (complete) {
            cache.put(key, new CachedVaults(result, now.plus(cacheTtl)));
        }
        if (!result.isEmpty()) {
            log.debug("{} has {} delegating vault(s)", LogSanitizer.maskIdentifier(key), result.size());
        }
        return result;
    }

    public void invalidate(String hotWallet) {
        cache.remove(EthereumAddressValidator.toChecksumAddress(hotWallet));
    }

    @Scheduled(fixedDelayString = "${gateway.delegation.cleanup-interval-ms:60000}")
    public int evictExpired() {
        Instant now = clock.instant();
        int before = cache.size();
        cache.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().expiresAt()));
        return before - cache.size();
    }

    public int getCacheSize() {
        return cache.size();
    }

    private record CachedVaults(Set<String> vaults, Instant expiresAt) {
    }
}
