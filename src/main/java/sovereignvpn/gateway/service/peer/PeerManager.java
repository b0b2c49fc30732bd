package sovereignvpn.gateway.service.peer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.exception.PeerConflictException;
import sovereignvpn.gateway.exception.PeerNotFoundException;
import sovereignvpn.gateway.service.session.SessionRevokedEvent;
import sovereignvpn.gateway.util.LogSanitizer;
import sovereignvpn.gateway.util.WireGuardKeys;

/**
 * Owns the tunnel peers and the address pool behind them.
 *
 * <p>Every mutation happens under one lock, so the set of allocated pool addresses always
 * equals the set of addresses held by registered peers. A wallet has at most one peer.
 */
@Service
@Slf4j
public class PeerManager {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Peer> peersByKey = new HashMap<>();
    private final Map<String, String> keyByOwner = new HashMap<>();
    private final AddressPool pool;
    private final TunnelConfigurator tunnel;
    private final Clock clock;
    private final GatewayProperties.Tunnel tunnelProperties;

    public PeerManager(TunnelConfigurator tunnel, GatewayProperties properties, Clock clock) {
        this.tunnel = tunnel;
        this.clock = clock;
        this.tunnelProperties = properties.getTunnel();
        this.pool = new AddressPool(tunnelProperties.getSubnet());
        log.info("Tunnel address pool {} ready with {} addresses", tunnelProperties.getSubnet(), pool.getCapacity());
    }

    /**
     * Provisions a peer for {@code owner}. A previous peer of the same wallet, or an earlier
     * registration of the same key by that wallet, is replaced.
     *
     * @throws IllegalArgumentException if the key is not a WireGuard public key
     * @throws PeerConflictException if another wallet holds the key
     * @throws sovereignvpn.gateway.exception.AddressPoolExhaustedException if no address is free
     * @throws sovereignvpn.gateway.exception.TunnelCommandException if the interface rejects the peer
     */
    public PeerConfig addPeer(String owner, String publicKey, Duration ttl) {
        if (!WireGuardKeys.isValidPublicKey(publicKey)) {
            throw new IllegalArgumentException("invalid WireGuard public key");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("peer lifetime must be positive");
        }
        lock.lock();
        try {
            Peer existing = peersByKey.get(publicKey);
            if (existing != null && !existing.getOwner().equals(owner)) {
                throw new PeerConflictException("public key already registered to another wallet");
            }
            if (existing != null) {
                teardown(existing);
            }
            String previousKey = keyByOwner.get(owner);
            if (previousKey != null && peersByKey.containsKey(previousKey)) {
                teardown(peersByKey.get(previousKey));
            }

            String address = pool.allocate();
            try {
                tunnel.addPeer(publicKey, address);
            } catch (RuntimeException e) {
                pool.release(address);
                throw e;
            }

            Instant now = clock.instant();
            Peer peer = new Peer(publicKey, owner, address, now, now.plus(ttl));
            peersByKey.put(publicKey, peer);
            keyByOwner.put(owner, publicKey);
            log.info("Peer {} added for {} at {} (expires {})", LogSanitizer.maskIdentifier(publicKey),
                LogSanitizer.maskIdentifier(owner), address, peer.getExpiresAt());

            return new PeerConfig(
                tunnelProperties.getServerPublicKey(),
                tunnelProperties.getServerEndpoint(),
                address + "/" + pool.getPrefixLength(),
                tunnelProperties.getDns(),
                tunnelProperties.getAllowedIps(),
                peer.getExpiresAt());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws PeerNotFoundException if no peer holds the key
     */
    public void removePeer(String publicKey) {
        lock.lock();
        try {
            Peer peer = peersByKey.get(publicKey);
            if (peer == null) {
                throw new PeerNotFoundException("peer not found");
            }
            teardown(peer);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the peer only if it belongs to {@code owner}; another wallet's peer is reported as not found.
     */
    public void removePeer(String publicKey, String owner) {
        lock.lock();
        try {
            Peer peer = peersByKey.get(publicKey);
            if (peer == null || !peer.getOwner().equals(owner)) {
                throw new PeerNotFoundException("peer not found");
            }
            teardown(peer);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tears down the wallet's peer. A failed teardown leaves the peer flagged for the next sweep.
     *
     * @return number of peers removed
     */
    public int removePeersOwnedBy(String owner) {
        lock.lock();
        try {
            String key = keyByOwner.get(owner);
            Peer peer = key != null ? peersByKey.get(key) : null;
            if (peer == null) {
                return 0;
            }
            try {
                teardown(peer);
                return 1;
            } catch (RuntimeException e) {
                peer.markRevoked();
                log.warn("Failed to remove peer {} of {}; retrying on next sweep: {}",
                    LogSanitizer.maskIdentifier(key), LogSanitizer.maskIdentifier(owner), e.getMessage());
                return 0;
            }
        } finally {
            lock.unlock();
        }
    }

    @EventListener
    public void onSessionRevoked(SessionRevokedEvent event) {
        int removed = removePeersOwnedBy(event.wallet());
        if (removed > 0) {
            log.info("Removed tunnel peer of {} after revocation ({})",
                LogSanitizer.maskIdentifier(event.wallet()), event.reason());
        }
    }

    /**
     * Removes expired and revoked peers. A peer that cannot be removed stays for the next run.
     *
     * @return number of peers removed
     */
    @Scheduled(fixedDelayString = "${gateway.tunnel.sweep-interval-ms:60000}")
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        lock.lock();
        try {
            for (Peer peer : new ArrayList<>(peersByKey.values())) {
                if (!peer.isExpiredAt(now) && !peer.isRevoked()) {
                    continue;
                }
                try {
                    teardown(peer);
                    removed++;
                } catch (RuntimeException e) {
                    log.warn("Failed to remove expired peer {}: {}",
                        LogSanitizer.maskIdentifier(peer.getPublicKey()), e.getMessage());
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.info("Swept {} expired peers", removed);
        }
        return removed;
    }

    @Scheduled(fixedDelayString = "${gateway.tunnel.stats-interval-ms:60000}")
    public void refreshTransferStats() {
        Map<String, TunnelConfigurator.TransferStats> stats;
        try {
            stats = tunnel.readTransferStats();
        } catch (RuntimeException e) {
            log.debug("Unable to read tunnel transfer stats: {}", e.getMessage());
            return;
        }
        lock.lock();
        try {
            stats.forEach((key, value) -> {
                Peer peer = peersByKey.get(key);
                if (peer != null) {
                    peer.updateTransfer(value.received(), value.sent());
                }
            });
        } finally {
            lock.unlock();
        }
    }

    public Optional<Peer> getPeer(String publicKey) {
        lock.lock();
        try {
            return Optional.ofNullable(peersByKey.get(publicKey));
        } finally {
            lock.unlock();
        }
    }

    public Optional<Peer> findPeerByOwner(String owner) {
        lock.lock();
        try {
            String key = keyByOwner.get(owner);
            return key == null ? Optional.empty() : Optional.ofNullable(peersByKey.get(key));
        } finally {
            lock.unlock();
        }
    }

    public int getPeerCount() {
        lock.lock();
        try {
            return peersByKey.size();
        } finally {
            lock.unlock();
        }
    }

    public int getPoolCapacity() {
        return pool.getCapacity();
    }

    public int getPoolAvailable() {
        lock.lock();
        try {
            return pool.getAvailableCount();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of pool allocations next to peer addresses, taken under one lock acquisition.
     */
    public AllocationSnapshot allocationSnapshot() {
        lock.lock();
        try {
            List<String> peerAddresses = peersByKey.values().stream().map(Peer::getAddress).sorted().toList();
            List<String> poolAddresses = pool.allocatedAddresses().stream().sorted().toList();
            return new AllocationSnapshot(poolAddresses, peerAddresses);
        } finally {
            lock.unlock();
        }
    }

    private void teardown(Peer peer) {
        tunnel.removePeer(peer.getPublicKey());
        pool.release(peer.getAddress());
        peersByKey.remove(peer.getPublicKey());
        keyByOwner.remove(peer.getOwner(), peer.getPublicKey());
        log.info("Peer {} removed, released {}", LogSanitizer.maskIdentifier(peer.getPublicKey()), peer.getAddress());
    }

    public record AllocationSnapshot(List<String> poolAddresses, List<String> peerAddresses) {
    }
}
