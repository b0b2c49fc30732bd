package sovereignvpn.gateway.config;

import jakarta.annotation.PostConstruct;
import java.math.BigInteger;
import java.time.Duration;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import sovereignvpn.gateway.util.EthereumAddressValidator;

/**
 * Typed view of the {@code gateway.*} configuration tree.
 * Invalid combinations abort startup from {@link #validate()}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "gateway")
@Slf4j
public class GatewayProperties {

    public static final int MIN_NONCE_LENGTH = 8;

    private final Ethereum ethereum = new Ethereum();
    private final Siwe siwe = new Siwe();
    private final Tier tier = new Tier();
    private final Delegation delegation = new Delegation();
    private final Session session = new Session();
    private final Tunnel tunnel = new Tunnel();
    private final Revocation revocation = new Revocation();
    private final SessionManager sessionManager = new SessionManager();
    private final NodeRegistry nodeRegistry = new NodeRegistry();
    private final Reputation reputation = new Reputation();

    @PostConstruct
    public void validate() {
        if (isBlank(ethereum.getRpcUrl())) {
            throw new IllegalStateException("gateway.ethereum.rpc-url is required");
        }
        if (siwe.getNonceLength() < MIN_NONCE_LENGTH) {
            throw new IllegalStateException("gateway.siwe.nonce-length must be at least " + MIN_NONCE_LENGTH
                + " bytes, got " + siwe.getNonceLength());
        }
        if (isBlank(siwe.getDomain())) {
            throw new IllegalStateException("gateway.siwe.domain is required");
        }
        requireAddress("gateway.tier.token-contract", tier.getTokenContract());
        if (tier.getMode() == TierMode.POLICY) {
            requireAddress("gateway.tier.access-policy-contract", tier.getAccessPolicyContract());
        } else if (tier.getMaxTokenId() < 1) {
            throw new IllegalStateException("gateway.tier.max-token-id must be positive in DIRECT mode");
        }
        if (isBlank(tunnel.getSubnet())) {
            throw new IllegalStateException("gateway.tunnel.subnet is required");
        }
        optionalAddress("gateway.session-manager.contract", sessionManager.getContract());
        optionalAddress("gateway.node-registry.contract", nodeRegistry.getContract());
        if (isBlank(tunnel.getServerPublicKey())) {
            log.warn("gateway.tunnel.server-public-key is empty; clients will not be able to complete a handshake");
        }
        log.info("Gateway configuration loaded: chainId={}, tierMode={}, delegation={}, sessionManager={}, nodeRegistry={}",
            ethereum.getChainId(), tier.getMode(), delegation.isEnabled(),
            !isBlank(sessionManager.getContract()), !isBlank(nodeRegistry.getContract()));
    }

    private static void requireAddress(String key, String value) {
        if (isBlank(value)) {
            throw new IllegalStateException(key + " is required");
        }
        optionalAddress(key, value);
    }

    private static void optionalAddress(String key, String value) {
        if (!isBlank(value) && !EthereumAddressValidator.isValidAddress(value)) {
            throw new IllegalStateException(key + " is not a valid address: " + value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public enum TierMode {
        /** Ask an AccessPolicy contract via checkAccess(address). */
        POLICY,
        /** Read ERC-1155 balances of the gated collection directly. */
        DIRECT
    }

    @Data
    public static class Ethereum {
        private String rpcUrl;
        private long chainId = 11155111L;
        private Duration callTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Siwe {
        private String domain = "sovereignvpn.network";
        private String uri = "https://sovereignvpn.network";
        private String statement = "Sign in to Sovereign VPN with your Ethereum account.";
        private int nonceLength = 16;
        private Duration challengeTtl = Duration.ofMinutes(5);
        private long cleanupIntervalMs = 60_000L;
    }

    @Data
    public static class Tier {
        private TierMode mode = TierMode.POLICY;
        private String accessPolicyContract;
        /** The gated ERC-1155 collection. */
        private String tokenContract;
        /** Token id whose holders get the free tier in DIRECT mode; 0 disables it. */
        private long freeTokenId;
        private int maxTokenId = 350;
        private Duration cacheTtl = Duration.ofMinutes(5);
        private long cleanupIntervalMs = 60_000L;
    }

    @Data
    public static class Delegation {
        private boolean enabled = true;
        private boolean delegateXyzEnabled = true;
        private String delegateXyzAddress = "0x00000000000000447e69651d841bD8D104Bed493";
        private boolean registry6529Enabled = true;
        private String registry6529Address = "0x2202CB9c00487e7e8EF21e6d8E914B32e709f43d";
        private long registry6529UseCase = 1L;
        private Duration cacheTtl = Duration.ofMinutes(5);
        private long cleanupIntervalMs = 60_000L;
    }

    @Data
    public static class Session {
        private Duration credentialTtl = Duration.ofHours(24);
        private long sweepIntervalMs = 60_000L;
    }

    @Data
    public static class Tunnel {
        private String interfaceName = "wg0";
        private String wgBinary = "wg";
        private String serverPublicKey = "";
        private String serverEndpoint = "";
        private String subnet = "10.8.0.0/24";
        private String dns = "1.1.1.1";
        private String allowedIps = "0.0.0.0/0, ::/0";
        private Duration commandTimeout = Duration.ofSeconds(5);
        private long sweepIntervalMs = 60_000L;
        private long statsIntervalMs = 60_000L;
    }

    @Data
    public static class Revocation {
        private boolean enabled = true;
        private Duration retryDelay = Duration.ofSeconds(10);
    }

    @Data
    public static class SessionManager {
        private String contract;
        /** Hex private key used for openFreeSession/closeSession; empty means read-only. */
        private String operatorKey;
        private BigInteger gasLimit = BigInteger.valueOf(150_000L);
        private int writeQueueCapacity = 100;
    }

    @Data
    public static class NodeRegistry {
        private String contract;
        private Duration cacheTtl = Duration.ofMinutes(2);
        /** Hex private key of the node operator; empty disables heartbeats. */
        private String heartbeatKey;
        private long heartbeatIntervalMs = 1_800_000L;
        private BigInteger gasLimit = BigInteger.valueOf(100_000L);
    }

    @Data
    public static class Reputation {
        private boolean enabled = true;
        private String baseUrl = "https://api.6529.io/api";
        private String category = "VPN Operator";
        private long minRep = 50_000L;
        private boolean userBanCheck;
        private String userBanCategory = "VPN User";
        private Duration cacheTtl = Duration.ofMinutes(5);
        private Duration httpTimeout = Duration.ofSeconds(10);
        private long cleanupIntervalMs = 300_000L;
    }
}
