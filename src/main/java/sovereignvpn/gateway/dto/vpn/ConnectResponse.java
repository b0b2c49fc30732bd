package sovereignvpn.gateway.dto.vpn;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import sovereignvpn.gateway.service.tier.AccessTier;

/**
 * WireGuard parameters for the client's tunnel config
 */
@Getter
@AllArgsConstructor
public class ConnectResponse {
    @JsonProperty("server_public_key")
    private final String serverPublicKey;
    @JsonProperty("server_endpoint")
    private final String serverEndpoint;
    @JsonProperty("client_address")
    private final String clientAddress;
    private final String dns;
    @JsonProperty("allowed_ips")
    private final String allowedIps;
    @JsonProperty("expires_at")
    private final String expiresAt;
    private final AccessTier tier;
}
