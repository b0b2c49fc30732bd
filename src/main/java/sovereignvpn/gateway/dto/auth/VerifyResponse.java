package sovereignvpn.gateway.dto.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import sovereignvpn.gateway.service.tier.AccessTier;

@Getter
@AllArgsConstructor
public class VerifyResponse {
    private final String address;
    private final AccessTier tier;
    @JsonProperty("expires_at")
    private final String expiresAt;
}
