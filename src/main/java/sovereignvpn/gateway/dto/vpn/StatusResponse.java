package sovereignvpn.gateway.dto.vpn;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import sovereignvpn.gateway.service.tier.AccessTier;

@Getter
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusResponse {
    private final boolean connected;
    private final AccessTier tier;
    @JsonProperty("expires_at")
    private final String expiresAt;
    private final String reason;

    public static StatusResponse active(AccessTier tier, String expiresAt) {
        return new StatusResponse(true, tier, expiresAt, null);
    }

    public static StatusResponse inactive(String reason) {
        return new StatusResponse(false, null, null, reason);
    }
}
