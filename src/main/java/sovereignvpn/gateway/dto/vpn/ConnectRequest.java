package sovereignvpn.gateway.dto.vpn;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /vpn/connect} and {@code POST /vpn/disconnect}.
 * The session token is the wallet address returned by verify.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConnectRequest {

    @JsonProperty("session_token")
    @NotBlank(message = "session_token is required")
    private String sessionToken;

    @JsonProperty("public_key")
    @NotBlank(message = "public_key is required")
    private String publicKey;
}
