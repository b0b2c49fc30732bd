package sovereignvpn.gateway.dto.node;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Public view of a registered VPN node.
 */
@Getter
@AllArgsConstructor
public class NodeResponse {
    private final String operator;
    private final String endpoint;
    @JsonProperty("wg_pub_key")
    private final String wgPubKey;
    private final String region;
    private final long rep;
    @JsonProperty("rep_eligible")
    private final boolean repEligible;
    private final boolean active;
}
