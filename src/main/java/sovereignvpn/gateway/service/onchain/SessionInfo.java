package sovereignvpn.gateway.service.onchain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigInteger;

/**
 * Pricing parameters a client needs before opening a paid session on-chain.
 * Wei amounts are serialized as decimal strings.
 */
public record SessionInfo(
    @JsonProperty("contract") String contract,
    @JsonProperty("chain_id") long chainId,
    @JsonProperty("node_operator") String nodeOperator,
    @JsonProperty("price_per_hour_wei") String pricePerHourWei,
    @JsonProperty("duration_seconds") BigInteger durationSeconds,
    @JsonProperty("cost_wei") String costWei
) {
}
