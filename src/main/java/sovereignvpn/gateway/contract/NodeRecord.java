package sovereignvpn.gateway.contract;

import java.math.BigInteger;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicStruct;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;

/**
 * NodeRegistry {@code Node} struct as returned by {@code getActiveNodes()}.
 */
public class NodeRecord extends DynamicStruct {

    public final String operator;
    public final String endpoint;
    public final String wgPubKey;
    public final String region;
    public final BigInteger stakedAmount;
    public final BigInteger registeredAt;
    public final BigInteger lastHeartbeat;
    public final boolean active;
    public final boolean slashed;

    public NodeRecord(Address operator, Utf8String endpoint, Utf8String wgPubKey, Utf8String region,
                      Uint256 stakedAmount, Uint256 registeredAt, Uint256 lastHeartbeat,
                      Bool active, Bool slashed) {
        super(operator, endpoint, wgPubKey, region, stakedAmount, registeredAt, lastHeartbeat, active, slashed);
        this.operator = operator.getValue();
        this.endpoint = endpoint.getValue();
        this.wgPubKey = wgPubKey.getValue();
        this.region = region.getValue();
        this.stakedAmount = stakedAmount.getValue();
        this.registeredAt = registeredAt.getValue();
        this.lastHeartbeat = lastHeartbeat.getValue();
        this.active = active.getValue();
        this.slashed = slashed.getValue();
    }
}
