package sovereignvpn.gateway.contract;

import java.math.BigInteger;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.StaticStruct;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;

/**
 * delegate.xyz v2 {@code Delegation} struct as returned by {@code getIncomingDelegations(address)}.
 */
public class IncomingDelegation extends StaticStruct {

    public static final int TYPE_ALL = 1;
    public static final int TYPE_CONTRACT = 2;

    public final int type;
    public final String to;
    public final String from;
    public final byte[] rights;
    public final String contract;
    public final BigInteger tokenId;
    public final BigInteger amount;

    public IncomingDelegation(Uint8 type, Address to, Address from, Bytes32 rights,
                              Address contract, Uint256 tokenId, Uint256 amount) {
        super(type, to, from, rights, contract, tokenId, amount);
        this.type = type.getValue().intValue();
        this.to = to.getValue();
        this.from = from.getValue();
        this.rights = rights.getValue();
        this.contract = contract.getValue();
        this.tokenId = tokenId.getValue();
        this.amount = amount.getValue();
    }
}
