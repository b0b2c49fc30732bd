package sovereignvpn.gateway.service.tier;

import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.service.ledger.ContractCallService;

/**
 * Asks the AccessPolicy contract: {@code checkAccess(address) returns (bool hasAccess, bool isFree)}.
 */
@Component
@ConditionalOnProperty(value = "gateway.tier.mode", havingValue = "POLICY", matchIfMissing = true)
public class AccessPolicyChecker implements OwnershipChecker {

    private final ContractCallService contractCallService;
    private final String policyContract;

    public AccessPolicyChecker(ContractCallService contractCallService, GatewayProperties properties) {
        this.contractCallService = contractCallService;
        this.policyContract = properties.getTier().getAccessPolicyContract();
    }

    @Override
    @SuppressWarnings("rawtypes")
    public AccessTier checkOwnership(String wallet) {
        Function function = new Function(
            "checkAccess",
            List.of(new Address(wallet)),
            List.of(new TypeReference<Bool>() {}, new TypeReference<Bool>() {}));
        List<Type> result = contractCallService.call(policyContract, function);
        boolean hasAccess = ((Bool) result.get(0)).getValue();
        boolean isFree = ((Bool) result.get(1)).getValue();
        if (isFree) {
            return AccessTier.FREE;
        }
        return hasAccess ? AccessTier.PAID : AccessTier.DENIED;
    }
}
