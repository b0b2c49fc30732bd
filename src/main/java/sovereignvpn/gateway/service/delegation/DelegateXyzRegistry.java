package sovereignvpn.gateway.service.delegation;

import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.contract.IncomingDelegation;
import sovereignvpn.gateway.service.ledger.ContractCallService;
import sovereignvpn.gateway.util.EthereumAddressValidator;

/**
 * delegate.xyz v2. Wallet-wide (ALL) delegations and CONTRACT delegations scoped to
 * the gated collection count; token-level delegations do not.
 */
@Component
public class DelegateXyzRegistry implements DelegationRegistry {

    private final ContractCallService contractCallService;
    private final boolean enabled;
    private final String registryAddress;
    private final String tokenContract;

    public DelegateXyzRegistry(ContractCallService contractCallService, GatewayProperties properties) {
        this.contractCallService = contractCallService;
        this.enabled = properties.getDelegation().isDelegateXyzEnabled();
        this.registryAddress = properties.getDelegation().getDelegateXyzAddress();
        this.tokenContract = properties.getTier().getTokenContract();
    }

    @Override
    public String name() {
        return "delegate.xyz";
    }

    @Override
    public boolean isEnabled() {
        return enabled && registryAddress != null && !registryAddress.isBlank();
    }

    @Override
    @SuppressWarnings({"rawtypes", "unchecked"})
    public List<String> findVaults(String hotWallet) {
        Function function = new Function(
            "getIncomingDelegations",
            List.of(new Address(hotWallet)),
            List.of(new TypeReference<DynamicArray<IncomingDelegation>>() {}));
        List<Type> result = contractCallService.call(registryAddress, function);
        List<IncomingDelegation> delegations = ((DynamicArray<IncomingDelegation>) result.get(0)).getValue();

        List<String> vaults = new ArrayList<>();
        for (IncomingDelegation delegation : delegations) {
            boolean applies = delegation.type == IncomingDelegation.TYPE_ALL
                || (delegation.type == IncomingDelegation.TYPE_CONTRACT
                    && delegation.contract.equalsIgnoreCase(tokenContract));
            if (applies && !EthereumAddressValidator.isZeroAddress(delegation.from)) {
                vaults.add(delegation.from);
            }
        }
        return vaults;
    }
}
