package sovereignvpn.gateway.service.delegation;

import java.math.BigInteger;
import java.util.List;
import org.springframework.stereotype.Component;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.service.ledger.ContractCallService;
import sovereignvpn.gateway.util.EthereumAddressValidator;

/**
 * 6529 NFTDelegation registry:
 * {@code retrieveDelegationAddresses(address delegate, address collection, uint256 useCase)}.
 */
@Component
public class Registry6529 implements DelegationRegistry {

    private final ContractCallService contractCallService;
    private final boolean enabled;
    private final String registryAddress;
    private final String tokenContract;
    private final BigInteger useCase;

    public Registry6529(ContractCallService contractCallService, GatewayProperties properties) {
        this.contractCallService = contractCallService;
        this.enabled = properties.getDelegation().isRegistry6529Enabled();
        this.registryAddress = properties.getDelegation().getRegistry6529Address();
        this.tokenContract = properties.getTier().getTokenContract();
        this.useCase = BigInteger.valueOf(properties.getDelegation().getRegistry6529UseCase());
    }

    @Override
    public String name() {
        return "6529";
    }

    @Override
    public boolean isEnabled() {
        return enabled && registryAddress != null && !registryAddress.isBlank();
    }

    @Override
    @SuppressWarnings({"rawtypes", "unchecked"})
    public List<String> findVaults(String hotWallet) {
        Function function = new Function(
            "retrieveDelegationAddresses",
            List.of(new Address(hotWallet), new Address(tokenContract), new Uint256(useCase)),
            List.of(new TypeReference<DynamicArray<Address>>() {}));
        List<Type> result = contractCallService.call(registryAddress, function);
        return ((DynamicArray<Address>) result.get(0)).getValue().stream()
            .map(Address::getValue)
            .filter(address -> !EthereumAddressValidator.isZeroAddress(address))
            .toList();
    }
}
