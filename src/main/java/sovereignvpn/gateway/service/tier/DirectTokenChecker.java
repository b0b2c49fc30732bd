package sovereignvpn.gateway.service.tier;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.exception.LedgerException;
import sovereignvpn.gateway.service.ledger.ContractCallService;
import sovereignvpn.gateway.util.LogSanitizer;

/**
 * Reads ERC-1155 balances of the gated collection with {@code balanceOfBatch}.
 * Holding the configured free card gives FREE; holding any other card gives PAID.
 */
@Component
@ConditionalOnProperty(value = "gateway.tier.mode", havingValue = "DIRECT")
@Slf4j
public class DirectTokenChecker implements OwnershipChecker {

    static final int BATCH_SIZE = 50;

    private final ContractCallService contractCallService;
    private final String tokenContract;
    private final BigInteger freeTokenId;
    private final int maxTokenId;

    public DirectTokenChecker(ContractCallService contractCallService, GatewayProperties properties) {
        this.contractCallService = contractCallService;
        this.tokenContract = properties.getTier().getTokenContract();
        this.freeTokenId = BigInteger.valueOf(properties.getTier().getFreeTokenId());
        this.maxTokenId = properties.getTier().getMaxTokenId();
    }

    @Override
    public AccessTier checkOwnership(String wallet) {
        AccessTier best = AccessTier.DENIED;
        for (int start = 1; start <= maxTokenId; start += BATCH_SIZE) {
            int end = Math.min(start + BATCH_SIZE - 1, maxTokenId);
            List<BigInteger> ids = new ArrayList<>(end - start + 1);
            for (int id = start; id <= end; id++) {
                ids.add(BigInteger.valueOf(id));
            }
            List<BigInteger> balances = balanceOfBatch(wallet, ids);
            for (int i = 0; i < ids.size(); i++) {
                if (balances.get(i).signum() <= 0) {
                    continue;
                }
                if (freeTokenId.signum() > 0 && ids.get(i).equals(freeTokenId)) {
                    log.debug("{} holds free card {}", LogSanitizer.maskIdentifier(wallet), freeTokenId);
                    return AccessTier.FREE;
                }
                best = AccessTier.PAID;
            }
        }
        return best;
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private List<BigInteger> balanceOfBatch(String wallet, List<BigInteger> ids) {
        List<Address> accounts = Collections.nCopies(ids.size(), new Address(wallet));
        Function function = new Function(
            "balanceOfBatch",
            List.of(
                new DynamicArray<>(Address.class, accounts),
                new DynamicArray<>(Uint256.class, ids.stream().map(Uint256::new).toList())),
            List.of(new TypeReference<DynamicArray<Uint256>>() {}));
        List<Type> result = contractCallService.call(tokenContract, function);
        List<Uint256> balances = ((DynamicArray<Uint256>) result.get(0)).getValue();
        if (balances.size() != ids.size()) {
            throw new LedgerException("balanceOfBatch",
                "balanceOfBatch returned " + balances.size() + " balances for " + ids.size() + " ids");
        }
        return balances.stream().map(Uint256::getValue).toList();
    }
}
