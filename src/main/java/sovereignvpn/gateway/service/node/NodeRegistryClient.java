package sovereignvpn.gateway.service.node;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.contract.NodeRecord;
import sovereignvpn.gateway.exception.ServiceNotConfiguredException;
import sovereignvpn.gateway.service.ledger.ContractCallService;

/**
 * Reads active nodes from the NodeRegistry contract. The full list is cached briefly;
 * region queries go to the contract each time.
 */
@Service
@Slf4j
public class NodeRegistryClient {

    private final ContractCallService contractCallService;
    private final String contract;
    private final Duration cacheTtl;
    private final Clock clock;

    private volatile CachedNodes cachedNodes;

    public NodeRegistryClient(ContractCallService contractCallService, GatewayProperties properties, Clock clock) {
        this.contractCallService = contractCallService;
        this.contract = properties.getNodeRegistry().getContract();
        this.cacheTtl = properties.getNodeRegistry().getCacheTtl();
        this.clock = clock;
    }

    public boolean isEnabled() {
        return contract != null && !contract.isBlank();
    }

    public String getContract() {
        return contract;
    }

    public List<Node> getActiveNodes() {
        requireEnabled();
        Instant now = clock.instant();
        CachedNodes cached = cachedNodes;
        if (cached != null && now.isBefore(cached.expiresAt())) {
            return cached.nodes();
        }
        List<Node> nodes = readNodes(new Function("getActiveNodes", List.of(), nodeListOutput()));
        cachedNodes = new CachedNodes(nodes, now.plus(cacheTtl));
        log.debug("Loaded {} active nodes from registry", nodes.size());
        return nodes;
    }

    public List<Node> getActiveNodesByRegion(String region) {
        requireEnabled();
        return readNodes(new Function("getActiveNodesByRegion", List.of(new Utf8String(region)), nodeListOutput()));
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private List<Node> readNodes(Function function) {
        List<Type> result = contractCallService.call(contract, function);
        List<NodeRecord> records = ((DynamicArray<NodeRecord>) result.get(0)).getValue();
        return records.stream().map(Node::from).toList();
    }

    private static List<TypeReference<?>> nodeListOutput() {
        return List.of(new TypeReference<DynamicArray<NodeRecord>>() {});
    }

    private void requireEnabled() {
        if (!isEnabled()) {
            throw new ServiceNotConfiguredException("node registry not configured");
        }
    }

    private record CachedNodes(List<Node> nodes, Instant expiresAt) {
    }
}
