package sovereignvpn.gateway.service.node;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.dto.node.NodeListResponse;
import sovereignvpn.gateway.dto.node.NodeResponse;
import sovereignvpn.gateway.exception.ReputationLookupException;
import sovereignvpn.gateway.util.LogSanitizer;

/**
 * Lists registry nodes whose operators hold enough community reputation.
 * With reputation checks disabled every active node is listed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NodeDirectoryService {

    private final NodeRegistryClient nodeRegistryClient;
    private final ReputationClient reputationClient;
    private final GatewayProperties properties;

    public NodeListResponse listNodes() {
        List<NodeResponse> eligible = filterEligible(nodeRegistryClient.getActiveNodes());
        return new NodeListResponse(eligible, eligible.size(), null, minRep(), repCategory());
    }

    public NodeListResponse listNodesByRegion(String region) {
        if (region == null || region.isBlank()) {
            throw new IllegalArgumentException("region query param required");
        }
        List<NodeResponse> eligible = filterEligible(nodeRegistryClient.getActiveNodesByRegion(region));
        return new NodeListResponse(eligible, eligible.size(), region, minRep(), repCategory());
    }

    private List<NodeResponse> filterEligible(List<Node> nodes) {
        List<NodeResponse> eligible = new ArrayList<>();
        for (Node node : nodes) {
            long rating = 0;
            boolean repEligible;
            if (reputationEnabled()) {
                try {
                    RepResult result = reputationClient.checkOperator(node.operator());
                    rating = result.rating();
                    repEligible = result.eligible();
                } catch (ReputationLookupException e) {
                    log.warn("Rep check failed for operator {}: {}",
                        LogSanitizer.maskIdentifier(node.operator()), LogSanitizer.sanitize(e.getMessage()));
                    repEligible = false;
                }
            } else {
                repEligible = true;
            }
            if (repEligible) {
                eligible.add(new NodeResponse(node.operator(), node.endpoint(), node.wgPubKey(),
                    node.region(), rating, true, node.active()));
            }
        }
        return eligible;
    }

    private boolean reputationEnabled() {
        GatewayProperties.Reputation reputation = properties.getReputation();
        return reputation.isEnabled() && reputation.getBaseUrl() != null && !reputation.getBaseUrl().isBlank();
    }

    private long minRep() {
        return reputationEnabled() ? properties.getReputation().getMinRep() : 0;
    }

    private String repCategory() {
        return reputationEnabled() ? properties.getReputation().getCategory() : "";
    }
}
