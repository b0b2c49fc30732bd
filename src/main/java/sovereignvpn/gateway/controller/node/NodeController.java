package sovereignvpn.gateway.controller.node;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import sovereignvpn.gateway.dto.node.NodeListResponse;
import sovereignvpn.gateway.service.node.NodeDirectoryService;

/**
 * Discovery of registered VPN nodes whose operators meet the reputation bar
 */
@RestController
@RequestMapping("/nodes")
@RequiredArgsConstructor
public class NodeController {

    private final NodeDirectoryService nodeDirectoryService;

    @GetMapping
    public ResponseEntity<NodeListResponse> listNodes() {
        return ResponseEntity.ok(nodeDirectoryService.listNodes());
    }

    @GetMapping("/region")
    public ResponseEntity<NodeListResponse> listNodesByRegion(@RequestParam("region") String region) {
        return ResponseEntity.ok(nodeDirectoryService.listNodesByRegion(region));
    }
}
