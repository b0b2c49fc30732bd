package sovereignvpn.gateway.controller.health;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import sovereignvpn.gateway.service.onchain.SessionManagerClient;
import sovereignvpn.gateway.service.peer.PeerManager;
import sovereignvpn.gateway.service.revocation.TransferEventWatcher;
import sovereignvpn.gateway.service.session.SessionGate;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final SessionGate sessionGate;
    private final PeerManager peerManager;
    private final TransferEventWatcher transferEventWatcher;
    private final SessionManagerClient sessionManagerClient;
    private final Clock clock;

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> healthStatus = new LinkedHashMap<>();
        healthStatus.put("status", "ok");
        healthStatus.put("time", clock.instant().truncatedTo(ChronoUnit.SECONDS).toString());
        healthStatus.put("active_sessions", sessionGate.getActiveSessionCount());
        healthStatus.put("active_peers", peerManager.getPeerCount());
        healthStatus.put("pool_capacity", peerManager.getPoolCapacity());
        healthStatus.put("pool_available", peerManager.getPoolAvailable());
        healthStatus.put("revocation_watcher", transferEventWatcher.getState().name().toLowerCase());
        healthStatus.put("onchain_write_failures", sessionManagerClient.getFailedWriteCount());
        return ResponseEntity.ok(healthStatus);
    }
}
