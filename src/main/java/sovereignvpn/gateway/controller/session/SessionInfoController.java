package sovereignvpn.gateway.controller.session;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import sovereignvpn.gateway.service.onchain.SessionInfo;
import sovereignvpn.gateway.service.onchain.SessionManagerClient;

/**
 * Pricing and contract details a client needs to open a paid session on-chain.
 */
@RestController
@RequestMapping("/session")
@RequiredArgsConstructor
public class SessionInfoController {

    private final SessionManagerClient sessionManagerClient;

    @GetMapping("/info")
    public ResponseEntity<SessionInfo> sessionInfo() {
        return ResponseEntity.ok(sessionManagerClient.getSessionInfo());
    }
}
