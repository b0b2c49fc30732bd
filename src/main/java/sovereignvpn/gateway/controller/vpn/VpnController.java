package sovereignvpn.gateway.controller.vpn;

import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import sovereignvpn.gateway.dto.vpn.ConnectRequest;
import sovereignvpn.gateway.dto.vpn.ConnectResponse;
import sovereignvpn.gateway.dto.vpn.StatusResponse;
import sovereignvpn.gateway.service.access.GatewayAccessService;

@RestController
@RequestMapping("/vpn")
@RequiredArgsConstructor
public class VpnController {

    private final GatewayAccessService accessService;

    @PostMapping("/connect")
    public ResponseEntity<ConnectResponse> connect(@Valid @RequestBody ConnectRequest request) {
        return ResponseEntity.ok(accessService.connect(request.getSessionToken(), request.getPublicKey()));
    }

    @PostMapping("/disconnect")
    public ResponseEntity<Map<String, String>> disconnect(@Valid @RequestBody ConnectRequest request) {
        accessService.disconnect(request.getSessionToken(), request.getPublicKey());
        return ResponseEntity.ok(Map.of("status", "disconnected"));
    }

    @GetMapping("/status")
    public ResponseEntity<StatusResponse> status(@RequestParam("session_token") String sessionToken) {
        if (sessionToken.isBlank()) {
            throw new IllegalArgumentException("session_token query param required");
        }
        return ResponseEntity.ok(accessService.status(sessionToken));
    }
}
