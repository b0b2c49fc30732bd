package sovereignvpn.gateway.controller.auth;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import sovereignvpn.gateway.dto.auth.ChallengeRequest;
import sovereignvpn.gateway.dto.auth.ChallengeResponse;
import sovereignvpn.gateway.dto.auth.VerifyRequest;
import sovereignvpn.gateway.dto.auth.VerifyResponse;
import sovereignvpn.gateway.service.access.GatewayAccessService;

/**
 * Sign-In with Ethereum endpoints
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class SiweAuthController {

    private final GatewayAccessService accessService;

    /**
     * Issues a single-use challenge for the given address.
     */
    @PostMapping("/challenge")
    public ResponseEntity<ChallengeResponse> challenge(@Valid @RequestBody ChallengeRequest request) {
        return ResponseEntity.ok(accessService.issueChallenge(request.getAddress()));
    }

    /**
     * Verifies the signed challenge and opens a session for a qualifying wallet.
     */
    @PostMapping("/verify")
    public ResponseEntity<VerifyResponse> verify(@Valid @RequestBody VerifyRequest request) {
        return ResponseEntity.ok(accessService.verify(request.getMessage(), request.getSignature()));
    }
}
