package sovereignvpn.gateway.dto.auth;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * EIP-4361 message for the client to sign, plus its nonce
 */
@Getter
@AllArgsConstructor
public class ChallengeResponse {
    private final String message;
    private final String nonce;
}
