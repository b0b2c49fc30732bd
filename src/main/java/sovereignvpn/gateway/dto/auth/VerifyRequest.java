package sovereignvpn.gateway.dto.auth;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Signed SIWE message submitted to {@code POST /auth/verify}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VerifyRequest {

    @NotBlank(message = "message is required")
    private String message;

    @NotBlank(message = "signature is required")
    private String signature;
}
