package sovereignvpn.gateway.dto.auth;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for {@code POST /auth/challenge}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChallengeRequest {

    @NotBlank(message = "address is required")
    private String address;
}
