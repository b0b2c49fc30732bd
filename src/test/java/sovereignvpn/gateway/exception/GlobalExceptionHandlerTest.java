package sovereignvpn.gateway.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    @DisplayName("Unexpected errors never leak their message")
    void genericErrorIsOpaque() {
        ResponseEntity<Map<String, Object>> response =
            handler.handleGenericException(new IllegalStateException("db password is hunter2"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).containsEntry("error", "internal server error");
    }

    @Test
    @DisplayName("Ledger errors hide the RPC detail")
    void ledgerErrorIsOpaque() {
        ResponseEntity<Map<String, Object>> response = handler.handleLedgerException(
            new LedgerException("checkAccess", "checkAccess failed: https://rpc.example/v3/secret-key unreachable"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).containsEntry("error", "blockchain service temporarily unavailable");
    }

    @Test
    @DisplayName("Denials carry the address and the denied tier")
    void tierDenied() {
        ResponseEntity<Map<String, Object>> response = handler.handleTierDenied(
            new TierDeniedException("0x1111111111111111111111111111111111111111", "wallet holds no qualifying token"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(response.getBody())
            .containsEntry("address", "0x1111111111111111111111111111111111111111")
            .containsEntry("tier", "denied")
            .containsEntry("error", "wallet holds no qualifying token");
    }

    @Test
    @DisplayName("Denials without an address omit it")
    void tierDeniedWithoutAddress() {
        ResponseEntity<Map<String, Object>> response =
            handler.handleTierDenied(new TierDeniedException(null, "access denied"));

        assertThat(response.getBody()).doesNotContainKey("address");
    }

    @Test
    @DisplayName("Client errors map to their status codes")
    void statusMapping() {
        assertThat(handler.handleSessionNotFound(new SessionNotFoundException("x")).getStatusCode())
            .isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(handler.handlePaymentRequired(new PaymentRequiredException("x")).getStatusCode())
            .isEqualTo(HttpStatus.PAYMENT_REQUIRED);
        assertThat(handler.handlePeerNotFound(new PeerNotFoundException("x")).getStatusCode())
            .isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(handler.handlePeerConflict(new PeerConflictException("x")).getStatusCode())
            .isEqualTo(HttpStatus.CONFLICT);
        assertThat(handler.handlePoolExhausted(new AddressPoolExhaustedException("x")).getStatusCode())
            .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(handler.handleNotConfigured(new ServiceNotConfiguredException("x")).getStatusCode())
            .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(handler.handleChallengeVerification(new ChallengeVerificationException("x")).getStatusCode())
            .isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(handler.handleIllegalArgumentException(new IllegalArgumentException("x")).getStatusCode())
            .isEqualTo(HttpStatus.BAD_REQUEST);
    }
}
