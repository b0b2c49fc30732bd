package sovereignvpn.gateway.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import sovereignvpn.gateway.service.tier.AccessTier;
import sovereignvpn.gateway.util.LogSanitizer;

/**
 * Maps gateway exceptions to {@code {"error": ...}} bodies.
 * Client errors are logged at WARN, upstream and unexpected failures at ERROR.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getAllErrors().stream()
            .map(error -> error instanceof FieldError fieldError
                ? fieldError.getDefaultMessage()
                : error.getDefaultMessage())
            .findFirst()
            .orElse("invalid request");
        log.warn("Validation error: {}", message);
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", LogSanitizer.sanitize(ex.getMostSpecificCause().getMessage()));
        return error(HttpStatus.BAD_REQUEST, "invalid request body");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getParameterName() + " query parameter required");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", LogSanitizer.sanitize(ex.getMessage()));
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(ChallengeVerificationException.class)
    public ResponseEntity<Map<String, Object>> handleChallengeVerification(ChallengeVerificationException ex) {
        log.warn("SIWE verification failed: {}", LogSanitizer.sanitize(ex.getMessage()));
        return error(HttpStatus.UNAUTHORIZED, "signature verification failed: " + ex.getMessage());
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleSessionNotFound(SessionNotFoundException ex) {
        return error(HttpStatus.UNAUTHORIZED, ex.getMessage());
    }

    @ExceptionHandler(PaymentRequiredException.class)
    public ResponseEntity<Map<String, Object>> handlePaymentRequired(PaymentRequiredException ex) {
        return error(HttpStatus.PAYMENT_REQUIRED, ex.getMessage());
    }

    @ExceptionHandler(TierDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleTierDenied(TierDeniedException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (ex.getAddress() != null) {
            body.put("address", ex.getAddress());
        }
        body.put("tier", AccessTier.DENIED.label());
        body.put("error", ex.getMessage());
        log.info("Access denied for {}: {}", LogSanitizer.maskIdentifier(ex.getAddress()), ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body);
    }

    @ExceptionHandler(PeerNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handlePeerNotFound(PeerNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(PeerConflictException.class)
    public ResponseEntity<Map<String, Object>> handlePeerConflict(PeerConflictException ex) {
        log.warn("Peer conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(AddressPoolExhaustedException.class)
    public ResponseEntity<Map<String, Object>> handlePoolExhausted(AddressPoolExhaustedException ex) {
        log.error("Tunnel address pool exhausted: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(ServiceNotConfiguredException.class)
    public ResponseEntity<Map<String, Object>> handleNotConfigured(ServiceNotConfiguredException ex) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Map<String, Object>> handleLedgerException(LedgerException ex) {
        log.error("Ledger error [{}]: {}", ex.getOperation(), ex.getMessage(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "blockchain service temporarily unavailable");
    }

    @ExceptionHandler(TunnelCommandException.class)
    public ResponseEntity<Map<String, Object>> handleTunnelCommand(TunnelCommandException ex) {
        log.error("Tunnel reconfiguration failed: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "failed to provision VPN connection");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        // Full stack trace stays in the log, never in the response
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal server error");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
