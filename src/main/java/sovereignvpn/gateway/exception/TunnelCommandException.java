package sovereignvpn.gateway.exception;

/**
 * Reconfiguring the WireGuard interface failed or timed out.
 */
public class TunnelCommandException extends RuntimeException {

    public TunnelCommandException(String message) {
        super(message);
    }

    public TunnelCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
