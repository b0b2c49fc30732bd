package sovereignvpn.gateway.exception;

/**
 * Tunnel public key already bound to another wallet.
 */
public class PeerConflictException extends RuntimeException {

    public PeerConflictException(String message) {
        super(message);
    }

    public PeerConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
