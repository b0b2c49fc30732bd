package sovereignvpn.gateway.exception;

/**
 * No tunnel peer registered for the given public key.
 */
public class PeerNotFoundException extends RuntimeException {

    public PeerNotFoundException(String message) {
        super(message);
    }

    public PeerNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
