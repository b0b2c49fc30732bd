package sovereignvpn.gateway.exception;

/**
 * Every host address of the tunnel subnet is held by a live peer.
 */
public class AddressPoolExhaustedException extends RuntimeException {

    public AddressPoolExhaustedException(String message) {
        super(message);
    }

    public AddressPoolExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
