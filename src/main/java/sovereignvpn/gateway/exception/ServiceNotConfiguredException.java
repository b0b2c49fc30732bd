package sovereignvpn.gateway.exception;

/**
 * Optional integration (session manager, node registry) is not configured.
 */
public class ServiceNotConfiguredException extends RuntimeException {

    public ServiceNotConfiguredException(String message) {
        super(message);
    }

    public ServiceNotConfiguredException(String message, Throwable cause) {
        super(message, cause);
    }
}
