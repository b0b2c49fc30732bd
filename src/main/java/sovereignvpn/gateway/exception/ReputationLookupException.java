package sovereignvpn.gateway.exception;

/**
 * The reputation API could not be reached or answered with an error.
 */
public class ReputationLookupException extends RuntimeException {

    public ReputationLookupException(String message) {
        super(message);
    }

    public ReputationLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
