package sovereignvpn.gateway.exception;

/**
 * The wallet resolved to the denied tier, or was banned by reputation.
 */
public class TierDeniedException extends RuntimeException {

    private final String address;

    public TierDeniedException(String address, String message) {
        super(message);
        this.address = address;
    }

    public String getAddress() {
        return address;
    }
}
