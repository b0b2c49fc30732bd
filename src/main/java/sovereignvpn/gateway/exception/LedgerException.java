package sovereignvpn.gateway.exception;

/**
 * Exception thrown when a contract read or transaction against the ledger fails.
 */
public class LedgerException extends RuntimeException {

    private final String operation;

    public LedgerException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public LedgerException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
