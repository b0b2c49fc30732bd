package sovereignvpn.gateway.exception;

/**
 * Signed SIWE message rejected: bad signature, wrong domain or address, or an unknown, used or expired nonce.
 */
public class ChallengeVerificationException extends RuntimeException {

    public ChallengeVerificationException(String message) {
        super(message);
    }

    public ChallengeVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
