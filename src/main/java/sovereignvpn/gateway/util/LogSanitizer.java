package sovereignvpn.gateway.util;

import java.util.regex.Pattern;

/**
 * Helpers that make user controlled values safe for logging.
 * Control characters are replaced to prevent log injection and identifiers
 * such as wallets, nonces and tunnel keys can be masked.
 */
public final class LogSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\r\\n\\t]+");

    private LogSanitizer() {
        // Utility class
    }

    /**
     * Removes control characters that could be abused for log injection.
     *
     * @param value User provided value
     * @return Sanitized value safe for log statements
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("_");
    }

    /**
     * Masks an identifier while keeping enough of both ends to correlate log lines.
     *
     * @param identifier Wallet address, nonce or tunnel public key
     * @return Short masked representation
     */
    public static String maskIdentifier(String identifier) {
        String sanitized = sanitize(identifier);
        if (sanitized.isEmpty()) {
            return "";
        }
        if (sanitized.length() == 1) {
            return "*";
        }
        if (sanitized.length() <= 4) {
            return sanitized.charAt(0) + "***";
        }
        int prefixLength = Math.min(6, sanitized.length() / 2);
        int suffixLength = Math.min(4, Math.max(1, sanitized.length() - prefixLength));
        return sanitized.substring(0, prefixLength) + "..." + sanitized.substring(sanitized.length() - suffixLength);
    }
}
