package sovereignvpn.gateway.util;

import java.util.regex.Pattern;
import org.web3j.crypto.Keys;

/**
 * Validation and normalization of Ethereum addresses.
 * Every wallet that enters the gateway is normalized to its EIP-55 checksum form
 * so caches and session maps agree on a single key per account.
 */
public final class EthereumAddressValidator {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private EthereumAddressValidator() {
    }

    /**
     * Accepts all-lowercase, all-uppercase or correctly checksummed mixed-case addresses.
     */
    public static boolean isValidAddress(String address) {
        if (address == null || !ADDRESS_PATTERN.matcher(address).matches()) {
            return false;
        }
        String body = address.substring(2);
        if (body.equals(body.toLowerCase()) || body.equals(body.toUpperCase())) {
            return true;
        }
        return Keys.toChecksumAddress(address).equals(address);
    }

    /**
     * @throws IllegalArgumentException if the address is malformed or has a bad checksum
     */
    public static String toChecksumAddress(String address) {
        if (!isValidAddress(address)) {
            throw new IllegalArgumentException("Invalid Ethereum address: " + LogSanitizer.sanitize(address));
        }
        return Keys.toChecksumAddress(address.toLowerCase());
    }

    public static boolean isZeroAddress(String address) {
        return address == null || ZERO_ADDRESS.equalsIgnoreCase(address);
    }

    /**
     * Extracts the address held in the low 20 bytes of an indexed event topic.
     */
    public static String fromTopic(String topic) {
        if (topic == null || topic.length() < 40) {
            throw new IllegalArgumentException("Topic too short to hold an address");
        }
        return Keys.toChecksumAddress("0x" + topic.substring(topic.length() - 40).toLowerCase());
    }
}
