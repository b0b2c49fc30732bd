package sovereignvpn.gateway.util;

import java.util.Base64;

/**
 * WireGuard public keys are 32 raw bytes in standard base64 (44 chars with padding).
 * Keys are checked before they reach the {@code wg} command line.
 */
public final class WireGuardKeys {

    private static final int KEY_BYTES = 32;
    private static final int ENCODED_LENGTH = 44;

    private WireGuardKeys() {
    }

    public static boolean isValidPublicKey(String key) {
        if (key == null || key.length() != ENCODED_LENGTH || !key.endsWith("=")) {
            return false;
        }
        try {
            return Base64.getDecoder().decode(key).length == KEY_BYTES;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
