package sovereignvpn.gateway.testsupport;

import java.util.Arrays;
import java.util.Base64;

/**
 * Deterministic WireGuard public keys for tests.
 */
public final class TunnelKeys {

    private TunnelKeys() {
    }

    public static String key(int seed) {
        byte[] raw = new byte[32];
        Arrays.fill(raw, (byte) seed);
        return Base64.getEncoder().encodeToString(raw);
    }
}
