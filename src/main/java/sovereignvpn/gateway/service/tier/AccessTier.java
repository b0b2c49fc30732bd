package sovereignvpn.gateway.service.tier;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Access level, ordered {@code DENIED < PAID < FREE}.
 */
public enum AccessTier {
    DENIED("denied"),
    PAID("paid"),
    FREE("free");

    private final String label;

    AccessTier(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean grantsAccess() {
        return this != DENIED;
    }

    public static AccessTier max(AccessTier a, AccessTier b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    @Override
    public String toString() {
        return label;
    }
}
