package sovereignvpn.gateway.service.node;

import java.time.Instant;

/**
 * Community reputation of an identity in one category.
 */
public record RepResult(long rating, boolean eligible, Instant checkedAt) {
}
