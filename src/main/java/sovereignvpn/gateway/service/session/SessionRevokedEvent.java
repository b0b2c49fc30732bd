package sovereignvpn.gateway.service.session;

/**
 * Published when a session is revoked; the peer manager tears down the wallet's tunnel peer.
 */
public record SessionRevokedEvent(String wallet, String reason) {
}
