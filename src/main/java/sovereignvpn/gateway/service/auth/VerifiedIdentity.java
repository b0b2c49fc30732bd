package sovereignvpn.gateway.service.auth;

/**
 * Wallet proven to control the SIWE signature, in checksum form.
 */
public record VerifiedIdentity(String wallet) {
}
