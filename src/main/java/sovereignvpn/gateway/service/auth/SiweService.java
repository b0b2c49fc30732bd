package sovereignvpn.gateway.service.auth;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SignatureException;
import java.time.Clock;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.exception.ChallengeVerificationException;
import sovereignvpn.gateway.util.EthereumAddressValidator;
import sovereignvpn.gateway.util.LogSanitizer;

/**
 * Issues SIWE challenges and verifies signed messages.
 * Verification order: signature recovery, message parsing, address, domain, chain id, nonce.
 * The nonce is only consumed once everything else checked out.
 */
@Service
@Slf4j
public class SiweService {

    static final String SIWE_VERSION = "1";
    private static final String PERSONAL_MESSAGE_PREFIX = "\u0019Ethereum Signed Message:\n";

    private final NonceStore nonceStore;
    private final Clock clock;
    private final GatewayProperties.Siwe siwe;
    private final long chainId;

    public SiweService(NonceStore nonceStore, GatewayProperties properties, Clock clock) {
        this.nonceStore = nonceStore;
        this.clock = clock;
        this.siwe = properties.getSiwe();
        this.chainId = properties.getEthereum().getChainId();
    }

    public Challenge issueChallenge() {
        return new Challenge(
            siwe.getDomain(),
            siwe.getUri(),
            SIWE_VERSION,
            chainId,
            nonceStore.issue(),
            clock.instant(),
            siwe.getStatement());
    }

    /**
     * Renders {@code challenge} as the EIP-4361 text {@code address} is asked to sign.
     */
    public String render(Challenge challenge, String address) {
        return SiweMessage.format(challenge, EthereumAddressValidator.toChecksumAddress(address));
    }

    /**
     * @return the checksummed wallet that signed {@code message}
     * @throws ChallengeVerificationException on any verification failure
     */
    public VerifiedIdentity verify(String message, String signatureHex) {
        String recovered = recoverSigner(message, signatureHex);

        SiweMessage parsed;
        try {
            parsed = SiweMessage.parse(message);
        } catch (IllegalArgumentException e) {
            throw new ChallengeVerificationException("malformed SIWE message: " + e.getMessage(), e);
        }

        if (!parsed.getAddress().equalsIgnoreCase(recovered)) {
            throw new ChallengeVerificationException("signer does not match message address");
        }
        if (!siwe.getDomain().equals(parsed.getDomain())) {
            throw new ChallengeVerificationException("domain mismatch: " + LogSanitizer.sanitize(parsed.getDomain()));
        }
        if (parsed.getChainId() != null && parsed.getChainId() != chainId) {
            throw new ChallengeVerificationException("chain id mismatch: " + parsed.getChainId());
        }
        if (!nonceStore.consume(parsed.getNonce())) {
            throw new ChallengeVerificationException("invalid or expired nonce");
        }

        String wallet = Keys.toChecksumAddress(recovered);
        log.info("SIWE verification succeeded for {}", LogSanitizer.maskIdentifier(wallet));
        return new VerifiedIdentity(wallet);
    }

    private String recoverSigner(String message, String signatureHex) {
        if (message == null || message.isEmpty()) {
            throw new ChallengeVerificationException("empty message");
        }
        byte[] signatureBytes;
        try {
            signatureBytes = Numeric.hexStringToByteArray(signatureHex);
        } catch (RuntimeException e) {
            throw new ChallengeVerificationException("signature is not valid hex", e);
        }
        if (signatureBytes.length != 65) {
            throw new ChallengeVerificationException("signature must be 65 bytes, got " + signatureBytes.length);
        }

        byte[] messageBytes = message.getBytes(StandardCharsets.UTF_8);
        byte[] prefix = (PERSONAL_MESSAGE_PREFIX + messageBytes.length).getBytes(StandardCharsets.UTF_8);
        byte[] prefixed = new byte[prefix.length + messageBytes.length];
        System.arraycopy(prefix, 0, prefixed, 0, prefix.length);
        System.arraycopy(messageBytes, 0, prefixed, prefix.length, messageBytes.length);
        byte[] messageHash = Hash.sha3(prefixed);

        byte v = signatureBytes[64];
        if (v < 27) {
            v += 27;
        }
        if (v != 27 && v != 28) {
            throw new ChallengeVerificationException("invalid signature recovery id: " + v);
        }
        Sign.SignatureData signatureData = new Sign.SignatureData(
            v,
            Arrays.copyOfRange(signatureBytes, 0, 32),
            Arrays.copyOfRange(signatureBytes, 32, 64));

        try {
            BigInteger publicKey = Sign.signedMessageHashToKey(messageHash, signatureData);
            return "0x" + Keys.getAddress(publicKey);
        } catch (SignatureException | RuntimeException e) {
            throw new ChallengeVerificationException("signature recovery failed", e);
        }
    }
}
