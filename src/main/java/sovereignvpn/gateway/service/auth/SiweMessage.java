package sovereignvpn.gateway.service.auth;

import java.time.temporal.ChronoUnit;
import java.util.regex.Pattern;
import lombok.Builder;
import lombok.Getter;

/**
 * EIP-4361 message text: rendering for issued challenges and the subset of
 * parsing needed to verify a signed one.
 */
@Getter
@Builder
public class SiweMessage {

    private static final String HEADER_SUFFIX = " wants you to sign in with your Ethereum account:";
    private static final Pattern HEX_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private static final String URI_PREFIX = "URI: ";
    private static final String VERSION_PREFIX = "Version: ";
    private static final String CHAIN_ID_PREFIX = "Chain ID: ";
    private static final String NONCE_PREFIX = "Nonce: ";
    private static final String ISSUED_AT_PREFIX = "Issued At: ";

    private final String domain;
    private final String address;
    private final String uri;
    private final String version;
    private final Long chainId;
    private final String nonce;
    private final String issuedAt;

    /**
     * Renders the message a wallet is asked to sign. No trailing newline.
     */
    public static String format(Challenge challenge, String address) {
        StringBuilder sb = new StringBuilder();
        sb.append(challenge.domain()).append(HEADER_SUFFIX).append('\n');
        sb.append(address).append("\n\n");
        if (challenge.statement() != null && !challenge.statement().isEmpty()) {
            sb.append(challenge.statement()).append("\n\n");
        }
        sb.append(URI_PREFIX).append(challenge.uri()).append('\n');
        sb.append(VERSION_PREFIX).append(challenge.version()).append('\n');
        sb.append(CHAIN_ID_PREFIX).append(challenge.chainId()).append('\n');
        sb.append(NONCE_PREFIX).append(challenge.nonce()).append('\n');
        sb.append(ISSUED_AT_PREFIX).append(challenge.issuedAt().truncatedTo(ChronoUnit.SECONDS));
        return sb.toString();
    }

    /**
     * Extracts domain, address, nonce and the optional URI, version, chain id and issued-at fields.
     *
     * @throws IllegalArgumentException if the header, address line or nonce is missing or malformed
     */
    public static SiweMessage parse(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("empty message");
        }
        String[] lines = message.split("\n", -1);
        if (lines.length < 2) {
            throw new IllegalArgumentException("message too short");
        }
        int headerEnd = lines[0].indexOf(HEADER_SUFFIX);
        if (headerEnd <= 0) {
            throw new IllegalArgumentException("missing SIWE header");
        }
        String address = lines[1].trim();
        if (!HEX_ADDRESS.matcher(address).matches()) {
            throw new IllegalArgumentException("invalid address line");
        }

        SiweMessageBuilder builder = SiweMessage.builder()
            .domain(lines[0].substring(0, headerEnd))
            .address(address);
        String nonce = null;
        for (int i = 2; i < lines.length; i++) {
            String line = lines[i];
            if (line.startsWith(NONCE_PREFIX)) {
                nonce = line.substring(NONCE_PREFIX.length()).trim();
            } else if (line.startsWith(URI_PREFIX)) {
                builder.uri(line.substring(URI_PREFIX.length()).trim());
            } else if (line.startsWith(VERSION_PREFIX)) {
                builder.version(line.substring(VERSION_PREFIX.length()).trim());
            } else if (line.startsWith(CHAIN_ID_PREFIX)) {
                builder.chainId(parseChainId(line.substring(CHAIN_ID_PREFIX.length()).trim()));
            } else if (line.startsWith(ISSUED_AT_PREFIX)) {
                builder.issuedAt(line.substring(ISSUED_AT_PREFIX.length()).trim());
            }
        }
        if (nonce == null || nonce.isEmpty()) {
            throw new IllegalArgumentException("missing nonce");
        }
        return builder.nonce(nonce).build();
    }

    private static Long parseChainId(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid chain id", e);
        }
    }
}
