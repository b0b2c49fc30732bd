package sovereignvpn.gateway.service.peer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.exception.TunnelCommandException;
import sovereignvpn.gateway.util.LogSanitizer;

/**
 * Drives the kernel WireGuard interface through the {@code wg} tool.
 */
@Component
@Slf4j
public class WireGuardCommandConfigurator implements TunnelConfigurator {

    private final String wgBinary;
    private final String interfaceName;
    private final Duration commandTimeout;

    public WireGuardCommandConfigurator(GatewayProperties properties) {
        this.wgBinary = properties.getTunnel().getWgBinary();
        this.interfaceName = properties.getTunnel().getInterfaceName();
        this.commandTimeout = properties.getTunnel().getCommandTimeout();
    }

    @Override
    public void addPeer(String publicKey, String address) {
        run(List.of(wgBinary, "set", interfaceName, "peer", publicKey, "allowed-ips", address + "/32"));
        log.debug("wg peer {} added with {}/32", LogSanitizer.maskIdentifier(publicKey), address);
    }

    @Override
    public void removePeer(String publicKey) {
        run(List.of(wgBinary, "set", interfaceName, "peer", publicKey, "remove"));
        log.debug("wg peer {} removed", LogSanitizer.maskIdentifier(publicKey));
    }

    @Override
    public Map<String, TransferStats> readTransferStats() {
        String output = run(List.of(wgBinary, "show", interfaceName, "transfer"));
        return parseTransfer(output);
    }

    static Map<String, TransferStats> parseTransfer(String output) {
        Map<String, TransferStats> stats = new HashMap<>();
        for (String line : output.split("\n")) {
            String[] fields = line.trim().split("\\s+");
            if (fields.length != 3) {
                continue;
            }
            try {
                stats.put(fields[0], new TransferStats(Long.parseLong(fields[1]), Long.parseLong(fields[2])));
            } catch (NumberFormatException e) {
                log.debug("Skipping unparsable wg transfer line: {}", LogSanitizer.sanitize(line));
            }
        }
        return stats;
    }

    private String run(List<String> command) {
        Process process;
        try {
            process = new ProcessBuilder(new ArrayList<>(command)).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new TunnelCommandException("failed to start " + command.get(0) + ": " + e.getMessage(), e);
        }
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        try {
            if (!process.waitFor(commandTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new TunnelCommandException("wg " + command.get(1) + " timed out after "
                    + commandTimeout.toMillis() + "ms");
            }
            String text = output.get(commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (process.exitValue() != 0) {
                throw new TunnelCommandException("wg " + command.get(1) + " exited with " + process.exitValue()
                    + ": " + LogSanitizer.sanitize(text.trim()));
            }
            return text;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new TunnelCommandException("interrupted while running wg " + command.get(1), e);
        } catch (TunnelCommandException e) {
            throw e;
        } catch (Exception e) {
            throw new TunnelCommandException("wg " + command.get(1) + " failed: " + e.getMessage(), e);
        }
    }

    private static String readFully(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
