package sovereignvpn.gateway.service.onchain;

import jakarta.annotation.PreDestroy;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.exception.LedgerException;
import sovereignvpn.gateway.exception.ServiceNotConfiguredException;
import sovereignvpn.gateway.service.ledger.ContractCallService;
import sovereignvpn.gateway.service.ledger.TransactionSubmitter;
import sovereignvpn.gateway.util.LogSanitizer;

/**
 * Client for the SessionManager contract. Reads are synchronous; writes run on a small bounded
 * executor and report through the returned future. Failed or rejected writes are logged and counted.
 * Without an operator key the client is read-only.
 */
@Service
@Slf4j
public class SessionManagerClient {

    private final ContractCallService contractCallService;
    private final TransactionSubmitter submitter;
    private final String contract;
    private final long chainId;
    private final BigInteger gasLimit;
    private final ExecutorService writeExecutor;
    private final AtomicLong failedWrites = new AtomicLong();

    @Autowired
    public SessionManagerClient(ContractCallService contractCallService, Web3j web3j, GatewayProperties properties) {
        this(contractCallService, properties, createSubmitter(web3j, properties));
    }

    SessionManagerClient(ContractCallService contractCallService, GatewayProperties properties,
                         TransactionSubmitter submitter) {
        GatewayProperties.SessionManager config = properties.getSessionManager();
        this.contractCallService = contractCallService;
        this.contract = config.getContract();
        this.chainId = properties.getEthereum().getChainId();
        this.gasLimit = config.getGasLimit();
        this.submitter = submitter;
        this.writeExecutor = new ThreadPoolExecutor(1, 1, 60, TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(Math.max(1, config.getWriteQueueCapacity())),
            r -> {
                Thread t = new Thread(r, "session-manager-writer");
                t.setDaemon(true);
                return t;
            },
            new ThreadPoolExecutor.AbortPolicy());
        if (isEnabled()) {
            log.info("SessionManager client for {} ({})", contract, submitter != null
                ? "operator " + submitter.getFromAddress()
                : "read-only");
        }
    }

    private static TransactionSubmitter createSubmitter(Web3j web3j, GatewayProperties properties) {
        GatewayProperties.SessionManager config = properties.getSessionManager();
        if (config.getContract() == null || config.getContract().isBlank()
            || config.getOperatorKey() == null || config.getOperatorKey().isBlank()) {
            return null;
        }
        return new TransactionSubmitter(web3j, Credentials.create(config.getOperatorKey()),
            properties.getEthereum().getChainId());
    }

    public boolean isEnabled() {
        return contract != null && !contract.isBlank();
    }

    public boolean canWrite() {
        return isEnabled() && submitter != null;
    }

    public long getFailedWriteCount() {
        return failedWrites.get();
    }

    /**
     * @return the user's active session id, zero when none
     */
    @SuppressWarnings("rawtypes")
    public BigInteger getActiveSessionId(String user) {
        requireEnabled();
        Function function = new Function(
            "getActiveSessionId",
            List.of(new Address(user)),
            List.of(new TypeReference<Uint256>() {}));
        List<Type> result = contractCallService.call(contract, function);
        return ((Uint256) result.get(0)).getValue();
    }

    /**
     * getSession returns a static tuple, which decodes like its flattened fields.
     */
    @SuppressWarnings("rawtypes")
    public OnChainSession getSession(BigInteger sessionId) {
        requireEnabled();
        Function function = new Function(
            "getSession",
            List.of(new Uint256(sessionId)),
            List.of(
                new TypeReference<Address>() {},
                new TypeReference<Address>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Bool>() {},
                new TypeReference<Bool>() {}));
        List<Type> result = contractCallService.call(contract, function);
        return new OnChainSession(
            ((Address) result.get(0)).getValue(),
            ((Address) result.get(1)).getValue(),
            ((Uint256) result.get(2)).getValue(),
            ((Uint256) result.get(3)).getValue(),
            ((Uint256) result.get(4)).getValue(),
            ((Bool) result.get(5)).getValue(),
            ((Bool) result.get(6)).getValue());
    }

    public SessionInfo getSessionInfo() {
        requireEnabled();
        BigInteger maxDuration = readUint("maxSessionDuration", List.of());
        BigInteger pricePerHour = readUint("pricePerHour", List.of());
        BigInteger cost = readUint("calculatePrice", List.of(new Uint256(maxDuration)));
        String operator = submitter != null ? submitter.getFromAddress() : "";
        return new SessionInfo(contract, chainId, operator, pricePerHour.toString(), maxDuration, cost.toString());
    }

    /**
     * Records a free session for {@code user} served by this node.
     *
     * @return future of the transaction hash
     */
    public CompletableFuture<String> openFreeSession(String user, Duration duration) {
        if (!canWrite()) {
            return CompletableFuture.failedFuture(new ServiceNotConfiguredException("session manager is read-only"));
        }
        return submitAsync("openFreeSession", () -> submitter.submit(contract, new Function(
            "openFreeSession",
            List.of(new Address(user), new Address(submitter.getFromAddress()),
                new Uint256(BigInteger.valueOf(duration.toSeconds()))),
            List.of()), gasLimit));
    }

    /**
     * Closes the user's active on-chain session if there is one.
     *
     * @return future of the transaction hash, or of null when nothing was open
     */
    public CompletableFuture<String> closeActiveSession(String user) {
        if (!canWrite()) {
            return CompletableFuture.failedFuture(new ServiceNotConfiguredException("session manager is read-only"));
        }
        return submitAsync("closeSession", () -> {
            BigInteger sessionId = getActiveSessionId(user);
            if (sessionId.signum() == 0) {
                return null;
            }
            return submitter.submit(contract,
                new Function("closeSession", List.of(new Uint256(sessionId)), List.of()), gasLimit);
        });
    }

    @PreDestroy
    public void shutdown() {
        writeExecutor.shutdown();
    }

    private CompletableFuture<String> submitAsync(String operation, Supplier<String> write) {
        CompletableFuture<String> future;
        try {
            future = CompletableFuture.supplyAsync(write, writeExecutor);
        } catch (RejectedExecutionException e) {
            failedWrites.incrementAndGet();
            log.error("{} dropped: write queue full", operation);
            return CompletableFuture.failedFuture(new LedgerException(operation, "write queue full", e));
        }
        return future.whenComplete((txHash, error) -> {
            if (error != null) {
                failedWrites.incrementAndGet();
                log.error("{} failed: {}", operation, LogSanitizer.sanitize(error.getMessage()));
            } else if (txHash != null) {
                log.info("{} sent: {}", operation, txHash);
            }
        });
    }

    @SuppressWarnings("rawtypes")
    private BigInteger readUint(String name, List<Type> inputs) {
        Function function = new Function(name, inputs, List.of(new TypeReference<Uint256>() {}));
        List<Type> result = contractCallService.call(contract, function);
        return ((Uint256) result.get(0)).getValue();
    }

    private void requireEnabled() {
        if (!isEnabled()) {
            throw new ServiceNotConfiguredException("session manager not configured");
        }
    }
}
