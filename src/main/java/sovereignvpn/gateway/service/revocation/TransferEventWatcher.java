package sovereignvpn.gateway.service.revocation;

import io.reactivex.disposables.Disposable;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.response.Log;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.util.EthereumAddressValidator;
import sovereignvpn.gateway.util.LogSanitizer;

/**
 * Subscribes to ERC-1155 transfers of the gated collection and revokes access of senders.
 *
 * <p>States: {@code DISCONNECTED -> SUBSCRIBED}; a subscription error or completion returns to
 * {@code DISCONNECTED} and a resubscription is scheduled after the retry delay, until
 * {@link #stop()} moves the watcher to {@code STOPPED}.
 */
@Component
@Slf4j
public class TransferEventWatcher {

    public enum State {
        DISCONNECTED,
        SUBSCRIBED,
        STOPPED
    }

    static final Event TRANSFER_SINGLE_EVENT = new Event(
        "TransferSingle",
        Arrays.<TypeReference<?>>asList(
            new TypeReference<Address>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {}
        )
    );

    static final Event TRANSFER_BATCH_EVENT = new Event(
        "TransferBatch",
        Arrays.<TypeReference<?>>asList(
            new TypeReference<Address>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<DynamicArray<Uint256>>() {},
            new TypeReference<DynamicArray<Uint256>>() {}
        )
    );

    static final String TRANSFER_SINGLE_TOPIC = EventEncoder.encode(TRANSFER_SINGLE_EVENT);
    static final String TRANSFER_BATCH_TOPIC = EventEncoder.encode(TRANSFER_BATCH_EVENT);
    private static final Set<String> TRANSFER_TOPICS = Set.of(TRANSFER_SINGLE_TOPIC, TRANSFER_BATCH_TOPIC);
    private static final Duration DEDUP_TTL = Duration.ofMinutes(10);

    private final Web3j web3j;
    private final SessionRevoker sessionRevoker;
    private final boolean enabled;
    private final String tokenContract;
    private final Duration retryDelay;
    private final Clock clock;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "transfer-event-watcher");
        t.setDaemon(true);
        return t;
    });

    /** Recently handled logs (tx hash + log index) for deduplication */
    private final Map<String, Instant> recentlyProcessed = new ConcurrentHashMap<>();

    private volatile State state = State.DISCONNECTED;
    private volatile boolean running;
    private volatile Disposable subscription;

    public TransferEventWatcher(Web3j web3j, SessionRevoker sessionRevoker, GatewayProperties properties,
                                Clock clock) {
        this.web3j = web3j;
        this.clock = clock;
        this.sessionRevoker = sessionRevoker;
        this.enabled = properties.getRevocation().isEnabled();
        this.tokenContract = properties.getTier().getTokenContract();
        this.retryDelay = properties.getRevocation().getRetryDelay();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!enabled) {
            log.info("Transfer revocation watcher is disabled");
            return;
        }
        if (tokenContract == null || tokenContract.isBlank()) {
            log.warn("No gated token contract configured; transfer revocation watcher not started");
            return;
        }
        synchronized (this) {
            if (running) {
                return;
            }
            running = true;
        }
        scheduler.scheduleAtFixedRate(this::cleanupDeduplicationCache, 5, 5, TimeUnit.MINUTES);
        subscribe();
    }

    @PreDestroy
    public void stop() {
        synchronized (this) {
            running = false;
            state = State.STOPPED;
        }
        Disposable current = subscription;
        if (current != null && !current.isDisposed()) {
            current.dispose();
        }
        scheduler.shutdownNow();
        log.info("Transfer revocation watcher stopped");
    }

    public State getState() {
        return state;
    }

    void subscribe() {
        if (!running) {
            return;
        }
        try {
            EthFilter filter = new EthFilter(
                DefaultBlockParameterName.LATEST,
                DefaultBlockParameterName.LATEST,
                tokenContract);
            filter.addOptionalTopics(TRANSFER_SINGLE_TOPIC, TRANSFER_BATCH_TOPIC);
            state = State.SUBSCRIBED;
            subscription = web3j.ethLogFlowable(filter).subscribe(
                this::handleLog,
                this::onSubscriptionError,
                this::onSubscriptionComplete);
            if (state == State.SUBSCRIBED) {
                log.info("Watching TransferSingle/TransferBatch on {}", tokenContract);
            }
        } catch (RuntimeException e) {
            log.error("Failed to subscribe to transfer events: {}", e.getMessage());
            state = State.DISCONNECTED;
            scheduleResubscribe();
        }
    }

    /**
     * Applies one transfer log: the sender loses access, the receiver's cached tier is refreshed.
     */
    public void handleLog(Log eventLog) {
        try {
            List<String> topics = eventLog.getTopics();
            if (topics == null || topics.size() < 4 || !TRANSFER_TOPICS.contains(topics.get(0).toLowerCase())) {
                return;
            }
            String dedupKey = eventLog.getTransactionHash() + ":" + eventLog.getLogIndexRaw();
            if (eventLog.getTransactionHash() != null
                && recentlyProcessed.putIfAbsent(dedupKey, clock.instant()) != null) {
                return;
            }

            String from = EthereumAddressValidator.fromTopic(topics.get(2));
            String to = EthereumAddressValidator.fromTopic(topics.get(3));
            if (!EthereumAddressValidator.isZeroAddress(from)) {
                log.info("Gated token transfer out of {} (tx {})", LogSanitizer.maskIdentifier(from),
                    eventLog.getTransactionHash());
                sessionRevoker.onTransferOut(from);
            }
            if (!EthereumAddressValidator.isZeroAddress(to)) {
                sessionRevoker.onTransferIn(to);
            }
        } catch (RuntimeException e) {
            log.error("Failed to process transfer log {}: {}", eventLog.getTransactionHash(), e.getMessage(), e);
        }
    }

    private void onSubscriptionError(Throwable error) {
        if (!running) {
            return;
        }
        log.warn("Transfer event subscription error: {}; resubscribing in {}s",
            error.getMessage(), retryDelay.toSeconds());
        state = State.DISCONNECTED;
        scheduleResubscribe();
    }

    private void onSubscriptionComplete() {
        if (!running) {
            return;
        }
        log.info("Transfer event subscription completed; resubscribing in {}s", retryDelay.toSeconds());
        state = State.DISCONNECTED;
        scheduleResubscribe();
    }

    private void scheduleResubscribe() {
        if (!running) {
            return;
        }
        try {
            scheduler.schedule(this::subscribe, retryDelay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Watcher scheduler already shut down");
        }
    }

    int cleanupDeduplicationCache() {
        Instant cutoff = clock.instant().minus(DEDUP_TTL);
        int before = recentlyProcessed.size();
        recentlyProcessed.entrySet().removeIf(entry -> entry.getValue().isBefore(cutoff));
        return before - recentlyProcessed.size();
    }
}
