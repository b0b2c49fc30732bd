package sovereignvpn.gateway.service.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import sovereignvpn.gateway.config.GatewayProperties;
import sovereignvpn.gateway.exception.ReputationLookupException;
import sovereignvpn.gateway.util.LogSanitizer;

/**
 * Reads community reputation ratings from the 6529 API
 * ({@code GET {base}/profiles/{identity}/rep/rating?category=...}).
 * Successful lookups are cached per identity and category.
 */
@Service
@Slf4j
public class ReputationClient {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final GatewayProperties.Reputation config;
    private final Clock clock;
    private final Map<String, CachedRating> cache = new ConcurrentHashMap<>();

    public ReputationClient(OkHttpClient httpClient, ObjectMapper objectMapper,
                            GatewayProperties properties, Clock clock) {
        this.config = properties.getReputation();
        this.httpClient = httpClient.newBuilder().callTimeout(config.getHttpTimeout()).build();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    /**
     * Operator eligibility in the configured operator category.
     */
    public RepResult checkOperator(String identity) {
        return check(identity, config.getCategory(), config.getMinRep());
    }

    /**
     * @param identity wallet address or 6529 handle
     * @throws ReputationLookupException when the API cannot be reached or answers with an error
     */
    public RepResult check(String identity, String category, long minRep) {
        long rating = fetchRating(identity, category);
        return new RepResult(rating, rating >= minRep, clock.instant());
    }

    /**
     * Raw rating, from cache when fresh.
     */
    public long fetchRating(String identity, String category) {
        String key = identity.toLowerCase() + "|" + category;
        Instant now = clock.instant();
        CachedRating cached = cache.get(key);
        if (cached != null && now.isBefore(cached.expiresAt())) {
            return cached.rating();
        }

        HttpUrl base = HttpUrl.parse(config.getBaseUrl());
        if (base == null) {
            throw new ReputationLookupException("invalid reputation API URL");
        }
        HttpUrl url = base.newBuilder()
            .addPathSegment("profiles")
            .addPathSegment(identity)
            .addPathSegment("rep")
            .addPathSegment("rating")
            .addQueryParameter("category", category)
            .build();

        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new ReputationLookupException("reputation API returned status " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new ReputationLookupException("reputation API returned an empty body");
            }
            JsonNode json = objectMapper.readTree(body.string());
            JsonNode ratingNode = json == null ? null : json.get("rating");
            if (ratingNode == null || !ratingNode.canConvertToLong()) {
                throw new ReputationLookupException("reputation API response has no rating");
            }
            long rating = ratingNode.asLong();
            cache.put(key, new CachedRating(rating, now.plus(config.getCacheTtl())));
            log.debug("Rep for {} in '{}': {}", LogSanitizer.maskIdentifier(identity), category, rating);
            return rating;
        } catch (IOException e) {
            throw new ReputationLookupException("reputation API unreachable: " + e.getMessage(), e);
        }
    }

    public void invalidate(String identity) {
        String prefix = identity.toLowerCase() + "|";
        cache.keySet().removeIf(key -> key.startsWith(prefix));
    }

    @Scheduled(fixedDelayString = "${gateway.reputation.cleanup-interval-ms:300000}")
    public int evictExpired() {
        Instant now = clock.instant();
        int before = cache.size();
        cache.values().removeIf(entry -> !now.isBefore(entry.expiresAt()));
        return before - cache.size();
    }

    public int getCacheSize() {
        return cache.size();
    }

    private record CachedRating(long rating, Instant expiresAt) {
    }
}
