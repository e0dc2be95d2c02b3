package com.tokenrelay.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.tokenrelay.common.RateLimiterStatus;
import com.tokenrelay.common.TieredCache;
import com.tokenrelay.common.TokenBucketRateLimiter;
import com.tokenrelay.common.Upstream;
import com.tokenrelay.common.UpstreamRateLimitedException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Cache-first access to the upstreams: fresh hit, else join the in-flight fetch, else fetch through the upstream's
 * {@link TokenBucketRateLimiter}. At most one fetch per key is in flight; fetch failures fall back to the last
 * known value when there is one.
 * <p>
 * Two independent guards apply. The token bucket is the global outbound budget per upstream. The per-key
 * 60-second request window only decides whether a key may reach the network at all; once a key hits the ceiling
 * it is served from cache (possibly stale) without queuing. HTTP 429 doubles the key's backoff, applied before its
 * next fetch.
 */
@Slf4j
public class CoalescingCacheManager {

    private static final long WINDOW_MS = 60_000L;
    private static final long INITIAL_BACKOFF_MS = 1_000L;

    private final TieredCache cache;
    private final Map<Upstream, TokenBucketRateLimiter> limiters;
    private final CoalescingSettings settings;
    private final Clock clock;

    private final Map<String, CompletableFuture<Object>> pending = new ConcurrentHashMap<>();
    private final Cache<String, Object> lastKnown;
    private final Cache<String, Long> backoffMs;
    private final Cache<String, RequestWindow> requestWindows;

    public CoalescingCacheManager(TieredCache cache, Map<Upstream, TokenBucketRateLimiter> limiters,
                                  CoalescingSettings settings, Clock clock) {
        for (Upstream upstream : Upstream.values()) {
            if (!limiters.containsKey(upstream)) {
                throw new IllegalArgumentException("No rate limiter for upstream " + upstream.id());
            }
        }
        this.cache = cache;
        this.limiters = new EnumMap<>(limiters);
        this.settings = settings;
        this.clock = clock;
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.lastKnown = Caffeine.newBuilder()
                .ticker(ticker)
                .expireAfterWrite(settings.staleRetention())
                .maximumSize(10_000)
                .build();
        this.backoffMs = Caffeine.newBuilder()
                .ticker(ticker)
                .expireAfterWrite(settings.stateRetention().plus(settings.maxBackoff()))
                .build();
        this.requestWindows = Caffeine.newBuilder()
                .ticker(ticker)
                .expireAfterAccess(settings.stateRetention())
                .build();
        cache.addSweepListener(this::cleanUpState);
    }

    /**
     * Cached value for {@code key}, fetching it with {@code fetcher} when needed. Empty when the fetcher yields
     * nothing or the key is over its request ceiling with nothing cached.
     */
    public <T> Mono<T> get(Upstream upstream, String key, Supplier<Mono<T>> fetcher, Duration ttl) {
        String cacheKey = namespaced(upstream, key);
        return Mono.defer(() -> {
            if (isOverRequestCeiling(cacheKey)) {
                log.warn("Request ceiling reached for {}, serving cached value only", cacheKey);
                Optional<T> cached = cache.<T>get(cacheKey).or(() -> lastKnown(cacheKey));
                return Mono.justOrEmpty(cached);
            }
            Optional<T> fresh = cache.get(cacheKey);
            if (fresh.isPresent()) {
                return Mono.just(fresh.get());
            }
            CompletableFuture<Object> created = new CompletableFuture<>();
            CompletableFuture<Object> inFlight = pending.putIfAbsent(cacheKey, created);
            if (inFlight != null) {
                log.debug("Fetch already in flight for {}, joining", cacheKey);
                return shared(inFlight);
            }
            created.whenComplete((value, error) -> pending.remove(cacheKey, created));
            fetch(upstream, cacheKey, fetcher, ttl)
                    .subscribe(created::complete, created::completeExceptionally, () -> created.complete(null));
            return shared(created);
        });
    }

    /**
     * Fresh cached value only; never touches the network.
     */
    public <T> Optional<T> getIfFresh(Upstream upstream, String key) {
        return cache.get(namespaced(upstream, key));
    }

    /**
     * True when {@code key} is over its per-minute request ceiling, so {@link #get} answers from cache only.
     */
    public boolean isOverRequestCeiling(Upstream upstream, String key) {
        return isOverRequestCeiling(namespaced(upstream, key));
    }

    /**
     * Throttled, deduplicated call that bypasses the cache (for non-idempotent requests).
     */
    public <T> Mono<T> executeUncached(Upstream upstream, String key, Supplier<Mono<T>> operation) {
        return limiters.get(upstream).execute(namespaced(upstream, key), operation);
    }

    public void invalidate(Upstream upstream, String key) {
        String cacheKey = namespaced(upstream, key);
        cache.invalidate(cacheKey);
        lastKnown.invalidate(cacheKey);
        pending.remove(cacheKey);
    }

    public void clear() {
        cache.clear();
        pending.clear();
        lastKnown.invalidateAll();
        backoffMs.invalidateAll();
        requestWindows.invalidateAll();
    }

    /**
     * Removes expired cache entries and idle per-key state now instead of waiting for the scheduled sweep.
     */
    public int sweep() {
        int removed = cache.sweepExpired();
        cleanUpState();
        return removed;
    }

    /**
     * Current backoff for a key, zero when none applies.
     */
    public Duration currentBackoff(Upstream upstream, String key) {
        Long ms = backoffMs.getIfPresent(namespaced(upstream, key));
        return ms != null ? Duration.ofMillis(ms) : Duration.ZERO;
    }

    public CacheManagerStats getStats() {
        long now = clock.millis();
        Map<String, Integer> counts = new LinkedHashMap<>();
        requestWindows.asMap().forEach((key, window) -> counts.put(key, window.count(now)));
        Map<String, RateLimiterStatus> limiterStatus = new LinkedHashMap<>();
        limiters.forEach((upstream, limiter) -> limiterStatus.put(upstream.id(), limiter.getStatus()));
        Set<String> backoffKeys = new TreeSet<>(backoffMs.asMap().keySet());
        return new CacheManagerStats(cache.stats(), pending.size(), backoffKeys, counts, limiterStatus);
    }

    private <T> Mono<T> fetch(Upstream upstream, String cacheKey, Supplier<Mono<T>> fetcher, Duration ttl) {
        recordRequest(cacheKey);
        Mono<T> call = limiters.get(upstream).execute(cacheKey, fetcher);
        Long backoff = backoffMs.getIfPresent(cacheKey);
        if (backoff != null && backoff > 0) {
            log.info("Applying {}ms backoff for {}", backoff, cacheKey);
            call = Mono.delay(Duration.ofMillis(backoff)).then(call);
        }
        return call
                .doOnNext(value -> {
                    cache.set(cacheKey, value, ttl);
                    lastKnown.put(cacheKey, value);
                    backoffMs.invalidate(cacheKey);
                })
                .onErrorResume(error -> fallback(cacheKey, error));
    }

    private <T> Mono<T> fallback(String cacheKey, Throwable error) {
        long backoff = 0;
        if (error instanceof UpstreamRateLimitedException) {
            backoff = registerRateLimit(cacheKey);
        }
        Optional<T> stale = lastKnown(cacheKey);
        if (stale.isPresent()) {
            log.warn("Returning stale value for {} after fetch failure: {}", cacheKey, error.toString());
            return Mono.just(stale.get());
        }
        log.warn("Fetch failed for {} with no stale value: {}", cacheKey, error.toString());
        if (error instanceof UpstreamRateLimitedException rateLimited && rateLimited.getRetryAfter().isEmpty()) {
            return Mono.error(rateLimited.withRetryAfter(Duration.ofMillis(backoff)));
        }
        return Mono.error(error);
    }

    private long registerRateLimit(String cacheKey) {
        long next = backoffMs.asMap().merge(cacheKey, INITIAL_BACKOFF_MS * 2,
                (current, ignored) -> Math.min(current * 2, settings.maxBackoff().toMillis()));
        log.warn("Upstream rate limited, backoff for {} set to {}ms", cacheKey, next);
        return next;
    }

    private void recordRequest(String cacheKey) {
        requestWindows.get(cacheKey, k -> new RequestWindow()).record(clock.millis());
    }

    private boolean isOverRequestCeiling(String cacheKey) {
        RequestWindow window = requestWindows.getIfPresent(cacheKey);
        return window != null && window.count(clock.millis()) >= settings.requestsPerMinuteCeiling();
    }

    @SuppressWarnings("unchecked")
    private <T> Optional<T> lastKnown(String cacheKey) {
        return Optional.ofNullable((T) lastKnown.getIfPresent(cacheKey));
    }

    private void cleanUpState() {
        lastKnown.cleanUp();
        backoffMs.cleanUp();
        requestWindows.cleanUp();
    }

    private static String namespaced(Upstream upstream, String key) {
        return upstream.id() + ":" + key;
    }

    @SuppressWarnings("unchecked")
    private static <T> Mono<T> shared(CompletableFuture<Object> future) {
        return Mono.fromFuture(future, true).map(value -> (T) value);
    }

    /**
     * Request timestamps of one key within the last minute.
     */
    private static final class RequestWindow {

        private final Deque<Long> timestamps = new ArrayDeque<>();

        synchronized void record(long now) {
            prune(now);
            timestamps.addLast(now);
        }

        synchronized int count(long now) {
            prune(now);
            return timestamps.size();
        }

        private void prune(long now) {
            while (!timestamps.isEmpty() && now - timestamps.peekFirst() >= WINDOW_MS) {
                timestamps.pollFirst();
            }
        }
    }
}
