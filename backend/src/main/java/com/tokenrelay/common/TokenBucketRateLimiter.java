package com.tokenrelay.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * Token-bucket throttle for one upstream, with request deduplication.
 * <p>
 * Calls sharing a key while one is in flight get the same result and never re-invoke the operation. Other calls
 * consume one token each; the bucket refills continuously at {@code ratePerSecond} up to {@code maxBurst}.
 * Without a token the call is queued FIFO and a single drain task re-polls every {@code 1000 / ratePerSecond} ms
 * while the queue is non-empty. Failures reach every caller of the shared request and are never cached; retries
 * are up to the caller.
 */
@Slf4j
public class TokenBucketRateLimiter implements AutoCloseable {

    private final String name;
    private final double ratePerSecond;
    private final int maxBurst;
    private final long pollIntervalMs;
    private final Clock clock;
    private final TaskScheduler scheduler;

    private final Map<String, CompletableFuture<Object>> pending = new ConcurrentHashMap<>();
    private final Deque<QueuedCall> queue = new ArrayDeque<>();
    private double tokensAvailable;
    private long lastRefillMillis;
    private ScheduledFuture<?> drainTask;
    private boolean closed;

    public TokenBucketRateLimiter(String name, double ratePerSecond, int maxBurst, Clock clock, TaskScheduler scheduler) {
        if (ratePerSecond <= 0) {
            throw new IllegalArgumentException("ratePerSecond must be positive");
        }
        if (maxBurst < 1) {
            throw new IllegalArgumentException("maxBurst must be at least 1");
        }
        this.name = name;
        this.ratePerSecond = ratePerSecond;
        this.maxBurst = maxBurst;
        this.pollIntervalMs = (long) Math.ceil(1000.0 / ratePerSecond);
        this.clock = clock;
        this.scheduler = scheduler;
        this.tokensAvailable = maxBurst;
        this.lastRefillMillis = clock.millis();
        log.info("Rate limiter {} started: {} req/s, burst {}", name, ratePerSecond, maxBurst);
    }

    /**
     * Runs {@code operation} under the rate budget, or joins the in-flight call with the same key.
     * Cancelling the returned Mono does not cancel the shared call.
     */
    public <T> Mono<T> execute(String key, Supplier<Mono<T>> operation) {
        return Mono.defer(() -> {
            CompletableFuture<Object> created = new CompletableFuture<>();
            CompletableFuture<Object> inFlight = pending.putIfAbsent(key, created);
            if (inFlight != null) {
                log.debug("Request deduplicated on {}: {}", name, key);
                return shared(inFlight);
            }
            created.whenComplete((value, error) -> pending.remove(key, created));
            submit(new QueuedCall(key, operation, created));
            return shared(created);
        });
    }

    public synchronized RateLimiterStatus getStatus() {
        refill();
        return new RateLimiterStatus(name, queue.size(), (int) Math.floor(tokensAvailable), maxBurst, ratePerSecond,
                pending.size());
    }

    /**
     * Rejects every queued request with {@link RateLimiterQueueClearedException}. Requests already running complete normally.
     */
    public void clearQueue() {
        List<QueuedCall> dropped;
        synchronized (this) {
            dropped = new ArrayList<>(queue);
            queue.clear();
            if (drainTask != null) {
                drainTask.cancel(false);
                drainTask = null;
            }
        }
        if (!dropped.isEmpty()) {
            log.warn("Rate limiter {} cleared {} queued requests", name, dropped.size());
        }
        dropped.forEach(call -> call.future.completeExceptionally(new RateLimiterQueueClearedException(name)));
    }

    public String getName() {
        return name;
    }

    @Override
    public void close() {
        synchronized (this) {
            closed = true;
        }
        clearQueue();
        log.info("Rate limiter {} stopped", name);
    }

    private void submit(QueuedCall call) {
        boolean runNow = false;
        boolean rejected = false;
        synchronized (this) {
            if (closed) {
                rejected = true;
            } else {
                refill();
                if (queue.isEmpty() && tokensAvailable >= 1) {
                    tokensAvailable -= 1;
                    runNow = true;
                } else {
                    queue.addLast(call);
                    scheduleDrain();
                    log.debug("Rate limiter {} queued {} (queue length {})", name, call.key, queue.size());
                }
            }
        }
        if (rejected) {
            call.future.completeExceptionally(new RateLimiterQueueClearedException(name));
        } else if (runNow) {
            call.start();
        }
    }

    void drain() {
        List<QueuedCall> ready = new ArrayList<>();
        synchronized (this) {
            drainTask = null;
            refill();
            while (!queue.isEmpty() && tokensAvailable >= 1) {
                tokensAvailable -= 1;
                ready.add(queue.pollFirst());
            }
            if (!queue.isEmpty()) {
                scheduleDrain();
            }
        }
        ready.forEach(QueuedCall::start);
    }

    // caller holds the lock
    private void scheduleDrain() {
        if (drainTask == null) {
            drainTask = scheduler.schedule(this::drain, Instant.now().plusMillis(pollIntervalMs));
        }
    }

    // caller holds the lock
    private void refill() {
        long now = clock.millis();
        long elapsed = now - lastRefillMillis;
        if (elapsed > 0) {
            tokensAvailable = Math.min(maxBurst, tokensAvailable + (elapsed / 1000.0) * ratePerSecond);
            lastRefillMillis = now;
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> Mono<T> shared(CompletableFuture<Object> future) {
        return Mono.fromFuture(future, true).map(value -> (T) value);
    }

    private static final class QueuedCall {

        private final String key;
        private final Supplier<? extends Mono<?>> operation;
        private final CompletableFuture<Object> future;

        private QueuedCall(String key, Supplier<? extends Mono<?>> operation, CompletableFuture<Object> future) {
            this.key = key;
            this.operation = operation;
            this.future = future;
        }

        private void start() {
            Mono<?> call;
            try {
                call = operation.get();
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
                return;
            }
            if (call == null) {
                future.complete(null);
                return;
            }
            call.subscribe(future::complete, future::completeExceptionally, () -> future.complete(null));
        }
    }
}
