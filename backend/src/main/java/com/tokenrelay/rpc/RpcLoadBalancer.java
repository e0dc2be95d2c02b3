package com.tokenrelay.rpc;

import com.tokenrelay.common.UpstreamRateLimitedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Health-aware selection over the configured RPC endpoints. Each call goes to the best-scoring healthy endpoint
 * not yet tried in that call and fails over on error, up to {@code maxAttempts}. Endpoints are probed
 * periodically; an unhealthy endpoint becomes healthy again only through a successful probe.
 * <p>
 * Score: {@code max(0, weight*100 - responseTimeMs/10 - consecutiveErrors*20 + 50 if probed OK within 5s)}.
 */
@Slf4j
public class RpcLoadBalancer implements AutoCloseable {

    static final long RECENT_PROBE_MS = 5_000L;
    static final int RECENT_PROBE_BONUS = 50;

    private final List<RpcEndpoint> endpoints;
    private final Function<String, Mono<?>> probe;
    private final LoadBalancerSettings settings;
    private final Clock clock;
    private final AtomicReference<CompletableFuture<Void>> recovery = new AtomicReference<>();
    private final ScheduledFuture<?> probeTask;

    /**
     * @param probe cheap liveness call per endpoint url (getSlot)
     */
    public RpcLoadBalancer(List<RpcEndpoint> endpoints, Function<String, Mono<?>> probe,
                           LoadBalancerSettings settings, Clock clock, TaskScheduler scheduler) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.probe = probe;
        this.settings = settings;
        this.clock = clock;
        this.probeTask = scheduler.scheduleWithFixedDelay(this::runProbe,
                Instant.now().plus(settings.probeInterval()), settings.probeInterval());
        log.info("RPC load balancer started with {} endpoint(s)", this.endpoints.size());
    }

    /**
     * Runs {@code operation} against the best endpoint, failing over to the next best on error.
     *
     * @throws NoHealthyEndpointException (as error signal) when no endpoint is healthy even after recovery
     * @throws RpcException               (as error signal) when every attempt failed
     * @throws com.tokenrelay.common.UpstreamRateLimitedException (as error signal) when the endpoints left to try
     *                                    rate limited the call
     */
    public <T> Mono<T> execute(Function<String, Mono<T>> operation) {
        return Mono.defer(() -> attempt(operation, new CallState()));
    }

    /**
     * Probes every endpoint concurrently. Never errors; failures are recorded on the endpoint.
     */
    public Mono<Void> probeAll() {
        return Flux.fromIterable(endpoints)
                .flatMap(this::probe)
                .then();
    }

    public synchronized LoadBalancerStats getStats() {
        long now = clock.millis();
        List<EndpointHealth> health = new ArrayList<>(endpoints.size());
        int healthyCount = 0;
        for (RpcEndpoint endpoint : endpoints) {
            health.add(new EndpointHealth(endpoint.getUrl(), endpoint.isHealthy(), endpoint.getResponseTimeMs(),
                    endpoint.getConsecutiveErrors(), score(endpoint, now)));
            if (endpoint.isHealthy()) {
                healthyCount++;
            }
        }
        return new LoadBalancerStats(List.copyOf(health), healthyCount, endpoints.size());
    }

    @Override
    public void close() {
        if (probeTask != null) {
            probeTask.cancel(false);
        }
        log.info("RPC load balancer stopped");
    }

    static double score(RpcEndpoint endpoint, long now) {
        double score = endpoint.getWeight() * 100.0
                - endpoint.getResponseTimeMs() / 10.0
                - endpoint.getConsecutiveErrors() * 20.0;
        if (endpoint.isHealthy() && endpoint.getLastProbe() > 0 && now - endpoint.getLastProbe() < RECENT_PROBE_MS) {
            score += RECENT_PROBE_BONUS;
        }
        return Math.max(0, score);
    }

    private <T> Mono<T> attempt(Function<String, Mono<T>> operation, CallState call) {
        return nextEndpoint(call).flatMap(endpoint -> {
            call.tried.add(endpoint.getUrl());
            call.attempts++;
            long started = clock.millis();
            return Mono.defer(() -> operation.apply(endpoint.getUrl()))
                    .doOnSuccess(value -> recordSuccess(endpoint, clock.millis() - started))
                    .onErrorResume(error -> {
                        call.errors.add(error);
                        if (error instanceof UpstreamRateLimitedException rateLimited) {
                            return afterRateLimit(operation, call, endpoint, rateLimited);
                        }
                        recordFailure(endpoint, error);
                        if (call.attempts >= settings.maxAttempts()) {
                            return Mono.error(exhausted(call));
                        }
                        return attempt(operation, call);
                    });
        });
    }

    /**
     * A throttled endpoint is not failing: its health is left alone and it is not retried within this call.
     * The call moves on only to healthy endpoints it has not tried; otherwise the rate-limit error surfaces
     * so the caller can back off.
     */
    private <T> Mono<T> afterRateLimit(Function<String, Mono<T>> operation, CallState call, RpcEndpoint endpoint,
                                       UpstreamRateLimitedException error) {
        log.debug("RPC endpoint {} rate limited the call", endpoint.getUrl());
        call.throttled.add(endpoint.getUrl());
        call.lastRateLimit = error;
        if (call.attempts >= settings.maxAttempts() || !hasUntried(call)) {
            return Mono.error(error);
        }
        return attempt(operation, call);
    }

    private synchronized boolean hasUntried(CallState call) {
        return endpoints.stream().anyMatch(e -> e.isHealthy()
                && !call.tried.contains(e.getUrl()) && !call.throttled.contains(e.getUrl()));
    }

    private Mono<RpcEndpoint> nextEndpoint(CallState call) {
        Optional<RpcEndpoint> best = selectBest(call);
        if (best.isPresent()) {
            return Mono.just(best.get());
        }
        if (call.lastRateLimit != null) {
            return Mono.error(call.lastRateLimit);
        }
        if (call.recoveryAttempted) {
            return Mono.error(noHealthyEndpoint());
        }
        call.recoveryAttempted = true;
        return recover().then(Mono.defer(() -> selectBest(call)
                .map(Mono::just)
                .orElseGet(() -> Mono.error(noHealthyEndpoint()))));
    }

    /**
     * Best healthy endpoint not tried in this call; starts a new round when every healthy endpoint was tried.
     * Endpoints that rate limited the call are never picked again by it.
     */
    private synchronized Optional<RpcEndpoint> selectBest(CallState call) {
        List<RpcEndpoint> healthy = endpoints.stream()
                .filter(e -> e.isHealthy() && !call.throttled.contains(e.getUrl()))
                .toList();
        if (healthy.isEmpty()) {
            return Optional.empty();
        }
        List<RpcEndpoint> candidates = healthy.stream().filter(e -> !call.tried.contains(e.getUrl())).toList();
        if (candidates.isEmpty()) {
            call.tried.clear();
            candidates = healthy;
        }
        long now = clock.millis();
        return candidates.stream().max(Comparator.comparingDouble(e -> score(e, now)));
    }

    private Mono<Void> recover() {
        CompletableFuture<Void> created = new CompletableFuture<>();
        CompletableFuture<Void> running = recovery.compareAndExchange(null, created);
        if (running != null) {
            return Mono.fromFuture(running, true);
        }
        log.info("No healthy RPC endpoint, resetting error counters and probing all");
        synchronized (this) {
            endpoints.forEach(RpcEndpoint::resetErrors);
        }
        probeAll()
                .doFinally(signal -> recovery.set(null))
                .subscribe(null, created::completeExceptionally, () -> created.complete(null));
        return Mono.fromFuture(created, true);
    }

    private Mono<Void> probe(RpcEndpoint endpoint) {
        return Mono.defer(() -> {
                    long started = clock.millis();
                    return probe.apply(endpoint.getUrl())
                            .timeout(settings.probeTimeout())
                            .doOnSuccess(ignored -> recordProbeSuccess(endpoint, clock.millis() - started));
                })
                .then()
                .onErrorResume(error -> {
                    if (error instanceof UpstreamRateLimitedException) {
                        log.debug("Health check of {} rate limited, health unchanged", endpoint.getUrl());
                        return Mono.empty();
                    }
                    log.debug("Probe of {} failed: {}", endpoint.getUrl(), error.toString());
                    recordFailure(endpoint, error);
                    return Mono.empty();
                });
    }

    private void runProbe() {
        try {
            probeAll().block(settings.probeTimeout().multipliedBy(2));
        } catch (RuntimeException e) {
            log.warn("RPC probe round failed", e);
        }
    }

    private synchronized void recordSuccess(RpcEndpoint endpoint, long elapsedMs) {
        endpoint.recordSuccess(elapsedMs);
    }

    private synchronized void recordProbeSuccess(RpcEndpoint endpoint, long elapsedMs) {
        boolean wasHealthy = endpoint.isHealthy();
        endpoint.recordProbeSuccess(elapsedMs, clock.millis());
        if (!wasHealthy) {
            log.info("RPC endpoint {} recovered", endpoint.getUrl());
        }
    }

    private synchronized void recordFailure(RpcEndpoint endpoint, Throwable error) {
        if (endpoint.recordFailure(settings.errorThreshold())) {
            log.warn("RPC endpoint {} marked unhealthy after {} consecutive errors: {}",
                    endpoint.getUrl(), endpoint.getConsecutiveErrors(), error.toString());
        }
    }

    private NoHealthyEndpointException noHealthyEndpoint() {
        log.error("No healthy RPC endpoint available out of {}", endpoints.size());
        return new NoHealthyEndpointException("No healthy RPC endpoint available");
    }

    /**
     * {@link RpcException} carrying the last error as cause and the earlier ones as suppressed.
     */
    private RpcException exhausted(CallState call) {
        Throwable last = call.errors.get(call.errors.size() - 1);
        RpcException exception = new RpcException(
                "All RPC attempts failed (" + call.attempts + "): " + last.getMessage(), last);
        call.errors.subList(0, call.errors.size() - 1).forEach(exception::addSuppressed);
        return exception;
    }

    private static final class CallState {
        private final Set<String> tried = new HashSet<>();
        private final Set<String> throttled = new HashSet<>();
        private final List<Throwable> errors = new ArrayList<>();
        private UpstreamRateLimitedException lastRateLimit;
        private int attempts;
        private boolean recoveryAttempted;
    }
}
