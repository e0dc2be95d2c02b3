package com.tokenrelay.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenrelay.common.TieredCache;
import com.tokenrelay.upstream.PriceFeedSource;
import com.tokenrelay.upstream.PricePoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.scheduling.TaskScheduler;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans one upstream price poll out to every stream subscriber. Each tick fetches the tracked prices once,
 * merges them into the last-known values and pushes the same serialized message to all subscribers; a
 * subscriber whose push fails is dropped at once. Keep-alive comments go out on their own schedule, which
 * also drops idle subscribers.
 */
@Slf4j
public class PriceBroadcastServer implements AutoCloseable {

    private final PriceFeedSource feed;
    private final TieredCache lastKnown;
    private final BroadcastSettings settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final AtomicLong subscriberIds = new AtomicLong();
    private final ScheduledFuture<?> pollTask;
    private final ScheduledFuture<?> keepAliveTask;
    private volatile boolean closed;

    /**
     * @param lastKnown owned by this server and closed with it
     */
    public PriceBroadcastServer(PriceFeedSource feed, TieredCache lastKnown, BroadcastSettings settings,
                                ObjectMapper objectMapper, Clock clock, TaskScheduler scheduler) {
        this.feed = feed;
        this.lastKnown = lastKnown;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.pollTask = scheduler.scheduleWithFixedDelay(this::tick, Instant.now(), settings.pollInterval());
        this.keepAliveTask = scheduler.scheduleAtFixedRate(this::sendKeepAlive,
                Instant.now().plus(settings.keepAliveInterval()), settings.keepAliveInterval());
        log.info("Price broadcast started for {} token(s), polling every {}", settings.trackedIds().size(),
                settings.pollInterval());
    }

    /**
     * Registers a subscriber and returns its event stream, starting with the connected message. Cancelling the
     * stream unregisters the subscriber.
     */
    public Flux<ServerSentEvent<String>> subscribe() {
        return Flux.defer(() -> {
            if (closed) {
                return Flux.empty();
            }
            Subscriber subscriber = new Subscriber(Long.toString(subscriberIds.incrementAndGet()),
                    settings.subscriberBufferSize(), clock);
            subscribers.put(subscriber.getId(), subscriber);
            BroadcastMessage connected = new BroadcastMessage(BroadcastMessage.CONNECTED, snapshot(),
                    subscribers.size(), clock.millis());
            subscriber.send(ServerSentEvent.builder(serialize(connected)).build());
            log.debug("Subscriber {} connected ({} total)", subscriber.getId(), subscribers.size());
            return subscriber.events()
                    .doFinally(signal -> remove(subscriber, signal.toString()));
        });
    }

    /**
     * One poll: fetch tracked prices, update last-known values, push to every subscriber. A failed or empty
     * fetch skips the tick without notifying anyone.
     *
     * @return subscribers the update reached
     */
    public int tick() {
        if (closed) {
            return 0;
        }
        Map<String, PricePoint> prices;
        try {
            prices = feed.fetchPrices(settings.trackedIds()).block(settings.pollTimeout());
        } catch (RuntimeException e) {
            log.warn("Price poll failed, skipping tick: {}", e.getMessage());
            return 0;
        }
        if (prices == null || prices.isEmpty()) {
            log.warn("Price poll returned no prices, skipping tick");
            return 0;
        }
        lastKnown.setMany(prices);
        if (subscribers.isEmpty()) {
            return 0;
        }
        BroadcastMessage update = new BroadcastMessage(BroadcastMessage.PRICE_UPDATE, snapshot(), null, clock.millis());
        return broadcast(ServerSentEvent.builder(serialize(update)).build());
    }

    /**
     * Drops idle subscribers and sends a comment-only frame to the rest.
     */
    public int sendKeepAlive() {
        long now = clock.millis();
        long idleTimeoutMs = settings.idleTimeout().toMillis();
        subscribers.values().forEach(subscriber -> {
            if (subscriber.isIdle(now, idleTimeoutMs)) {
                log.info("Dropping idle subscriber {}", subscriber.getId());
                remove(subscriber, "idle");
            }
        });
        return broadcast(ServerSentEvent.<String>builder().comment("keepalive").build());
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Last known price per tracked id.
     */
    public Map<String, PricePoint> snapshot() {
        Map<String, PricePoint> known = lastKnown.getMany(settings.trackedIds());
        Map<String, PricePoint> ordered = new LinkedHashMap<>();
        for (String id : settings.trackedIds()) {
            PricePoint point = known.get(id);
            if (point != null) {
                ordered.put(id, point);
            }
        }
        return ordered;
    }

    @Override
    public void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
        }
        if (keepAliveTask != null) {
            keepAliveTask.cancel(false);
        }
        List<Subscriber> remaining = List.copyOf(subscribers.values());
        remaining.forEach(subscriber -> remove(subscriber, "shutdown"));
        lastKnown.close();
        log.info("Price broadcast stopped, closed {} subscriber stream(s)", remaining.size());
    }

    private int broadcast(ServerSentEvent<String> event) {
        int delivered = 0;
        for (Subscriber subscriber : subscribers.values()) {
            if (subscriber.send(event)) {
                delivered++;
            } else {
                log.debug("Push to subscriber {} failed, removing", subscriber.getId());
                remove(subscriber, "send failed");
            }
        }
        return delivered;
    }

    private void remove(Subscriber subscriber, String reason) {
        if (subscribers.remove(subscriber.getId(), subscriber)) {
            subscriber.complete();
            log.debug("Subscriber {} removed ({}), {} remaining", subscriber.getId(), reason, subscribers.size());
        }
    }

    private String serialize(BroadcastMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize broadcast message", e);
        }
    }
}
