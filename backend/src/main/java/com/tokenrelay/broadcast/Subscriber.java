package com.tokenrelay.broadcast;

import lombok.Getter;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.time.Clock;

/**
 * One connected stream client. Pushes go into a bounded buffer; a full buffer (client not reading) makes the
 * push fail. {@code lastActivity} is the last time an event actually reached the client.
 */
@Getter
public class Subscriber {

    private final String id;
    private final long connectedAt;
    private volatile long lastActivity;
    @Getter(lombok.AccessLevel.NONE)
    private final Sinks.Many<ServerSentEvent<String>> sink;
    @Getter(lombok.AccessLevel.NONE)
    private final Clock clock;

    Subscriber(String id, int bufferSize, Clock clock) {
        this.id = id;
        this.clock = clock;
        this.connectedAt = clock.millis();
        this.lastActivity = connectedAt;
        this.sink = Sinks.many().unicast().onBackpressureBuffer(Queues.<ServerSentEvent<String>>get(bufferSize).get());
    }

    /**
     * @return false when the event could not be queued (buffer full, stream cancelled or completed)
     */
    synchronized boolean send(ServerSentEvent<String> event) {
        return sink.tryEmitNext(event).isSuccess();
    }

    synchronized void complete() {
        sink.tryEmitComplete();
    }

    Flux<ServerSentEvent<String>> events() {
        return sink.asFlux().doOnNext(event -> lastActivity = clock.millis());
    }

    boolean isIdle(long now, long idleTimeoutMs) {
        return now - lastActivity > idleTimeoutMs;
    }
}
