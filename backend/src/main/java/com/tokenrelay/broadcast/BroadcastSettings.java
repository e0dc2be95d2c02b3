package com.tokenrelay.broadcast;

import java.time.Duration;
import java.util.List;

/**
 * @param trackedIds           token ids polled every tick
 * @param pollInterval         delay between price polls
 * @param keepAliveInterval    period of comment-only keep-alive frames
 * @param idleTimeout          subscribers that received nothing for this long are dropped
 * @param pollTimeout          upper bound of one poll; a slower poll skips the tick
 * @param subscriberBufferSize events buffered per subscriber before pushes to it fail
 */
public record BroadcastSettings(List<String> trackedIds, Duration pollInterval, Duration keepAliveInterval,
                                Duration idleTimeout, Duration pollTimeout, int subscriberBufferSize) {

    public BroadcastSettings {
        trackedIds = List.copyOf(trackedIds);
        if (subscriberBufferSize < 1) {
            throw new IllegalArgumentException("subscriberBufferSize must be >= 1");
        }
    }
}
