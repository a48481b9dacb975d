package com.socialfeed.application.port.out;

/**
 * Cross-process publish/subscribe channel with at-least-once delivery.
 */
public interface PubSubPort {

    /**
     * Serializes {@code message} to JSON and publishes it. Returns the number of subscribers reached,
     * or 0 when the channel is unavailable; publishing never fails the caller.
     */
    long publish(String channel, Object message);
}
