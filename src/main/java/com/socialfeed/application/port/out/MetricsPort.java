package com.socialfeed.application.port.out;

import java.util.function.Supplier;

/**
 * Port for recording application metrics.
 */
public interface MetricsPort {

    void incrementFollows();

    void incrementUnfollows();

    void incrementContentCreated();

    void incrementLikes();

    void incrementNotificationsCreated();

    void incrementMessagesSent();

    void incrementEventHandlerFailures(String eventType);

    void incrementRealtimeDispatched(String messageType);

    void incrementRealtimeDropped(String reason);

    void incrementCacheFallbacks(String operation);

    <T> T recordFeedRanking(String feed, Supplier<T> operation);

    void recordProfileSyncFlush(Runnable operation);
}
