package com.socialfeed.infrastructure.metrics;

import com.socialfeed.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
public class AppMetrics implements MetricsPort {

    private final MeterRegistry registry;

    private final Counter followsCreated;
    private final Counter unfollows;
    private final Counter contentCreated;
    private final Counter likes;
    private final Counter notificationsCreated;
    private final Counter messagesSent;
    private final Timer profileSyncFlush;

    public AppMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.followsCreated = Counter.builder("follows_created_total")
            .description("Total number of follow actions")
            .register(registry);

        this.unfollows = Counter.builder("unfollows_total")
            .description("Total number of unfollow actions")
            .register(registry);

        this.contentCreated = Counter.builder("content_created_total")
            .description("Total number of posts created")
            .register(registry);

        this.likes = Counter.builder("likes_total")
            .description("Total number of likes recorded")
            .register(registry);

        this.notificationsCreated = Counter.builder("notifications_created_total")
            .description("Total number of notifications persisted")
            .register(registry);

        this.messagesSent = Counter.builder("messages_sent_total")
            .description("Total number of direct messages sent")
            .register(registry);

        this.profileSyncFlush = Timer.builder("profile_sync_flush_duration_seconds")
            .description("Time taken to propagate coalesced profile changes into content")
            .register(registry);
    }

    @Override
    public void incrementFollows() {
        followsCreated.increment();
    }

    @Override
    public void incrementUnfollows() {
        unfollows.increment();
    }

    @Override
    public void incrementContentCreated() {
        contentCreated.increment();
    }

    @Override
    public void incrementLikes() {
        likes.increment();
    }

    @Override
    public void incrementNotificationsCreated() {
        notificationsCreated.increment();
    }

    @Override
    public void incrementMessagesSent() {
        messagesSent.increment();
    }

    @Override
    public void incrementEventHandlerFailures(String eventType) {
        registry.counter("event_handler_failures_total", "event_type", eventType).increment();
    }

    @Override
    public void incrementRealtimeDispatched(String messageType) {
        registry.counter("realtime_messages_dispatched_total", "type", messageType).increment();
    }

    @Override
    public void incrementRealtimeDropped(String reason) {
        registry.counter("realtime_messages_dropped_total", "reason", reason).increment();
    }

    @Override
    public void incrementCacheFallbacks(String operation) {
        registry.counter("cache_fallbacks_total", "operation", operation).increment();
    }

    @Override
    public <T> T recordFeedRanking(String feed, Supplier<T> operation) {
        return Timer.builder("feed_ranking_duration_seconds")
            .description("Time taken to load and rank a feed page")
            .tag("feed", feed)
            .register(registry)
            .record(operation);
    }

    @Override
    public void recordProfileSyncFlush(Runnable operation) {
        profileSyncFlush.record(operation);
    }
}
