package com.socialfeed.domain.event;

import com.socialfeed.domain.model.UserId;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted when a viewer without follows or tag affinity was served the ranked feed instead of a personalized one.
 */
public record ColdStartFeedGenerated(
    UUID eventId,
    UserId viewerId,
    int itemCount,
    Instant occurredAt
) implements DomainEvent {

    public static ColdStartFeedGenerated from(UUID eventId, UserId viewerId, int itemCount) {
        return new ColdStartFeedGenerated(eventId, viewerId, itemCount, Instant.now());
    }

    @Override
    public String aggregateId() {
        return viewerId.toString();
    }

    @Override
    public String eventType() {
        return "COLD_START_FEED_GENERATED";
    }
}
