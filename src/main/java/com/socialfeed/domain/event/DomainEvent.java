package com.socialfeed.domain.event;

import java.time.Instant;
import java.util.UUID;

public sealed interface DomainEvent permits
        ContentCreated, ContentLikeChanged, ContentInteracted,
        UserFollowed, UserUnfollowed,
        MessageSent, MessageStatusUpdated,
        NotificationCreated, NotificationsRead,
        ProfileChanged, ColdStartFeedGenerated {
    UUID eventId();
    String aggregateId();
    Instant occurredAt();
    String eventType();
}
