package com.socialfeed.domain.event;

import com.socialfeed.domain.model.NotificationRecord;

import java.time.Instant;
import java.util.UUID;

public record NotificationCreated(
    UUID eventId,
    NotificationRecord notification,
    Instant occurredAt
) implements DomainEvent {

    public static NotificationCreated from(UUID eventId, NotificationRecord notification) {
        return new NotificationCreated(eventId, notification, Instant.now());
    }

    @Override
    public String aggregateId() {
        return notification.receiverId().toString();
    }

    @Override
    public String eventType() {
        return "NOTIFICATION_CREATED";
    }
}
