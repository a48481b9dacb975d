package com.socialfeed.domain.event;

import com.socialfeed.domain.model.UserId;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * An empty {@code notificationIds} list means every notification of the user was marked read.
 */
public record NotificationsRead(
    UUID eventId,
    UserId userId,
    List<UUID> notificationIds,
    Instant occurredAt
) implements DomainEvent {

    public static NotificationsRead one(UUID eventId, UserId userId, UUID notificationId) {
        return new NotificationsRead(eventId, userId, List.of(notificationId), Instant.now());
    }

    public static NotificationsRead all(UUID eventId, UserId userId) {
        return new NotificationsRead(eventId, userId, List.of(), Instant.now());
    }

    public boolean allRead() {
        return notificationIds.isEmpty();
    }

    @Override
    public String aggregateId() {
        return userId.toString();
    }

    @Override
    public String eventType() {
        return "NOTIFICATIONS_READ";
    }
}
