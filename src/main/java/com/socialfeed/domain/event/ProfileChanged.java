package com.socialfeed.domain.event;

import com.socialfeed.domain.model.UserId;

import java.time.Instant;
import java.util.UUID;

/**
 * A null field was not part of the change.
 */
public record ProfileChanged(
    UUID eventId,
    UserId userId,
    String username,
    String avatarUrl,
    Instant occurredAt
) implements DomainEvent {

    public static ProfileChanged from(UUID eventId, UserId userId, String username, String avatarUrl) {
        return new ProfileChanged(eventId, userId, username, avatarUrl, Instant.now());
    }

    public boolean avatarChanged() {
        return avatarUrl != null;
    }

    public boolean usernameChanged() {
        return username != null;
    }

    @Override
    public String aggregateId() {
        return userId.toString();
    }

    @Override
    public String eventType() {
        return "PROFILE_CHANGED";
    }
}
