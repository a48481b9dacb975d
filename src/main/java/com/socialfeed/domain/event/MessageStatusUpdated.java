package com.socialfeed.domain.event;

import com.socialfeed.domain.model.DeliveryStatus;
import com.socialfeed.domain.model.UserId;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * {@code recipients} are every participant of the conversation; the reader's other sessions need the update too.
 */
public record MessageStatusUpdated(
    UUID eventId,
    String conversationId,
    UserId actorId,
    List<UserId> recipients,
    DeliveryStatus status,
    Instant occurredAt
) implements DomainEvent {

    public static MessageStatusUpdated from(UUID eventId, String conversationId, UserId actorId,
                                            List<UserId> recipients, DeliveryStatus status) {
        return new MessageStatusUpdated(eventId, conversationId, actorId, List.copyOf(recipients), status, Instant.now());
    }

    @Override
    public String aggregateId() {
        return conversationId;
    }

    @Override
    public String eventType() {
        return "MESSAGE_STATUS_UPDATED";
    }
}
