package com.socialfeed.domain.event;

import com.socialfeed.domain.model.UserId;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record MessageSent(
    UUID eventId,
    String conversationId,
    UUID messageId,
    UserId senderId,
    List<UserId> recipients,
    Instant occurredAt
) implements DomainEvent {

    public static MessageSent from(UUID eventId, String conversationId, UUID messageId, UserId senderId, List<UserId> recipients) {
        return new MessageSent(eventId, conversationId, messageId, senderId, List.copyOf(recipients), Instant.now());
    }

    @Override
    public String aggregateId() {
        return conversationId;
    }

    @Override
    public String eventType() {
        return "MESSAGE_SENT";
    }
}
