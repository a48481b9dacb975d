package com.socialfeed.domain.event;

import com.socialfeed.domain.model.ContentItem;
import com.socialfeed.domain.model.UserId;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ContentInteracted(
    UUID eventId,
    UUID contentId,
    UserId actorId,
    UserId authorId,
    String actionType,
    List<String> tags,
    Instant occurredAt
) implements DomainEvent {

    public static ContentInteracted from(UUID eventId, ContentItem content, UserId actorId, String actionType) {
        return new ContentInteracted(eventId, content.id(), actorId, content.authorId(), actionType,
            content.tags(), Instant.now());
    }

    @Override
    public String aggregateId() {
        return contentId.toString();
    }

    @Override
    public String eventType() {
        return "CONTENT_INTERACTED";
    }
}
