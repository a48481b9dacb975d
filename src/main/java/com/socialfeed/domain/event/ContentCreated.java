package com.socialfeed.domain.event;

import com.socialfeed.domain.model.ContentItem;
import com.socialfeed.domain.model.UserId;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ContentCreated(
    UUID eventId,
    UUID contentId,
    UserId authorId,
    List<String> tags,
    Instant occurredAt
) implements DomainEvent {

    public static ContentCreated from(UUID eventId, ContentItem content) {
        return new ContentCreated(eventId, content.id(), content.authorId(), content.tags(), Instant.now());
    }

    @Override
    public String aggregateId() {
        return contentId.toString();
    }

    @Override
    public String eventType() {
        return "CONTENT_CREATED";
    }
}
