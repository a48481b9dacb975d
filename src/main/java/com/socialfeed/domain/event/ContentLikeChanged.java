package com.socialfeed.domain.event;

import com.socialfeed.domain.model.ContentItem;
import com.socialfeed.domain.model.UserId;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Carries the authoritative like count read back after the atomic increment, so consumers
 * rebroadcast it instead of recomputing.
 */
public record ContentLikeChanged(
    UUID eventId,
    UUID contentId,
    UserId actorId,
    UserId authorId,
    List<String> tags,
    long newLikes,
    boolean liked,
    Instant occurredAt
) implements DomainEvent {

    public static ContentLikeChanged from(UUID eventId, ContentItem content, UserId actorId, long newLikes, boolean liked) {
        return new ContentLikeChanged(eventId, content.id(), actorId, content.authorId(), content.tags(),
            newLikes, liked, Instant.now());
    }

    @Override
    public String aggregateId() {
        return contentId.toString();
    }

    @Override
    public String eventType() {
        return liked ? "CONTENT_LIKED" : "CONTENT_UNLIKED";
    }
}
