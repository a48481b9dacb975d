package com.socialfeed.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Denormalized notification. Only {@code read} ever changes after creation.
 */
public record NotificationRecord(
    UUID id,
    UserId receiverId,
    NotificationAction actionType,
    UserId actorId,
    String actorUsername,
    String actorAvatar,
    String targetId,
    String targetType,
    String preview,
    boolean read,
    Instant timestamp
) {
    public static final int MAX_PREVIEW_LENGTH = 140;

    public static NotificationRecord create(
            UUID id,
            UserId receiverId,
            NotificationAction actionType,
            UserId actorId,
            AuthorSnapshot actor,
            String targetId,
            String targetType,
            String preview) {
        return new NotificationRecord(
            id,
            receiverId,
            actionType,
            actorId,
            actor.username(),
            actor.avatarUrl(),
            targetId,
            targetType,
            truncate(preview),
            false,
            Instant.now()
        );
    }

    public NotificationRecord markRead() {
        return new NotificationRecord(id, receiverId, actionType, actorId, actorUsername, actorAvatar,
            targetId, targetType, preview, true, timestamp);
    }

    private static String truncate(String preview) {
        if (preview == null || preview.length() <= MAX_PREVIEW_LENGTH) {
            return preview;
        }
        return preview.substring(0, MAX_PREVIEW_LENGTH);
    }
}
