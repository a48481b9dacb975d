package com.socialfeed.domain.model;

import com.socialfeed.domain.error.ValidationError.MessageValidationError;

import java.time.Instant;
import java.util.UUID;

public record Message(
    UUID id,
    String conversationId,
    UserId senderId,
    String body,
    Instant createdAt
) {
    public static final int MAX_BODY_LENGTH = 5000;

    public static Result<Message, MessageValidationError> create(UUID id, String conversationId, UserId senderId, String body) {
        if (body == null || body.isBlank()) {
            return Result.failure(MessageValidationError.EmptyBody.INSTANCE);
        }
        String trimmed = body.trim();
        if (trimmed.length() > MAX_BODY_LENGTH) {
            return Result.failure(new MessageValidationError.BodyTooLong(trimmed.length(), MAX_BODY_LENGTH));
        }
        return Result.success(new Message(id, conversationId, senderId, trimmed, Instant.now()));
    }
}
