package com.socialfeed.domain.model;

import com.socialfeed.domain.error.ValidationError.FollowValidationError;

import java.time.Instant;

/**
 * Directed follow relationship. Unique per pair, hard-deleted on unfollow.
 */
public record FollowEdge(
    UserId followerId,
    UserId followeeId,
    Instant createdAt
) {
    public static Result<FollowEdge, FollowValidationError> create(UserId followerId, UserId followeeId) {
        if (followerId.equals(followeeId)) {
            return Result.failure(FollowValidationError.SelfFollow.INSTANCE);
        }
        return Result.success(new FollowEdge(followerId, followeeId, Instant.now()));
    }
}
