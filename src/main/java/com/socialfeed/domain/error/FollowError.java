package com.socialfeed.domain.error;

import com.socialfeed.domain.model.UserId;

/**
 * Expected outcomes of follow operations that depend on stored state.
 * A duplicate follow is a conflict and an unfollow of a non-followed user is a not-found;
 * neither changes any edge.
 *
 * For domain validation errors (like self-follow), see ValidationError.FollowValidationError.
 */
public sealed interface FollowError {

    record AlreadyFollowing(UserId followerId, UserId followeeId) implements FollowError {
        @Override
        public String message() {
            return "User " + followerId + " is already following " + followeeId;
        }

        @Override
        public String code() {
            return "ALREADY_FOLLOWING";
        }
    }

    record NotFollowing(UserId followerId, UserId followeeId) implements FollowError {
        @Override
        public String message() {
            return "User " + followerId + " is not following " + followeeId;
        }

        @Override
        public String code() {
            return "NOT_FOLLOWING";
        }
    }

    record ValidationFailed(ValidationError error) implements FollowError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    String message();

    String code();
}
