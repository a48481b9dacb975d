package com.socialfeed.domain.error;

import com.socialfeed.domain.model.UserId;

import java.util.UUID;

public sealed interface ContentError {

    record NotFound(UUID contentId) implements ContentError {
        @Override
        public String message() {
            return "Content not found: " + contentId;
        }

        @Override
        public String code() {
            return "CONTENT_NOT_FOUND";
        }
    }

    record AlreadyLiked(UserId userId, UUID contentId) implements ContentError {
        @Override
        public String message() {
            return "User " + userId + " already likes " + contentId;
        }

        @Override
        public String code() {
            return "ALREADY_LIKED";
        }
    }

    record NotLiked(UserId userId, UUID contentId) implements ContentError {
        @Override
        public String message() {
            return "User " + userId + " does not like " + contentId;
        }

        @Override
        public String code() {
            return "NOT_LIKED";
        }
    }

    record ValidationFailed(ValidationError error) implements ContentError {
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
