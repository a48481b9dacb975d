package com.socialfeed.domain.error;

/**
 * Sealed type representing domain validation errors.
 * These are expected business outcomes, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    // UserId validation errors
    sealed interface UserIdError extends ValidationError {

        record Empty() implements UserIdError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "User ID cannot be empty";
            }

            @Override
            public String code() {
                return "USER_ID_EMPTY";
            }
        }

        record InvalidFormat(String value) implements UserIdError {
            @Override
            public String message() {
                return "User ID must be a valid UUID format: " + value;
            }

            @Override
            public String code() {
                return "USER_ID_INVALID_FORMAT";
            }
        }
    }

    // Content validation errors
    sealed interface ContentValidationError extends ValidationError {

        record EmptyBody() implements ContentValidationError {
            public static final EmptyBody INSTANCE = new EmptyBody();
            @Override
            public String message() {
                return "Content body cannot be empty";
            }

            @Override
            public String code() {
                return "CONTENT_BODY_EMPTY";
            }
        }

        record BodyTooLong(int length, int maxLength) implements ContentValidationError {
            @Override
            public String message() {
                return "Content body exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "CONTENT_BODY_TOO_LONG";
            }
        }

        record TooManyTags(int count, int maxTags) implements ContentValidationError {
            @Override
            public String message() {
                return "Content may carry at most " + maxTags + " tags (was " + count + ")";
            }

            @Override
            public String code() {
                return "CONTENT_TOO_MANY_TAGS";
            }
        }
    }

    sealed interface FollowValidationError extends ValidationError {

        record SelfFollow() implements FollowValidationError {
            public static final SelfFollow INSTANCE = new SelfFollow();
            @Override
            public String message() {
                return "Cannot follow yourself";
            }

            @Override
            public String code() {
                return "SELF_FOLLOW";
            }
        }
    }

    sealed interface MessageValidationError extends ValidationError {

        record EmptyBody() implements MessageValidationError {
            public static final EmptyBody INSTANCE = new EmptyBody();
            @Override
            public String message() {
                return "Message body cannot be empty";
            }

            @Override
            public String code() {
                return "MESSAGE_BODY_EMPTY";
            }
        }

        record BodyTooLong(int length, int maxLength) implements MessageValidationError {
            @Override
            public String message() {
                return "Message body exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "MESSAGE_BODY_TOO_LONG";
            }
        }

        record SelfConversation() implements MessageValidationError {
            public static final SelfConversation INSTANCE = new SelfConversation();
            @Override
            public String message() {
                return "Cannot start a conversation with yourself";
            }

            @Override
            public String code() {
                return "SELF_CONVERSATION";
            }
        }
    }

    sealed interface ProfileValidationError extends ValidationError {

        record NothingToUpdate() implements ProfileValidationError {
            public static final NothingToUpdate INSTANCE = new NothingToUpdate();
            @Override
            public String message() {
                return "Profile update must change the username or the avatar";
            }

            @Override
            public String code() {
                return "PROFILE_NOTHING_TO_UPDATE";
            }
        }

        record InvalidUsername(String username) implements ProfileValidationError {
            @Override
            public String message() {
                return "Username must be 3 to 30 characters of letters, digits or underscores: " + username;
            }

            @Override
            public String code() {
                return "PROFILE_INVALID_USERNAME";
            }
        }
    }
}
