package com.socialfeed.domain.error;

import com.socialfeed.domain.model.UserId;

public sealed interface MessagingError {

    record ConversationNotFound(String conversationId) implements MessagingError {
        @Override
        public String message() {
            return "Conversation not found: " + conversationId;
        }

        @Override
        public String code() {
            return "CONVERSATION_NOT_FOUND";
        }
    }

    record NotParticipant(UserId userId, String conversationId) implements MessagingError {
        @Override
        public String message() {
            return "User " + userId + " is not a participant of " + conversationId;
        }

        @Override
        public String code() {
            return "NOT_PARTICIPANT";
        }
    }

    record RecipientNotFound(UserId recipientId) implements MessagingError {
        @Override
        public String message() {
            return "Recipient not found: " + recipientId;
        }

        @Override
        public String code() {
            return "RECIPIENT_NOT_FOUND";
        }
    }

    record ValidationFailed(ValidationError error) implements MessagingError {
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
