package com.socialfeed.domain.error;

import com.socialfeed.domain.model.UserId;

import java.util.UUID;

public sealed interface NotificationError {

    /**
     * Also returned when the notification exists but belongs to another user.
     */
    record NotFound(UserId userId, UUID notificationId) implements NotificationError {
        @Override
        public String message() {
            return "Notification " + notificationId + " not found for user " + userId;
        }

        @Override
        public String code() {
            return "NOTIFICATION_NOT_FOUND";
        }
    }

    String message();

    String code();
}
