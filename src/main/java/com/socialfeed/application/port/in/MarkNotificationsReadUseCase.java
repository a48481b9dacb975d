package com.socialfeed.application.port.in;

import com.socialfeed.domain.error.NotificationError;
import com.socialfeed.domain.model.Result;
import com.socialfeed.domain.model.UserId;

import java.util.UUID;

public interface MarkNotificationsReadUseCase {
    Result<Void, NotificationError> markAsRead(UserId userId, UUID notificationId);

    int markAllAsRead(UserId userId);
}
