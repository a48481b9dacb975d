package com.socialfeed.application.port.in;

import com.socialfeed.domain.model.NotificationAction;
import com.socialfeed.domain.model.NotificationRecord;
import com.socialfeed.domain.model.UserId;

public interface CreateNotificationUseCase {

    NotificationRecord createNotification(NewNotification request);

    record NewNotification(
        UserId receiverId,
        NotificationAction actionType,
        UserId actorId,
        String targetId,
        String targetType,
        String preview
    ) {}
}
