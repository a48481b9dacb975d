package com.socialfeed.application.port.in;

import com.socialfeed.domain.model.NotificationRecord;
import com.socialfeed.domain.model.UserId;

import java.time.Instant;
import java.util.List;

public interface GetNotificationsUseCase {

    /**
     * Newest first. A non-null {@code before} pages through durable storage only.
     */
    List<NotificationRecord> getNotifications(UserId userId, int limit, Instant before);

    long getUnreadCount(UserId userId);
}
