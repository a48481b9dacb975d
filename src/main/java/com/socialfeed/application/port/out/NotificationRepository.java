package com.socialfeed.application.port.out;

import com.socialfeed.domain.model.NotificationRecord;
import com.socialfeed.domain.model.UserId;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Durable source of truth for notifications.
 */
public interface NotificationRepository {
    void save(NotificationRecord notification);

    /**
     * Newest first; a null {@code before} starts from the latest notification.
     */
    List<NotificationRecord> findByReceiver(UserId receiverId, Instant before, int limit);

    boolean markAsRead(UserId receiverId, UUID notificationId);

    int markAllAsRead(UserId receiverId);

    long countUnread(UserId receiverId);
}
