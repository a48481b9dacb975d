package com.socialfeed.application.port.out;

import com.socialfeed.domain.model.NotificationRecord;
import com.socialfeed.domain.model.UserId;

import java.util.List;
import java.util.UUID;

/**
 * Capped, newest-first per-user notification list in the cache tier. Advisory only: every method
 * degrades to a no-op or an empty result when the cache is unavailable.
 */
public interface NotificationCachePort {

    /**
     * Pushes onto the head of the list and evicts the oldest entries beyond the configured cap.
     */
    void push(NotificationRecord notification);

    List<NotificationRecord> getLatest(UserId userId, int limit);

    /**
     * Replaces the cached list with {@code newestFirst}, truncated to the cap.
     */
    void backfill(UserId userId, List<NotificationRecord> newestFirst);

    void markRead(UserId userId, UUID notificationId);

    void markAllRead(UserId userId);
}
