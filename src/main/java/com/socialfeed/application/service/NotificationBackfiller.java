package com.socialfeed.application.service;

import com.socialfeed.application.port.out.NotificationCachePort;
import com.socialfeed.domain.model.NotificationRecord;
import com.socialfeed.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rewrites a user's cached notification list off the request thread.
 */
@Component
public class NotificationBackfiller {

    private static final Logger log = LoggerFactory.getLogger(NotificationBackfiller.class);

    private final NotificationCachePort notificationCache;

    public NotificationBackfiller(NotificationCachePort notificationCache) {
        this.notificationCache = notificationCache;
    }

    @Async
    public void backfill(UserId userId, List<NotificationRecord> newestFirst) {
        try {
            notificationCache.backfill(userId, newestFirst);
        } catch (RuntimeException e) {
            log.warn("Notification backfill failed for {}: {}", userId, e.getMessage());
        }
    }
}
