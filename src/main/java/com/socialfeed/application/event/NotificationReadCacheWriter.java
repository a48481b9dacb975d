package com.socialfeed.application.event;

import com.socialfeed.application.port.out.NotificationCachePort;
import com.socialfeed.domain.event.NotificationsRead;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Mirrors committed read flags into the cached notification hashes.
 */
@Component
@Order(20)
public class NotificationReadCacheWriter implements DomainEventHandler<NotificationsRead> {

    private final NotificationCachePort notificationCache;

    public NotificationReadCacheWriter(NotificationCachePort notificationCache) {
        this.notificationCache = notificationCache;
    }

    @Override
    public Class<NotificationsRead> eventType() {
        return NotificationsRead.class;
    }

    @Override
    public void handle(NotificationsRead event) {
        if (event.allRead()) {
            notificationCache.markAllRead(event.userId());
            return;
        }
        event.notificationIds().forEach(id -> notificationCache.markRead(event.userId(), id));
    }
}
