package com.socialfeed.application.event;

import com.socialfeed.application.port.out.NotificationCachePort;
import com.socialfeed.domain.event.NotificationCreated;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(20)
public class NotificationCacheWriter implements DomainEventHandler<NotificationCreated> {

    private final NotificationCachePort notificationCache;

    public NotificationCacheWriter(NotificationCachePort notificationCache) {
        this.notificationCache = notificationCache;
    }

    @Override
    public Class<NotificationCreated> eventType() {
        return NotificationCreated.class;
    }

    @Override
    public void handle(NotificationCreated event) {
        notificationCache.push(event.notification());
    }
}
