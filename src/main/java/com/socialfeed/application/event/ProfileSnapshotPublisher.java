package com.socialfeed.application.event;

import com.socialfeed.application.port.out.PubSubPort;
import com.socialfeed.domain.event.ProfileChanged;
import com.socialfeed.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hands committed profile changes to the profile-sync worker, which rewrites the author
 * snapshot denormalized onto existing content.
 */
@Component
@Order(100)
public class ProfileSnapshotPublisher implements DomainEventHandler<ProfileChanged> {

    private static final Logger log = LoggerFactory.getLogger(ProfileSnapshotPublisher.class);

    private final PubSubPort pubSub;
    private final String channel;

    public ProfileSnapshotPublisher(PubSubPort pubSub, AppProperties appProperties) {
        this.pubSub = pubSub;
        this.channel = appProperties.getRealtime().getProfileChannel();
    }

    @Override
    public Class<ProfileChanged> eventType() {
        return ProfileChanged.class;
    }

    @Override
    public void handle(ProfileChanged event) {
        if (event.avatarChanged()) {
            Map<String, Object> message = message("avatar_changed", event);
            message.put("avatarUrl", event.avatarUrl());
            pubSub.publish(channel, message);
        }
        if (event.usernameChanged()) {
            Map<String, Object> message = message("username_changed", event);
            message.put("username", event.username());
            pubSub.publish(channel, message);
        }
        log.debug("Queued author snapshot refresh for {}", event.userId());
    }

    private static Map<String, Object> message(String type, ProfileChanged event) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type);
        message.put("userPublicId", event.userId().toString());
        message.put("timestamp", event.occurredAt().toString());
        return message;
    }
}
