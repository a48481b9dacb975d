package com.socialfeed.application.event;

import com.socialfeed.application.port.out.PubSubPort;
import com.socialfeed.domain.event.ContentCreated;
import com.socialfeed.domain.event.ContentInteracted;
import com.socialfeed.domain.event.ContentLikeChanged;
import com.socialfeed.domain.event.DomainEvent;
import com.socialfeed.domain.event.MessageSent;
import com.socialfeed.domain.event.MessageStatusUpdated;
import com.socialfeed.domain.event.NotificationCreated;
import com.socialfeed.domain.event.NotificationsRead;
import com.socialfeed.domain.event.ProfileChanged;
import com.socialfeed.domain.model.UserId;
import com.socialfeed.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Translates committed domain events into realtime wire messages on the cross-process channels.
 * Every node's dispatcher picks them up and fans them out to its own connections.
 */
@Component
@Order(100)
public class RealtimeBridgeHandler implements DomainEventHandler<DomainEvent> {

    private static final Logger log = LoggerFactory.getLogger(RealtimeBridgeHandler.class);

    private final PubSubPort pubSub;
    private final AudienceResolver audienceResolver;
    private final AppProperties.Realtime channels;

    public RealtimeBridgeHandler(PubSubPort pubSub, AudienceResolver audienceResolver, AppProperties appProperties) {
        this.pubSub = pubSub;
        this.audienceResolver = audienceResolver;
        this.channels = appProperties.getRealtime();
    }

    @Override
    public Class<DomainEvent> eventType() {
        return DomainEvent.class;
    }

    @Override
    public void handle(DomainEvent event) {
        if (event instanceof ContentCreated created) {
            Map<String, Object> message = message("new_post", event);
            message.put("authorId", created.authorId().toString());
            message.put("postId", created.contentId().toString());
            message.put("tags", created.tags());
            message.put("affectedUsers", ids(audienceResolver.audienceOf(created)));
            send(channels.getFeedChannel(), message);
        } else if (event instanceof ContentLikeChanged liked) {
            Map<String, Object> message = message("like_update", event);
            message.put("postId", liked.contentId().toString());
            message.put("newLikes", liked.newLikes());
            send(channels.getFeedChannel(), message);
        } else if (event instanceof ContentInteracted interacted) {
            Map<String, Object> message = message("interaction", event);
            message.put("userId", interacted.actorId().toString());
            message.put("actionType", interacted.actionType());
            message.put("targetId", interacted.contentId().toString());
            message.put("tags", interacted.tags());
            send(channels.getFeedChannel(), message);
        } else if (event instanceof ProfileChanged changed && changed.avatarChanged()) {
            Map<String, Object> message = message("avatar_changed", event);
            message.put("userId", changed.userId().toString());
            message.put("newAvatar", changed.avatarUrl());
            send(channels.getFeedChannel(), message);
        } else if (event instanceof MessageSent sent) {
            Map<String, Object> message = message("message_sent", event);
            message.put("conversationId", sent.conversationId());
            message.put("messageId", sent.messageId().toString());
            message.put("senderId", sent.senderId().toString());
            message.put("recipients", ids(sent.recipients()));
            send(channels.getMessagingChannel(), message);
        } else if (event instanceof MessageStatusUpdated updated) {
            Map<String, Object> message = message("message_status_updated", event);
            message.put("conversationId", updated.conversationId());
            message.put("recipients", ids(updated.recipients()));
            message.put("status", updated.status().wireName());
            send(channels.getMessagingChannel(), message);
        } else if (event instanceof NotificationCreated created) {
            Map<String, Object> message = message("notification", event);
            message.put("receiverId", created.notification().receiverId().toString());
            message.put("notification", created.notification());
            send(channels.getNotificationChannel(), message);
        } else if (event instanceof NotificationsRead read) {
            Map<String, Object> message = message("notification_read", event);
            message.put("userId", read.userId().toString());
            message.put("notificationIds", read.notificationIds().stream().map(UUID::toString).toList());
            message.put("all", read.allRead());
            send(channels.getNotificationChannel(), message);
        }
    }

    private void send(String channel, Map<String, Object> message) {
        long receivers = pubSub.publish(channel, message);
        log.debug("Published {} on {} to {} subscribers", message.get("type"), channel, receivers);
    }

    private static Map<String, Object> message(String type, DomainEvent event) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type);
        message.put("timestamp", event.occurredAt().toString());
        return message;
    }

    private static List<String> ids(Collection<UserId> users) {
        return users.stream().map(UserId::toString).toList();
    }
}
