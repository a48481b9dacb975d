package com.socialfeed.adapter.in.realtime.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.socialfeed.adapter.in.realtime.ConnectionRegistry;
import com.socialfeed.adapter.in.realtime.RealtimeMessage;
import com.socialfeed.adapter.in.realtime.RealtimeMessageHandler;
import com.socialfeed.adapter.in.realtime.RealtimeMessageType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Pushes a new notification to its receiver's sessions only.
 */
@Component
public class NotificationMessageHandler implements RealtimeMessageHandler {

    @Override
    public RealtimeMessageType type() {
        return RealtimeMessageType.NOTIFICATION;
    }

    @Override
    public void handle(ConnectionRegistry connections, RealtimeMessage message, String channel) {
        Optional<String> receiverId = message.text("receiverId");
        Optional<JsonNode> notification = message.node("notification");
        if (receiverId.isEmpty() || notification.isEmpty()) {
            return;
        }
        connections.emitToRoom(receiverId.get(), "new_notification", notification.get());
    }
}
