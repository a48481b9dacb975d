package com.socialfeed.adapter.in.realtime.handler;

import com.socialfeed.adapter.in.realtime.ConnectionRegistry;
import com.socialfeed.adapter.in.realtime.RealtimeMessage;
import com.socialfeed.adapter.in.realtime.RealtimeMessageHandler;
import com.socialfeed.adapter.in.realtime.RealtimeMessageType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the owner's other sessions in sync when notifications are read in one of them.
 */
@Component
public class NotificationReadMessageHandler implements RealtimeMessageHandler {

    @Override
    public RealtimeMessageType type() {
        return RealtimeMessageType.NOTIFICATION_READ;
    }

    @Override
    public void handle(ConnectionRegistry connections, RealtimeMessage message, String channel) {
        Optional<String> userId = message.text("userId");
        if (userId.isEmpty()) {
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("notificationIds", message.textList("notificationIds"));
        payload.put("all", message.node("all").map(node -> node.asBoolean(false)).orElse(false));
        payload.put("timestamp", message.text("timestamp").orElse(null));
        connections.emitToRoom(userId.get(), "notification_read", payload);
    }
}
