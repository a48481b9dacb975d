package com.socialfeed.adapter.in.realtime.handler;

import com.socialfeed.adapter.in.realtime.ConnectionRegistry;
import com.socialfeed.adapter.in.realtime.RealtimeMessage;
import com.socialfeed.adapter.in.realtime.RealtimeMessageHandler;
import com.socialfeed.adapter.in.realtime.RealtimeMessageType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Component
public class MessageStatusUpdatedMessageHandler implements RealtimeMessageHandler {

    @Override
    public RealtimeMessageType type() {
        return RealtimeMessageType.MESSAGE_STATUS_UPDATED;
    }

    @Override
    public void handle(ConnectionRegistry connections, RealtimeMessage message, String channel) {
        Optional<String> conversationId = message.text("conversationId");
        Optional<String> status = message.text("status");
        if (conversationId.isEmpty() || status.isEmpty()) {
            return;
        }

        Set<String> rooms = new LinkedHashSet<>(message.textList("recipients"));
        rooms.removeIf(String::isBlank);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "message_status_updated");
        payload.put("conversationId", conversationId.get());
        payload.put("status", status.get());
        payload.put("timestamp", message.text("timestamp").orElse(null));

        rooms.forEach(room -> connections.emitToRoom(room, "messaging_update", payload));
    }
}
