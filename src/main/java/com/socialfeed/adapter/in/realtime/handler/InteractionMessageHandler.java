package com.socialfeed.adapter.in.realtime.handler;

import com.socialfeed.adapter.in.realtime.ConnectionRegistry;
import com.socialfeed.adapter.in.realtime.RealtimeMessage;
import com.socialfeed.adapter.in.realtime.RealtimeMessageHandler;
import com.socialfeed.adapter.in.realtime.RealtimeMessageType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Component
public class InteractionMessageHandler implements RealtimeMessageHandler {

    @Override
    public RealtimeMessageType type() {
        return RealtimeMessageType.INTERACTION;
    }

    @Override
    public void handle(ConnectionRegistry connections, RealtimeMessage message, String channel) {
        Optional<String> userId = message.text("userId");
        Optional<String> targetId = message.text("targetId");
        if (userId.isEmpty() || targetId.isEmpty()) {
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "user_interaction");
        payload.put("userId", userId.get());
        payload.put("actionType", message.text("actionType").orElse(null));
        payload.put("targetId", targetId.get());
        payload.put("tags", message.textList("tags"));
        payload.put("timestamp", message.text("timestamp").orElse(null));
        connections.emitGlobal("feed_interaction", payload);
    }
}
