package com.socialfeed.adapter.in.realtime.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.socialfeed.adapter.in.realtime.ConnectionRegistry;
import com.socialfeed.adapter.in.realtime.RealtimeMessage;
import com.socialfeed.adapter.in.realtime.RealtimeMessageHandler;
import com.socialfeed.adapter.in.realtime.RealtimeMessageType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Like counts are public, so the new count goes to everyone.
 */
@Component
public class LikeUpdateMessageHandler implements RealtimeMessageHandler {

    @Override
    public RealtimeMessageType type() {
        return RealtimeMessageType.LIKE_UPDATE;
    }

    @Override
    public void handle(ConnectionRegistry connections, RealtimeMessage message, String channel) {
        Optional<String> postId = message.text("postId");
        Optional<JsonNode> newLikes = message.node("newLikes").filter(JsonNode::isNumber);
        if (postId.isEmpty() || newLikes.isEmpty()) {
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "like_count_changed");
        payload.put("postId", postId.get());
        payload.put("newLikes", newLikes.get().longValue());
        payload.put("timestamp", message.text("timestamp").orElse(null));
        connections.emitGlobal("like_update", payload);
    }
}
