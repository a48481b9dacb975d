package com.socialfeed.adapter.in.realtime.handler;

import com.socialfeed.adapter.in.realtime.ConnectionRegistry;
import com.socialfeed.adapter.in.realtime.RealtimeMessage;
import com.socialfeed.adapter.in.realtime.RealtimeMessageHandler;
import com.socialfeed.adapter.in.realtime.RealtimeMessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Component
public class MessageSentMessageHandler implements RealtimeMessageHandler {

    private static final Logger log = LoggerFactory.getLogger(MessageSentMessageHandler.class);

    @Override
    public RealtimeMessageType type() {
        return RealtimeMessageType.MESSAGE_SENT;
    }

    @Override
    public void handle(ConnectionRegistry connections, RealtimeMessage message, String channel) {
        Optional<String> conversationId = message.text("conversationId");
        Optional<String> senderId = message.text("senderId");
        if (conversationId.isEmpty() || senderId.isEmpty()) {
            return;
        }

        // the sender's other sessions need the message too
        Set<String> rooms = new LinkedHashSet<>();
        rooms.add(senderId.get());
        rooms.addAll(message.textList("recipients"));
        rooms.removeIf(String::isBlank);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "message_sent");
        payload.put("conversationId", conversationId.get());
        payload.put("messageId", message.text("messageId").orElse(null));
        payload.put("senderId", senderId.get());
        payload.put("timestamp", message.text("timestamp").orElse(null));

        rooms.forEach(room -> connections.emitToRoom(room, "messaging_update", payload));
        log.debug("Message in {} delivered to {} rooms via {}", conversationId.get(), rooms.size(), channel);
    }
}
