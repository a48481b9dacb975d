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
 * Avatars appear on everyone's feeds, so the change is broadcast.
 */
@Component
public class AvatarUpdateMessageHandler implements RealtimeMessageHandler {

    @Override
    public RealtimeMessageType type() {
        return RealtimeMessageType.AVATAR_CHANGED;
    }

    @Override
    public void handle(ConnectionRegistry connections, RealtimeMessage message, String channel) {
        Optional<String> userId = message.text("userId").or(() -> message.text("userPublicId"));
        if (userId.isEmpty()) {
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "user_avatar_changed");
        payload.put("userId", userId.get());
        payload.put("oldAvatar", message.text("oldAvatar").orElse(null));
        payload.put("newAvatar", message.text("newAvatar").or(() -> message.text("avatarUrl")).orElse(null));
        payload.put("timestamp", message.text("timestamp").orElse(null));
        connections.emitGlobal("avatar_update", payload);
    }
}
