package com.socialfeed.adapter.in.realtime.handler;

import com.socialfeed.adapter.in.realtime.ConnectionRegistry;
import com.socialfeed.adapter.in.realtime.RealtimeMessage;
import com.socialfeed.adapter.in.realtime.RealtimeMessageHandler;
import com.socialfeed.adapter.in.realtime.RealtimeMessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Announces new content globally for the discovery feeds, then to every user whose personalized
 * feed it lands in, then back to the author.
 */
@Component
public class NewPostMessageHandler implements RealtimeMessageHandler {

    private static final Logger log = LoggerFactory.getLogger(NewPostMessageHandler.class);

    @Override
    public RealtimeMessageType type() {
        return RealtimeMessageType.NEW_POST;
    }

    @Override
    public void handle(ConnectionRegistry connections, RealtimeMessage message, String channel) {
        Optional<String> authorId = message.text("authorId");
        Optional<String> postId = message.text("postId");
        if (authorId.isEmpty() || postId.isEmpty()) {
            log.debug("Ignoring new_post without author or post id");
            return;
        }
        List<String> tags = message.textList("tags");
        String timestamp = message.text("timestamp").orElse(null);

        connections.emitGlobal("discovery_new_post", payload(
            "new_post_global", authorId.get(), postId.get(), tags, timestamp));

        List<String> affectedUsers = message.textList("affectedUsers");
        for (String userId : affectedUsers) {
            connections.emitToRoom(userId, "feed_update", payload(
                "new_post", authorId.get(), postId.get(), tags, timestamp));
        }

        Map<String, Object> published = new LinkedHashMap<>();
        published.put("type", "post_published");
        published.put("postId", postId.get());
        published.put("tags", tags);
        published.put("timestamp", timestamp);
        connections.emitToRoom(authorId.get(), "feed_update", published);

        log.debug("New post {} announced globally and to {} users", postId.get(), affectedUsers.size());
    }

    private static Map<String, Object> payload(String type, String authorId, String postId, List<String> tags, String timestamp) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        payload.put("authorId", authorId);
        payload.put("postId", postId);
        payload.put("tags", tags);
        payload.put("timestamp", timestamp);
        return payload;
    }
}
