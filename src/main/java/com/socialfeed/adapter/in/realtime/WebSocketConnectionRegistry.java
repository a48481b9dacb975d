package com.socialfeed.adapter.in.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialfeed.domain.model.UserId;
import com.socialfeed.infrastructure.context.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket sessions of this node, grouped into rooms. Each session joins the room named by its user id
 * as soon as it is established.
 * <p>
 * Frames are JSON objects {@code {"event": ..., "data": ...}}.
 */
@Component
public class WebSocketConnectionRegistry extends TextWebSocketHandler implements ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConnectionRegistry.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> rooms = new ConcurrentHashMap<>();

    public WebSocketConnectionRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        if (!(session.getAttributes().get(UserIdHandshakeInterceptor.USER_ID_ATTRIBUTE) instanceof UserId userId)) {
            log.warn("Closing session {} without an authenticated user", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        RequestContext.set(userId, "ws-" + session.getId());
        try {
            sessions.put(session.getId(), new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
            join(userId.toString(), session.getId());
            log.debug("Session {} connected for user {}", session.getId(), userId);
        } finally {
            RequestContext.clear();
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        leave(session.getId());
        log.debug("Session {} closed: {}", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on session {}: {}", session.getId(), exception.getMessage());
        leave(session.getId());
    }

    @Override
    public void join(String room, String connectionId) {
        rooms.compute(room, (r, members) -> {
            Set<String> joined = members != null ? members : ConcurrentHashMap.newKeySet();
            joined.add(connectionId);
            return joined;
        });
    }

    /**
     * Membership changes run inside the map's per-room compute so a concurrent join never lands in a room
     * that is being dropped as empty.
     */
    @Override
    public void leave(String connectionId) {
        sessions.remove(connectionId);
        for (String room : rooms.keySet()) {
            rooms.computeIfPresent(room, (r, members) -> {
                members.remove(connectionId);
                return members.isEmpty() ? null : members;
            });
        }
    }

    @Override
    public void emitToRoom(String room, String event, Object payload) {
        Set<String> members = rooms.get(room);
        if (members == null || members.isEmpty()) {
            return;
        }
        TextMessage frame = frame(event, payload);
        if (frame != null) {
            members.forEach(id -> send(id, frame));
        }
    }

    @Override
    public void emitGlobal(String event, Object payload) {
        TextMessage frame = frame(event, payload);
        if (frame != null) {
            sessions.keySet().forEach(id -> send(id, frame));
        }
    }

    int connectionCount() {
        return sessions.size();
    }

    boolean isMember(String room, String connectionId) {
        Set<String> members = rooms.get(room);
        return members != null && members.contains(connectionId);
    }

    private void send(String connectionId, TextMessage frame) {
        WebSocketSession session = sessions.get(connectionId);
        if (session == null || !session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(frame);
        } catch (IOException | RuntimeException e) {
            log.debug("Dropping frame to session {}: {}", connectionId, e.getMessage());
        }
    }

    private TextMessage frame(String event, Object payload) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("event", event);
        frame.put("data", payload);
        try {
            return new TextMessage(objectMapper.writeValueAsString(frame));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize realtime frame {}: {}", event, e.getOriginalMessage());
            return null;
        }
    }
}
