package com.socialfeed.adapter.in.realtime.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialfeed.adapter.in.realtime.ConnectionRegistry;
import com.socialfeed.adapter.in.realtime.RealtimeMessage;
import com.socialfeed.adapter.in.realtime.RealtimeMessageType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Realtime message handlers")
class RealtimeMessageHandlersTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private ConnectionRegistry connections;

    private static RealtimeMessage message(RealtimeMessageType type, Map<String, Object> body) {
        return new RealtimeMessage(type, MAPPER.valueToTree(body));
    }

    @Nested
    @DisplayName("new post")
    class NewPostTests {

        private final NewPostMessageHandler handler = new NewPostMessageHandler();

        @Test
        @DisplayName("Should announce globally, to affected users and to the author")
        void shouldFanOut() {
            // Given
            var msg = message(RealtimeMessageType.NEW_POST, Map.of(
                "authorId", "author", "postId", "p1", "tags", List.of("java"),
                "affectedUsers", List.of("u1", "u2")));

            // When
            handler.handle(connections, msg, "feed_updates");

            // Then
            verify(connections).emitGlobal(eq("discovery_new_post"), any());
            verify(connections).emitToRoom(eq("u1"), eq("feed_update"), any());
            verify(connections).emitToRoom(eq("u2"), eq("feed_update"), any());
            verify(connections).emitToRoom(eq("author"), eq("feed_update"), any());
        }

        @Test
        @DisplayName("Should ignore messages without a post id")
        void shouldIgnoreIncomplete() {
            // When
            handler.handle(connections, message(RealtimeMessageType.NEW_POST, Map.of("authorId", "author")), "feed_updates");

            // Then
            verifyNoInteractions(connections);
        }
    }

    @Nested
    @DisplayName("like update")
    class LikeUpdateTests {

        private final LikeUpdateMessageHandler handler = new LikeUpdateMessageHandler();

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("Should broadcast the new like count")
        void shouldBroadcastCount() {
            // Given
            ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);

            // When
            handler.handle(connections, message(RealtimeMessageType.LIKE_UPDATE,
                Map.of("postId", "p1", "newLikes", 12)), "feed_updates");

            // Then
            verify(connections).emitGlobal(eq("like_update"), payload.capture());
            verify(connections, never()).emitToRoom(any(), any(), any());
            Map<String, Object> sent = (Map<String, Object>) payload.getValue();
            assertEquals("p1", sent.get("postId"));
            assertEquals(12L, sent.get("newLikes"));
        }

        @Test
        @DisplayName("Should ignore a non-numeric count")
        void shouldIgnoreNonNumericCount() {
            // When
            handler.handle(connections, message(RealtimeMessageType.LIKE_UPDATE,
                Map.of("postId", "p1", "newLikes", "many")), "feed_updates");

            // Then
            verifyNoInteractions(connections);
        }
    }

    @Nested
    @DisplayName("messaging")
    class MessagingTests {

        @Test
        @DisplayName("Should deliver a sent message to the sender and every recipient once")
        void shouldDeliverToSenderAndRecipients() {
            // Given
            var handler = new MessageSentMessageHandler();
            var msg = message(RealtimeMessageType.MESSAGE_SENT, Map.of(
                "conversationId", "a:b", "senderId", "a", "messageId", "m1",
                "recipients", List.of("b", "a", "")));

            // When
            handler.handle(connections, msg, "messaging_updates");

            // Then
            verify(connections).emitToRoom(eq("a"), eq("messaging_update"), any());
            verify(connections).emitToRoom(eq("b"), eq("messaging_update"), any());
            verifyNoMoreInteractions(connections);
        }

        @Test
        @DisplayName("Should deliver status updates to the listed recipients")
        void shouldDeliverStatusUpdates() {
            // Given
            var handler = new MessageStatusUpdatedMessageHandler();
            var msg = message(RealtimeMessageType.MESSAGE_STATUS_UPDATED, Map.of(
                "conversationId", "a:b", "status", "read", "recipients", List.of("a")));

            // When
            handler.handle(connections, msg, "messaging_updates");

            // Then
            verify(connections).emitToRoom(eq("a"), eq("messaging_update"), any());
            verifyNoMoreInteractions(connections);
        }
    }

    @Nested
    @DisplayName("notifications")
    class NotificationTests {

        @Test
        @DisplayName("Should push a notification to its receiver only")
        void shouldPushToReceiver() {
            // Given
            var handler = new NotificationMessageHandler();
            var msg = message(RealtimeMessageType.NOTIFICATION, Map.of(
                "receiverId", "u1", "notification", Map.of("id", "n1", "type", "like")));

            // When
            handler.handle(connections, msg, "notification_updates");

            // Then
            ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
            verify(connections).emitToRoom(eq("u1"), eq("new_notification"), payload.capture());
            assertEquals("n1", ((JsonNode) payload.getValue()).get("id").textValue());
            verify(connections, never()).emitGlobal(any(), any());
        }

        @Test
        @DisplayName("Should ignore a notification without a receiver")
        void shouldIgnoreMissingReceiver() {
            // When
            new NotificationMessageHandler().handle(connections, message(RealtimeMessageType.NOTIFICATION,
                Map.of("notification", Map.of("id", "n1"))), "notification_updates");

            // Then
            verifyNoInteractions(connections);
        }

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("Should sync read state to the owner's sessions")
        void shouldSyncReadState() {
            // Given
            var handler = new NotificationReadMessageHandler();
            ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);

            // When
            handler.handle(connections, message(RealtimeMessageType.NOTIFICATION_READ,
                Map.of("userId", "u1", "all", true)), "notification_updates");

            // Then
            verify(connections).emitToRoom(eq("u1"), eq("notification_read"), payload.capture());
            Map<String, Object> sent = (Map<String, Object>) payload.getValue();
            assertEquals(Boolean.TRUE, sent.get("all"));
            assertEquals(List.of(), sent.get("notificationIds"));
        }
    }

    @Nested
    @DisplayName("profile and interaction")
    class BroadcastTests {

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("Should broadcast avatar changes keyed by the user's public id")
        void shouldBroadcastAvatarChange() {
            // Given
            var handler = new AvatarUpdateMessageHandler();
            ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);

            // When
            handler.handle(connections, message(RealtimeMessageType.AVATAR_CHANGED,
                Map.of("userPublicId", "u1", "avatarUrl", "https://cdn/a.png")), "profile_snapshot_updates");

            // Then
            verify(connections).emitGlobal(eq("avatar_update"), payload.capture());
            Map<String, Object> sent = (Map<String, Object>) payload.getValue();
            assertEquals("u1", sent.get("userId"));
            assertEquals("https://cdn/a.png", sent.get("newAvatar"));
        }

        @Test
        @DisplayName("Should require both user and target for interactions")
        void shouldRequireInteractionTarget() {
            // Given
            var handler = new InteractionMessageHandler();

            // When
            handler.handle(connections, message(RealtimeMessageType.INTERACTION, Map.of("userId", "u1")), "feed_updates");
            handler.handle(connections, message(RealtimeMessageType.INTERACTION,
                Map.of("userId", "u1", "targetId", "p1", "actionType", "like")), "feed_updates");

            // Then
            verify(connections, times(1)).emitGlobal(eq("feed_interaction"), any());
        }
    }
}
