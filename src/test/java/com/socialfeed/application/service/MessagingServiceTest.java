package com.socialfeed.application.service;

import com.socialfeed.application.event.EventBus;
import com.socialfeed.application.port.in.CreateNotificationUseCase;
import com.socialfeed.application.port.in.CreateNotificationUseCase.NewNotification;
import com.socialfeed.application.port.out.ConversationRepository;
import com.socialfeed.application.port.out.IdGenerator;
import com.socialfeed.application.port.out.MessageRepository;
import com.socialfeed.application.port.out.MetricsPort;
import com.socialfeed.application.port.out.UserRepository;
import com.socialfeed.domain.error.MessagingError;
import com.socialfeed.domain.error.ValidationError.MessageValidationError;
import com.socialfeed.domain.event.MessageSent;
import com.socialfeed.domain.event.MessageStatusUpdated;
import com.socialfeed.domain.model.Conversation;
import com.socialfeed.domain.model.DeliveryStatus;
import com.socialfeed.domain.model.NotificationAction;
import com.socialfeed.domain.model.UserId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("MessagingService")
class MessagingServiceTest {

    @Mock
    private ConversationRepository conversationRepository;

    @Mock
    private MessageRepository messageRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private CreateNotificationUseCase notifications;

    @Mock
    private EventBus eventBus;

    @Mock
    private IdGenerator idGenerator;

    @Mock
    private MetricsPort metrics;

    private MessagingService messagingService;

    private final UserId alice = UserId.random();
    private final UserId bob = UserId.random();

    @BeforeEach
    void setUp() {
        messagingService = new MessagingService(conversationRepository, messageRepository, userRepository,
            notifications, eventBus, idGenerator, metrics);
    }

    @Nested
    @DisplayName("sendMessage")
    class SendMessageTests {

        @Test
        @DisplayName("Should store the message, bump unread for the recipient and notify")
        void shouldSendMessage() {
            // Given
            when(userRepository.exists(bob)).thenReturn(true);
            when(idGenerator.generate()).thenReturn(UUID.randomUUID());
            when(conversationRepository.findOrCreate(any())).thenAnswer(inv -> inv.getArgument(0));
            ArgumentCaptor<NewNotification> notification = ArgumentCaptor.forClass(NewNotification.class);

            // When
            var result = messagingService.sendMessage(alice, bob, "  hi bob ");

            // Then
            assertTrue(result.isSuccess());
            String conversationId = Conversation.participantHash(List.of(alice, bob));
            assertEquals(conversationId, result.getOrThrow().conversationId());
            assertEquals("hi bob", result.getOrThrow().body());
            verify(messageRepository).save(result.getOrThrow(), List.of(bob));
            verify(conversationRepository).incrementUnread(conversationId, List.of(bob));
            verify(conversationRepository).resetUnread(conversationId, alice);
            verify(eventBus).queueTransactional(any(MessageSent.class));
            verify(notifications).createNotification(notification.capture());
            assertEquals(NotificationAction.MESSAGE, notification.getValue().actionType());
            assertEquals(bob, notification.getValue().receiverId());
            verify(metrics).incrementMessagesSent();
        }

        @Test
        @DisplayName("Should reject a conversation with oneself")
        void shouldRejectSelfConversation() {
            // When
            var result = messagingService.sendMessage(alice, alice, "hi me");

            // Then
            MessagingError.ValidationFailed failure = assertInstanceOf(MessagingError.ValidationFailed.class, result.errorOrNull());
            assertInstanceOf(MessageValidationError.SelfConversation.class, failure.error());
            verifyNoInteractions(conversationRepository, messageRepository);
        }

        @Test
        @DisplayName("Should reject an unknown recipient")
        void shouldRejectUnknownRecipient() {
            // Given
            when(userRepository.exists(bob)).thenReturn(false);

            // When
            var result = messagingService.sendMessage(alice, bob, "hi");

            // Then
            assertInstanceOf(MessagingError.RecipientNotFound.class, result.errorOrNull());
            verifyNoInteractions(messageRepository);
        }

        @Test
        @DisplayName("Should reject an empty body")
        void shouldRejectEmptyBody() {
            // Given
            when(userRepository.exists(bob)).thenReturn(true);
            when(idGenerator.generate()).thenReturn(UUID.randomUUID());

            // When
            var result = messagingService.sendMessage(alice, bob, "   ");

            // Then
            assertInstanceOf(MessagingError.ValidationFailed.class, result.errorOrNull());
            verifyNoInteractions(messageRepository, eventBus);
        }
    }

    @Nested
    @DisplayName("delivery status")
    class DeliveryStatusTests {

        private final Conversation conversation = Conversation.start(List.of(alice, bob));

        @Test
        @DisplayName("Should mark read, reset unread and announce the change")
        void shouldMarkRead() {
            // Given
            when(conversationRepository.findById(conversation.id())).thenReturn(Optional.of(conversation));
            when(messageRepository.advanceReceipts(conversation.id(), bob, DeliveryStatus.READ)).thenReturn(3);
            when(idGenerator.generate()).thenReturn(UUID.randomUUID());
            ArgumentCaptor<MessageStatusUpdated> event = ArgumentCaptor.forClass(MessageStatusUpdated.class);

            // When
            var result = messagingService.markConversationRead(bob, conversation.id());

            // Then
            assertEquals(3, result.getOrThrow());
            verify(conversationRepository).resetUnread(conversation.id(), bob);
            verify(eventBus).queueTransactional(event.capture());
            assertEquals(DeliveryStatus.READ, event.getValue().status());
        }

        @Test
        @DisplayName("Should stay silent when nothing advanced")
        void shouldStaySilentWhenNothingAdvanced() {
            // Given
            when(conversationRepository.findById(conversation.id())).thenReturn(Optional.of(conversation));
            when(messageRepository.advanceReceipts(conversation.id(), bob, DeliveryStatus.DELIVERED)).thenReturn(0);

            // When
            var result = messagingService.markConversationDelivered(bob, conversation.id());

            // Then
            assertEquals(0, result.getOrThrow());
            verify(conversationRepository, never()).resetUnread(any(), any());
            verifyNoInteractions(eventBus);
        }

        @Test
        @DisplayName("Should reject a non-participant")
        void shouldRejectNonParticipant() {
            // Given
            when(conversationRepository.findById(conversation.id())).thenReturn(Optional.of(conversation));

            // When
            var result = messagingService.markConversationRead(UserId.random(), conversation.id());

            // Then
            assertInstanceOf(MessagingError.NotParticipant.class, result.errorOrNull());
            verifyNoInteractions(messageRepository);
        }

        @Test
        @DisplayName("Should reject an unknown conversation")
        void shouldRejectUnknownConversation() {
            // Given
            when(conversationRepository.findById("missing")).thenReturn(Optional.empty());

            // When
            var result = messagingService.markConversationDelivered(bob, "missing");

            // Then
            assertInstanceOf(MessagingError.ConversationNotFound.class, result.errorOrNull());
        }
    }
}
