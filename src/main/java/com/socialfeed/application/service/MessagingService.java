package com.socialfeed.application.service;

import com.socialfeed.application.event.EventBus;
import com.socialfeed.application.port.in.CreateNotificationUseCase;
import com.socialfeed.application.port.in.CreateNotificationUseCase.NewNotification;
import com.socialfeed.application.port.in.SendMessageUseCase;
import com.socialfeed.application.port.in.UpdateMessageStatusUseCase;
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
import com.socialfeed.domain.model.Message;
import com.socialfeed.domain.model.NotificationAction;
import com.socialfeed.domain.model.Result;
import com.socialfeed.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * 1:1 messaging. Each recipient holds its own receipt per message, which only ever moves
 * forward through {@link DeliveryStatus}.
 */
@Service
public class MessagingService implements SendMessageUseCase, UpdateMessageStatusUseCase {

    private static final Logger log = LoggerFactory.getLogger(MessagingService.class);

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final UserRepository userRepository;
    private final CreateNotificationUseCase notifications;
    private final EventBus eventBus;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;

    public MessagingService(
            ConversationRepository conversationRepository,
            MessageRepository messageRepository,
            UserRepository userRepository,
            CreateNotificationUseCase notifications,
            EventBus eventBus,
            IdGenerator idGenerator,
            MetricsPort metrics) {
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.userRepository = userRepository;
        this.notifications = notifications;
        this.eventBus = eventBus;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
    }

    @Override
    @Transactional
    public Result<Message, MessagingError> sendMessage(UserId senderId, UserId recipientId, String body) {
        if (senderId.equals(recipientId)) {
            return Result.failure(new MessagingError.ValidationFailed(MessageValidationError.SelfConversation.INSTANCE));
        }
        if (!userRepository.exists(recipientId)) {
            log.debug("Message to unknown recipient {} rejected", recipientId);
            return Result.failure(new MessagingError.RecipientNotFound(recipientId));
        }

        Conversation candidate = Conversation.start(List.of(senderId, recipientId));
        var messageResult = Message.create(idGenerator.generate(), candidate.id(), senderId, body);
        if (messageResult.isFailure()) {
            log.warn("Message validation failed: {}", messageResult.errorOrNull().message());
            return Result.failure(new MessagingError.ValidationFailed(messageResult.errorOrNull()));
        }
        Message message = messageResult.getOrThrow();

        Conversation conversation = conversationRepository.findOrCreate(candidate);
        List<UserId> recipients = conversation.recipientsOf(senderId);

        messageRepository.save(message, recipients);
        conversationRepository.touch(conversation.id(), message.createdAt());
        conversationRepository.incrementUnread(conversation.id(), recipients);
        conversationRepository.resetUnread(conversation.id(), senderId);

        eventBus.queueTransactional(MessageSent.from(
            idGenerator.generate(), conversation.id(), message.id(), senderId, recipients));
        for (UserId recipient : recipients) {
            notifications.createNotification(new NewNotification(
                recipient, NotificationAction.MESSAGE, senderId, conversation.id(), "conversation", message.body()));
        }

        metrics.incrementMessagesSent();
        log.info("Message sent: id={}, conversation={}, sender={}", message.id(), conversation.id(), senderId);
        return Result.success(message);
    }

    @Override
    @Transactional
    public Result<Integer, MessagingError> markConversationDelivered(UserId userId, String conversationId) {
        return advance(userId, conversationId, DeliveryStatus.DELIVERED);
    }

    @Override
    @Transactional
    public Result<Integer, MessagingError> markConversationRead(UserId userId, String conversationId) {
        return advance(userId, conversationId, DeliveryStatus.READ);
    }

    private Result<Integer, MessagingError> advance(UserId userId, String conversationId, DeliveryStatus target) {
        Optional<Conversation> found = conversationRepository.findById(conversationId);
        if (found.isEmpty()) {
            return Result.failure(new MessagingError.ConversationNotFound(conversationId));
        }
        Conversation conversation = found.get();
        if (!conversation.hasParticipant(userId)) {
            return Result.failure(new MessagingError.NotParticipant(userId, conversationId));
        }

        int advanced = messageRepository.advanceReceipts(conversationId, userId, target);
        if (target == DeliveryStatus.READ) {
            conversationRepository.resetUnread(conversationId, userId);
        }

        if (advanced > 0) {
            eventBus.queueTransactional(MessageStatusUpdated.from(
                idGenerator.generate(), conversationId, userId, conversation.participants(), target));
        }
        log.debug("Advanced {} receipts to {} for {} in {}", advanced, target.wireName(), userId, conversationId);
        return Result.success(advanced);
    }
}
