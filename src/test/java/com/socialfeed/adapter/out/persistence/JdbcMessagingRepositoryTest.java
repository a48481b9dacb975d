package com.socialfeed.adapter.out.persistence;

import com.socialfeed.domain.model.Conversation;
import com.socialfeed.domain.model.DeliveryStatus;
import com.socialfeed.domain.model.Message;
import com.socialfeed.domain.model.UserId;
import com.socialfeed.integration.base.FullStackTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@EnabledIf("isDockerAvailable")
class JdbcMessagingRepositoryTest extends FullStackTestBase {

    @Autowired
    private JdbcConversationRepository conversationRepository;

    @Autowired
    private JdbcMessageRepository messageRepository;

    private UserId alice;
    private UserId bob;
    private Conversation conversation;

    @BeforeEach
    void setUpConversation() {
        alice = UserId.random();
        bob = UserId.random();
        conversation = conversationRepository.findOrCreate(Conversation.start(List.of(alice, bob)));
    }

    @Test
    void shouldReuseConversationForSameParticipants() {
        // When
        Conversation again = conversationRepository.findOrCreate(Conversation.start(List.of(bob, alice)));

        // Then
        assertEquals(conversation.id(), again.id());
        assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM conversations", Integer.class));
        assertTrue(again.hasParticipant(alice));
        assertTrue(again.hasParticipant(bob));
    }

    @Test
    void shouldTrackUnreadPerParticipant() {
        // When
        conversationRepository.incrementUnread(conversation.id(), List.of(bob));
        conversationRepository.incrementUnread(conversation.id(), List.of(bob));

        // Then
        assertEquals(2, conversationRepository.getUnread(conversation.id(), bob));
        assertEquals(0, conversationRepository.getUnread(conversation.id(), alice));

        conversationRepository.resetUnread(conversation.id(), bob);
        assertEquals(0, conversationRepository.getUnread(conversation.id(), bob));
    }

    @Test
    void shouldOnlyMoveLastMessageTimeForward() {
        // Given
        Instant later = conversation.lastMessageAt().plusSeconds(60);

        // When
        conversationRepository.touch(conversation.id(), later);
        conversationRepository.touch(conversation.id(), later.minusSeconds(3600));

        // Then
        Instant stored = conversationRepository.findById(conversation.id()).orElseThrow().lastMessageAt();
        assertEquals(later.toEpochMilli(), stored.toEpochMilli());
    }

    @Test
    void shouldAdvanceReceiptsForwardOnly() {
        // Given
        Message message = Message.create(UUID.randomUUID(), conversation.id(), alice, "hi").getOrThrow();
        messageRepository.save(message, List.of(bob));
        assertEquals(Optional.of(DeliveryStatus.SENT), messageRepository.findReceiptStatus(message.id(), bob));

        // When
        int toRead = messageRepository.advanceReceipts(conversation.id(), bob, DeliveryStatus.READ);
        int backToDelivered = messageRepository.advanceReceipts(conversation.id(), bob, DeliveryStatus.DELIVERED);

        // Then
        assertEquals(1, toRead);
        assertEquals(0, backToDelivered);
        assertEquals(Optional.of(DeliveryStatus.READ), messageRepository.findReceiptStatus(message.id(), bob));
        assertTrue(messageRepository.findReceiptStatus(message.id(), alice).isEmpty());
    }
}
