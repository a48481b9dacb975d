package com.socialfeed.adapter.out.persistence;

import com.socialfeed.application.port.out.MessageRepository;
import com.socialfeed.domain.model.DeliveryStatus;
import com.socialfeed.domain.model.Message;
import com.socialfeed.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Messages plus one receipt row per recipient. Receipt status is stored as the {@link DeliveryStatus}
 * rank so the forward-only guard is a plain comparison in SQL.
 */
@Repository
public class JdbcMessageRepository implements MessageRepository {

    private final JdbcTemplate jdbc;

    public JdbcMessageRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Message message, Collection<UserId> recipients) {
        jdbc.update("""
            INSERT INTO messages (id, conversation_id, sender_id, body, created_at)
            VALUES (?, ?, ?, ?, ?)
            """,
            message.id(),
            message.conversationId(),
            message.senderId().toString(),
            message.body(),
            Timestamp.from(message.createdAt())
        );

        Timestamp now = Timestamp.from(message.createdAt());
        List<Object[]> receipts = recipients.stream()
            .map(r -> new Object[] {message.id(), r.toString(), DeliveryStatus.SENT.rank(), now})
            .toList();
        jdbc.batchUpdate("""
            INSERT INTO message_receipts (message_id, recipient_id, status, updated_at)
            VALUES (?, ?, ?, ?)
            """, receipts);
    }

    @Override
    public int advanceReceipts(String conversationId, UserId recipient, DeliveryStatus target) {
        return jdbc.update("""
            UPDATE message_receipts r
            SET status = ?, updated_at = ?
            FROM messages m
            WHERE r.message_id = m.id
              AND m.conversation_id = ?
              AND r.recipient_id = ?
              AND r.status < ?
            """,
            target.rank(),
            Timestamp.from(Instant.now()),
            conversationId,
            recipient.toString(),
            target.rank()
        );
    }

    @Override
    public Optional<DeliveryStatus> findReceiptStatus(UUID messageId, UserId recipient) {
        return jdbc.query(
            "SELECT status FROM message_receipts WHERE message_id = ? AND recipient_id = ?",
            (rs, rowNum) -> DeliveryStatus.values()[rs.getInt("status")],
            messageId,
            recipient.toString()
        ).stream().findFirst();
    }
}
