package com.socialfeed.adapter.out.persistence;

import com.socialfeed.application.port.out.ConversationRepository;
import com.socialfeed.domain.model.Conversation;
import com.socialfeed.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Conversations keyed by participant hash, with a per-participant unread counter in {@code conversation_unread}.
 */
@Repository
public class JdbcConversationRepository implements ConversationRepository {

    private static final RowMapper<Conversation> ROW_MAPPER = (rs, rowNum) -> new Conversation(
        rs.getString("id"),
        Arrays.stream((String[]) rs.getArray("participants").getArray()).map(UserId::fromTrusted).toList(),
        rs.getTimestamp("last_message_at").toInstant()
    );

    private final JdbcTemplate jdbc;

    public JdbcConversationRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<Conversation> findById(String conversationId) {
        return jdbc.query(
            "SELECT id, participants, last_message_at FROM conversations WHERE id = ?",
            ROW_MAPPER,
            conversationId
        ).stream().findFirst();
    }

    @Override
    public Conversation findOrCreate(Conversation conversation) {
        jdbc.update(connection -> {
            var ps = connection.prepareStatement("""
                INSERT INTO conversations (id, participants, last_message_at)
                VALUES (?, ?, ?)
                ON CONFLICT (id) DO NOTHING
                """);
            ps.setString(1, conversation.id());
            ps.setArray(2, connection.createArrayOf("text",
                conversation.participants().stream().map(UserId::toString).toArray()));
            ps.setTimestamp(3, Timestamp.from(conversation.lastMessageAt()));
            return ps;
        });
        return findById(conversation.id())
            .orElseThrow(() -> new IllegalStateException("Conversation missing after insert: " + conversation.id()));
    }

    @Override
    public void touch(String conversationId, Instant lastMessageAt) {
        jdbc.update(
            "UPDATE conversations SET last_message_at = GREATEST(last_message_at, ?) WHERE id = ?",
            Timestamp.from(lastMessageAt),
            conversationId
        );
    }

    @Override
    public void incrementUnread(String conversationId, Collection<UserId> participants) {
        if (participants.isEmpty()) {
            return;
        }
        List<Object[]> batch = participants.stream()
            .map(p -> new Object[] {conversationId, p.toString()})
            .toList();
        jdbc.batchUpdate("""
            INSERT INTO conversation_unread (conversation_id, user_id, unread)
            VALUES (?, ?, 1)
            ON CONFLICT (conversation_id, user_id)
            DO UPDATE SET unread = conversation_unread.unread + 1
            """, batch);
    }

    @Override
    public void resetUnread(String conversationId, UserId participant) {
        jdbc.update("""
            INSERT INTO conversation_unread (conversation_id, user_id, unread)
            VALUES (?, ?, 0)
            ON CONFLICT (conversation_id, user_id)
            DO UPDATE SET unread = 0
            """,
            conversationId,
            participant.toString()
        );
    }

    @Override
    public int getUnread(String conversationId, UserId participant) {
        return jdbc.query(
            "SELECT unread FROM conversation_unread WHERE conversation_id = ? AND user_id = ?",
            (rs, rowNum) -> rs.getInt("unread"),
            conversationId,
            participant.toString()
        ).stream().findFirst().orElse(0);
    }
}
