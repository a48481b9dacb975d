package com.socialfeed.adapter.out.persistence;

import com.socialfeed.application.port.out.NotificationRepository;
import com.socialfeed.domain.model.NotificationAction;
import com.socialfeed.domain.model.NotificationRecord;
import com.socialfeed.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public class JdbcNotificationRepository implements NotificationRepository {

    private static final String COLUMNS = """
        id, receiver_id, action_type, actor_id, actor_username, actor_avatar,
        target_id, target_type, preview, is_read, created_at
        """;

    private static final RowMapper<NotificationRecord> ROW_MAPPER = (rs, rowNum) -> new NotificationRecord(
        UUID.fromString(rs.getString("id")),
        UserId.fromTrusted(rs.getString("receiver_id")),
        NotificationAction.valueOf(rs.getString("action_type")),
        UserId.fromTrusted(rs.getString("actor_id")),
        rs.getString("actor_username"),
        rs.getString("actor_avatar"),
        rs.getString("target_id"),
        rs.getString("target_type"),
        rs.getString("preview"),
        rs.getBoolean("is_read"),
        rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbc;

    public JdbcNotificationRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(NotificationRecord notification) {
        jdbc.update("""
            INSERT INTO notifications (id, receiver_id, action_type, actor_id, actor_username, actor_avatar,
                                       target_id, target_type, preview, is_read, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            notification.id(),
            notification.receiverId().toString(),
            notification.actionType().name(),
            notification.actorId().toString(),
            notification.actorUsername(),
            notification.actorAvatar(),
            notification.targetId(),
            notification.targetType(),
            notification.preview(),
            notification.read(),
            Timestamp.from(notification.timestamp())
        );
    }

    @Override
    public List<NotificationRecord> findByReceiver(UserId receiverId, Instant before, int limit) {
        if (before == null) {
            return jdbc.query(
                "SELECT " + COLUMNS + " FROM notifications WHERE receiver_id = ? ORDER BY created_at DESC, id DESC LIMIT ?",
                ROW_MAPPER,
                receiverId.toString(),
                limit
            );
        }
        return jdbc.query("""
            SELECT %s
            FROM notifications
            WHERE receiver_id = ? AND created_at < ?
            ORDER BY created_at DESC, id DESC
            LIMIT ?
            """.formatted(COLUMNS),
            ROW_MAPPER,
            receiverId.toString(),
            Timestamp.from(before),
            limit
        );
    }

    @Override
    public boolean markAsRead(UserId receiverId, UUID notificationId) {
        return jdbc.update(
            "UPDATE notifications SET is_read = TRUE WHERE id = ? AND receiver_id = ?",
            notificationId,
            receiverId.toString()
        ) > 0;
    }

    @Override
    public int markAllAsRead(UserId receiverId) {
        return jdbc.update(
            "UPDATE notifications SET is_read = TRUE WHERE receiver_id = ? AND is_read = FALSE",
            receiverId.toString()
        );
    }

    @Override
    public long countUnread(UserId receiverId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM notifications WHERE receiver_id = ? AND is_read = FALSE",
            Long.class,
            receiverId.toString()
        );
        return count != null ? count : 0;
    }
}
