package com.socialfeed.adapter.out.persistence;

import com.socialfeed.application.port.out.LikeRepository;
import com.socialfeed.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

@Repository
public class JdbcLikeRepository implements LikeRepository {

    private final JdbcTemplate jdbc;

    public JdbcLikeRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean add(UserId userId, UUID contentId) {
        return jdbc.update("""
            INSERT INTO content_likes (user_id, content_id, created_at)
            VALUES (?, ?, ?)
            ON CONFLICT (user_id, content_id) DO NOTHING
            """,
            userId.toString(),
            contentId,
            Timestamp.from(Instant.now())
        ) > 0;
    }

    @Override
    public boolean remove(UserId userId, UUID contentId) {
        return jdbc.update(
            "DELETE FROM content_likes WHERE user_id = ? AND content_id = ?",
            userId.toString(),
            contentId
        ) > 0;
    }
}
