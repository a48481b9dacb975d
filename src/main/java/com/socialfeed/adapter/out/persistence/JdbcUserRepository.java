package com.socialfeed.adapter.out.persistence;

import com.socialfeed.application.port.out.UserRepository;
import com.socialfeed.domain.model.UserId;
import com.socialfeed.domain.model.UserProfile;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Optional;

@Repository
public class JdbcUserRepository implements UserRepository {

    private static final RowMapper<UserProfile> ROW_MAPPER = (rs, rowNum) -> new UserProfile(
        UserId.fromTrusted(rs.getString("id")),
        rs.getString("username"),
        rs.getString("avatar_url"),
        rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbc;

    public JdbcUserRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void upsert(UserProfile user) {
        jdbc.update("""
            INSERT INTO users (id, username, avatar_url, created_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (id) DO NOTHING
            """,
            user.id().toString(),
            user.username(),
            user.avatarUrl(),
            Timestamp.from(user.createdAt())
        );
    }

    @Override
    public Optional<UserProfile> findById(UserId id) {
        return jdbc.query(
            "SELECT id, username, avatar_url, created_at FROM users WHERE id = ?",
            ROW_MAPPER,
            id.toString()
        ).stream().findFirst();
    }

    @Override
    public boolean exists(UserId id) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM users WHERE id = ?",
            Integer.class,
            id.toString()
        );
        return count != null && count > 0;
    }

    @Override
    public boolean updateProfile(UserId id, String username, String avatarUrl) {
        return jdbc.update("""
            UPDATE users
            SET username = COALESCE(?, username),
                avatar_url = COALESCE(?, avatar_url)
            WHERE id = ?
            """,
            username,
            avatarUrl,
            id.toString()
        ) > 0;
    }
}
