package com.socialfeed.adapter.out.persistence;

import com.socialfeed.application.port.out.FollowRepository;
import com.socialfeed.domain.model.FollowEdge;
import com.socialfeed.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

@Repository
public class JdbcFollowRepository implements FollowRepository {

    private static final RowMapper<UserId> USER_ID_MAPPER = (rs, rowNum) -> UserId.fromTrusted(rs.getString(1));

    private final JdbcTemplate jdbc;

    public JdbcFollowRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean save(FollowEdge follow) {
        return jdbc.update("""
            INSERT INTO follows (follower_id, followee_id, created_at)
            VALUES (?, ?, ?)
            ON CONFLICT (follower_id, followee_id) DO NOTHING
            """,
            follow.followerId().toString(),
            follow.followeeId().toString(),
            Timestamp.from(follow.createdAt())
        ) > 0;
    }

    @Override
    public boolean delete(UserId followerId, UserId followeeId) {
        return jdbc.update(
            "DELETE FROM follows WHERE follower_id = ? AND followee_id = ?",
            followerId.toString(),
            followeeId.toString()
        ) > 0;
    }

    @Override
    public boolean exists(UserId followerId, UserId followeeId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM follows WHERE follower_id = ? AND followee_id = ?",
            Integer.class,
            followerId.toString(),
            followeeId.toString()
        );
        return count != null && count > 0;
    }

    @Override
    public List<UserId> findFollowingIds(UserId userId) {
        return jdbc.query(
            "SELECT followee_id FROM follows WHERE follower_id = ?",
            USER_ID_MAPPER,
            userId.toString()
        );
    }

    @Override
    public List<UserId> findAllFollowerIds(UserId userId) {
        return jdbc.query(
            "SELECT follower_id FROM follows WHERE followee_id = ?",
            USER_ID_MAPPER,
            userId.toString()
        );
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM follows", Long.class);
        return count != null ? count : 0;
    }
}
