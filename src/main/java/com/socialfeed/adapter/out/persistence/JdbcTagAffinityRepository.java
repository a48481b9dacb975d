package com.socialfeed.adapter.out.persistence;

import com.socialfeed.application.port.out.TagAffinityRepository;
import com.socialfeed.domain.model.TagAffinity;
import com.socialfeed.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public class JdbcTagAffinityRepository implements TagAffinityRepository {

    static final double MIN_INTEREST = 1.0;

    private static final RowMapper<TagAffinity> ROW_MAPPER = (rs, rowNum) -> new TagAffinity(
        UserId.fromTrusted(rs.getString("user_id")),
        rs.getString("tag"),
        rs.getDouble("weight")
    );

    private final JdbcTemplate jdbc;

    public JdbcTagAffinityRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void increment(UserId userId, Collection<String> tags, double delta) {
        if (tags.isEmpty()) {
            return;
        }
        Timestamp now = Timestamp.from(Instant.now());
        List<Object[]> batch = tags.stream()
            .map(tag -> new Object[] {userId.toString(), tag, delta, now, delta, now})
            .toList();

        jdbc.batchUpdate("""
            INSERT INTO tag_affinity (user_id, tag, weight, updated_at)
            VALUES (?, ?, GREATEST(?, 0), ?)
            ON CONFLICT (user_id, tag)
            DO UPDATE SET weight = GREATEST(tag_affinity.weight + ?, 0), updated_at = ?
            """, batch);
    }

    @Override
    public List<TagAffinity> findTopTags(UserId userId, int limit) {
        return jdbc.query("""
            SELECT user_id, tag, weight
            FROM tag_affinity
            WHERE user_id = ? AND weight > 0
            ORDER BY weight DESC, tag
            LIMIT ?
            """,
            ROW_MAPPER,
            userId.toString(),
            limit
        );
    }

    @Override
    public List<UserId> findUsersInterestedIn(Collection<String> tags) {
        if (tags.isEmpty()) {
            return List.of();
        }
        return jdbc.query(
            "SELECT DISTINCT user_id FROM tag_affinity WHERE tag = ANY(?) AND weight >= ?",
            ps -> {
                ps.setArray(1, ps.getConnection().createArrayOf("text", tags.toArray()));
                ps.setDouble(2, MIN_INTEREST);
            },
            (rs, rowNum) -> UserId.fromTrusted(rs.getString("user_id"))
        );
    }
}
