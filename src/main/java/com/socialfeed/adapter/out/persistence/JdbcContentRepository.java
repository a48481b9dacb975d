package com.socialfeed.adapter.out.persistence;

import com.socialfeed.application.port.out.ContentRepository;
import com.socialfeed.domain.model.AuthorSnapshot;
import com.socialfeed.domain.model.ContentCounters;
import com.socialfeed.domain.model.ContentItem;
import com.socialfeed.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcContentRepository implements ContentRepository {

    private static final String COLUMNS = """
        id, author_id, body, tags, likes, comments, views, author_username, author_avatar, created_at
        """;

    private static final RowMapper<ContentItem> ROW_MAPPER = (rs, rowNum) -> new ContentItem(
        UUID.fromString(rs.getString("id")),
        UserId.fromTrusted(rs.getString("author_id")),
        rs.getString("body"),
        toList(rs.getArray("tags")),
        new ContentCounters(rs.getLong("likes"), rs.getLong("comments"), rs.getLong("views")),
        new AuthorSnapshot(rs.getString("author_username"), rs.getString("author_avatar")),
        rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbc;

    public JdbcContentRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(ContentItem content) {
        jdbc.update(connection -> {
            var ps = connection.prepareStatement("""
                INSERT INTO content (id, author_id, body, tags, likes, comments, views,
                                     author_username, author_avatar, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """);
            ps.setObject(1, content.id());
            ps.setString(2, content.authorId().toString());
            ps.setString(3, content.body());
            ps.setArray(4, connection.createArrayOf("text", content.tags().toArray()));
            ps.setLong(5, content.counters().likes());
            ps.setLong(6, content.counters().comments());
            ps.setLong(7, content.counters().views());
            ps.setString(8, content.author().username());
            ps.setString(9, content.author().avatarUrl());
            ps.setTimestamp(10, Timestamp.from(content.createdAt()));
            return ps;
        });
    }

    @Override
    public Optional<ContentItem> findById(UUID id) {
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM content WHERE id = ?",
            ROW_MAPPER,
            id
        ).stream().findFirst();
    }

    @Override
    public List<ContentItem> findCreatedSince(Instant since, int maxCandidates) {
        if (since == null) {
            return jdbc.query(
                "SELECT " + COLUMNS + " FROM content ORDER BY created_at DESC, id DESC LIMIT ?",
                ROW_MAPPER,
                maxCandidates
            );
        }
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM content WHERE created_at >= ? ORDER BY created_at DESC, id DESC LIMIT ?",
            ROW_MAPPER,
            Timestamp.from(since),
            maxCandidates
        );
    }

    @Override
    public Optional<Long> incrementLikes(UUID id, int delta) {
        return jdbc.query(
            "UPDATE content SET likes = GREATEST(likes + ?, 0) WHERE id = ? RETURNING likes",
            (rs, rowNum) -> rs.getLong("likes"),
            delta,
            id
        ).stream().findFirst();
    }

    @Override
    public Optional<Long> incrementComments(UUID id, int delta) {
        return jdbc.query(
            "UPDATE content SET comments = GREATEST(comments + ?, 0) WHERE id = ? RETURNING comments",
            (rs, rowNum) -> rs.getLong("comments"),
            delta,
            id
        ).stream().findFirst();
    }

    @Override
    public int updateAuthorSnapshot(UserId authorId, AuthorSnapshot snapshot) {
        return jdbc.update("""
            UPDATE content
            SET author_username = COALESCE(?, author_username),
                author_avatar = COALESCE(?, author_avatar)
            WHERE author_id = ?
            """,
            snapshot.username(),
            snapshot.avatarUrl(),
            authorId.toString()
        );
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM content", Long.class);
        return count != null ? count : 0;
    }

    private static List<String> toList(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        return Arrays.asList((String[]) array.getArray());
    }
}
