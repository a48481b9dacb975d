package com.socialfeed.application.port.out;

import com.socialfeed.domain.model.AuthorSnapshot;
import com.socialfeed.domain.model.ContentItem;
import com.socialfeed.domain.model.UserId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ContentRepository {
    void save(ContentItem content);

    Optional<ContentItem> findById(UUID id);

    /**
     * Snapshot the ranking engine scores: content created at or after {@code since}, newest first,
     * capped at {@code maxCandidates}. A null {@code since} means no lower bound.
     */
    List<ContentItem> findCreatedSince(Instant since, int maxCandidates);

    /**
     * Atomically adds {@code delta} to the like counter, clamping at zero, and returns the stored value.
     * Empty when the content does not exist.
     */
    Optional<Long> incrementLikes(UUID id, int delta);

    Optional<Long> incrementComments(UUID id, int delta);

    /**
     * Rewrites the denormalized author fields on every item by {@code authorId}.
     * Null fields in {@code snapshot} are left as stored. Returns the number of rows touched.
     */
    int updateAuthorSnapshot(UserId authorId, AuthorSnapshot snapshot);

    long count();
}
