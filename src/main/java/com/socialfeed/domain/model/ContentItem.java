package com.socialfeed.domain.model;

import com.socialfeed.domain.error.ValidationError.ContentValidationError;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A post. Immutable after creation except for its counters and the denormalized author snapshot.
 * Tags keep their original case; matching against viewer preferences is exact-string.
 */
public record ContentItem(
    UUID id,
    UserId authorId,
    String body,
    List<String> tags,
    ContentCounters counters,
    AuthorSnapshot author,
    Instant createdAt
) {
    public static final int MAX_BODY_LENGTH = 2000;
    public static final int MAX_TAGS = 10;

    public ContentItem {
        tags = tags == null ? List.of() : List.copyOf(tags);
        counters = counters == null ? ContentCounters.ZERO : counters;
        author = author == null ? AuthorSnapshot.EMPTY : author;
    }

    public static Result<ContentItem, ContentValidationError> create(
            UUID id, UserId authorId, String body, List<String> tags, AuthorSnapshot author) {
        if (body == null || body.isBlank()) {
            return Result.failure(ContentValidationError.EmptyBody.INSTANCE);
        }
        String trimmed = body.trim();
        if (trimmed.length() > MAX_BODY_LENGTH) {
            return Result.failure(new ContentValidationError.BodyTooLong(trimmed.length(), MAX_BODY_LENGTH));
        }
        List<String> normalized = normalizeTags(tags);
        if (normalized.size() > MAX_TAGS) {
            return Result.failure(new ContentValidationError.TooManyTags(normalized.size(), MAX_TAGS));
        }
        return Result.success(new ContentItem(id, authorId, trimmed, normalized, ContentCounters.ZERO, author, Instant.now()));
    }

    public boolean hasAnyTag(Set<String> candidates) {
        return tagOverlap(candidates) > 0;
    }

    public int tagOverlap(Set<String> candidates) {
        if (candidates.isEmpty()) {
            return 0;
        }
        int overlap = 0;
        for (String tag : tags) {
            if (candidates.contains(tag)) {
                overlap++;
            }
        }
        return overlap;
    }

    private static List<String> normalizeTags(List<String> tags) {
        if (tags == null) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                unique.add(tag.trim());
            }
        }
        return List.copyOf(unique);
    }
}
