package com.socialfeed.domain.model;

import java.util.List;

/**
 * Offset-paginated feed slice. {@code page} is 1-based and derived from skip/limit.
 */
public record FeedPage<T>(
    List<T> items,
    long total,
    int page,
    int limit,
    int totalPages
) {
    public FeedPage {
        items = List.copyOf(items);
    }

    public static <T> FeedPage<T> of(List<T> items, long total, int skip, int limit) {
        int page = skip / limit + 1;
        int totalPages = (int) ((total + limit - 1) / limit);
        return new FeedPage<>(items, total, page, limit, totalPages);
    }

    public static <T> FeedPage<T> empty(int skip, int limit) {
        return of(List.of(), 0, skip, limit);
    }
}
