package com.socialfeed.application.service;

import com.socialfeed.domain.model.UserId;

import java.util.List;

/**
 * Cache keys and invalidation tags of the rendered feeds.
 */
public final class FeedCacheKeys {

    public static final String TRENDING_TAG = "trending_feed";
    public static final String NEW_FEED_TAG = "new_feed";

    private FeedCacheKeys() {
    }

    public static String personalizedKey(UserId viewerId, int page, int limit) {
        return "core_feed:" + viewerId + ":" + page + ":" + limit;
    }

    public static String trendingKey(int page, int limit) {
        return TRENDING_TAG + ":" + page + ":" + limit;
    }

    public static String newFeedKey(int page, int limit) {
        return NEW_FEED_TAG + ":" + page + ":" + limit;
    }

    /**
     * Tags covering every cached personalized page of the user.
     */
    public static List<String> userFeedTags(UserId userId) {
        return List.of("user_feed:" + userId, "for_you_feed:" + userId);
    }
}
