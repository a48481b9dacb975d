package com.socialfeed.domain.model;

/**
 * Engagement counters of a content item. Never negative; changed only through atomic storage increments.
 */
public record ContentCounters(long likes, long comments, long views) {

    public static final ContentCounters ZERO = new ContentCounters(0, 0, 0);

    public ContentCounters {
        if (likes < 0 || comments < 0 || views < 0) {
            throw new IllegalStateException("Counters cannot be negative: likes=" + likes
                + ", comments=" + comments + ", views=" + views);
        }
    }
}
