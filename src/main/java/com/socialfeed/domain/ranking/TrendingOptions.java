package com.socialfeed.domain.ranking;

public record TrendingOptions(
    int timeWindowDays,
    long minLikes,
    double recencyWeight,
    double popularityWeight,
    double commentsWeight
) {
    public static final TrendingOptions DEFAULTS = new TrendingOptions(14, 0, 0.4, 0.5, 0.1);

    public TrendingOptions withMinLikes(long minLikes) {
        return new TrendingOptions(timeWindowDays, minLikes, recencyWeight, popularityWeight, commentsWeight);
    }
}
