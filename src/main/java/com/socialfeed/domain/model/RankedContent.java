package com.socialfeed.domain.model;

/**
 * A content item together with the score and personalization flag the ranking engine assigned to it.
 */
public record RankedContent(
    ContentItem content,
    double score,
    boolean personalized
) {}
