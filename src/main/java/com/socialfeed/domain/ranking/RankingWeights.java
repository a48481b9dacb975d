package com.socialfeed.domain.ranking;

public record RankingWeights(double recency, double popularity, double tagMatch) {

    public static final RankingWeights COLD_START = new RankingWeights(0.5, 0.3, 0.2);
}
