package com.socialfeed.domain.model;

public record TagAffinity(UserId userId, String tag, double weight) {

    public TagAffinity {
        if (weight < 0) {
            throw new IllegalStateException("Tag affinity weight cannot be negative: " + weight);
        }
    }
}
