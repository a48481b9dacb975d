package com.socialfeed.domain.model;

import java.time.Instant;

public record UserProfile(
    UserId id,
    String username,
    String avatarUrl,
    Instant createdAt
) {
    public static UserProfile create(UserId id) {
        return new UserProfile(id, null, null, Instant.now());
    }

    public AuthorSnapshot snapshot() {
        return new AuthorSnapshot(username, avatarUrl);
    }
}
