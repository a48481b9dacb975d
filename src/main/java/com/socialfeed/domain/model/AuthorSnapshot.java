package com.socialfeed.domain.model;

/**
 * Author display fields copied onto content at write time and refreshed by the profile-sync worker.
 */
public record AuthorSnapshot(String username, String avatarUrl) {

    public static final AuthorSnapshot EMPTY = new AuthorSnapshot(null, null);
}
