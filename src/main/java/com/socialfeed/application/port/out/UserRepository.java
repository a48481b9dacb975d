package com.socialfeed.application.port.out;

import com.socialfeed.domain.model.UserId;
import com.socialfeed.domain.model.UserProfile;

import java.util.Optional;

public interface UserRepository {
    void upsert(UserProfile user);
    Optional<UserProfile> findById(UserId id);
    boolean exists(UserId id);

    /**
     * Null arguments keep the stored value. Returns false if the user does not exist.
     */
    boolean updateProfile(UserId id, String username, String avatarUrl);
}
