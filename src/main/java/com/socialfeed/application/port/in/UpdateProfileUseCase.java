package com.socialfeed.application.port.in;

import com.socialfeed.domain.error.ValidationError.ProfileValidationError;
import com.socialfeed.domain.model.Result;
import com.socialfeed.domain.model.UserId;
import com.socialfeed.domain.model.UserProfile;

public interface UpdateProfileUseCase {

    /**
     * A null argument leaves that field unchanged.
     */
    Result<UserProfile, ProfileValidationError> updateProfile(UserId userId, String username, String avatarUrl);
}
