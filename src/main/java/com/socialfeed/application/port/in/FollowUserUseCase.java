package com.socialfeed.application.port.in;

import com.socialfeed.domain.error.FollowError;
import com.socialfeed.domain.model.Result;
import com.socialfeed.domain.model.UserId;

public interface FollowUserUseCase {
    Result<Void, FollowError> followUser(UserId followerId, UserId followeeId);
}
