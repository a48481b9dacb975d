package com.socialfeed.application.port.in;

import com.socialfeed.domain.error.ContentError;
import com.socialfeed.domain.model.Result;
import com.socialfeed.domain.model.UserId;

import java.util.UUID;

/**
 * Both operations return the like count stored after the change.
 */
public interface LikeContentUseCase {
    Result<Long, ContentError> likeContent(UserId userId, UUID contentId);

    Result<Long, ContentError> unlikeContent(UserId userId, UUID contentId);
}
