package com.socialfeed.application.port.in;

import com.socialfeed.domain.error.ContentError;
import com.socialfeed.domain.model.Result;
import com.socialfeed.domain.model.UserId;

import java.util.UUID;

public interface CommentOnContentUseCase {
    Result<Long, ContentError> addComment(UserId userId, UUID contentId, String text);
}
