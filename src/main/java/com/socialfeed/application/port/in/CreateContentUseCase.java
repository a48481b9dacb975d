package com.socialfeed.application.port.in;

import com.socialfeed.domain.error.ContentError;
import com.socialfeed.domain.model.ContentItem;
import com.socialfeed.domain.model.Result;
import com.socialfeed.domain.model.UserId;

import java.util.List;

public interface CreateContentUseCase {
    Result<ContentItem, ContentError> createContent(UserId authorId, String body, List<String> tags);
}
