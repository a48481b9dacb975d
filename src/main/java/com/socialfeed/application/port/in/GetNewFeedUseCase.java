package com.socialfeed.application.port.in;

import com.socialfeed.domain.model.FeedPage;
import com.socialfeed.domain.model.RankedContent;

public interface GetNewFeedUseCase {
    FeedPage<RankedContent> getNewFeed(int limit, int skip);
}
