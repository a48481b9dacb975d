package com.socialfeed.application.port.in;

import com.socialfeed.domain.model.FeedPage;
import com.socialfeed.domain.model.RankedContent;
import com.socialfeed.domain.model.UserId;

public interface GetRankedFeedUseCase {
    FeedPage<RankedContent> getRankedFeed(UserId viewerId, int limit, int skip);
}
