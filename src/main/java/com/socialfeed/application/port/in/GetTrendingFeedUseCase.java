package com.socialfeed.application.port.in;

import com.socialfeed.domain.model.FeedPage;
import com.socialfeed.domain.model.RankedContent;

public interface GetTrendingFeedUseCase {
    FeedPage<RankedContent> getTrendingFeed(int limit, int skip);
}
