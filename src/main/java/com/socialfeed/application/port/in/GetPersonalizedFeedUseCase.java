package com.socialfeed.application.port.in;

import com.socialfeed.domain.model.FeedPage;
import com.socialfeed.domain.model.RankedContent;
import com.socialfeed.domain.model.UserId;

public interface GetPersonalizedFeedUseCase {

    /**
     * Personalized "for you" feed; viewers without any follow or tag signal get the ranked cold-start feed.
     */
    FeedPage<RankedContent> getPersonalizedFeed(UserId viewerId, int limit, int skip);
}
