package com.socialfeed.application.port.out;

import com.socialfeed.domain.model.FeedPage;
import com.socialfeed.domain.model.RankedContent;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * Typed view over the tagged cache for rendered feed pages.
 */
public interface FeedCachePort {

    Optional<FeedPage<RankedContent>> get(String key);

    void put(String key, FeedPage<RankedContent> page, Collection<String> tags, Duration ttl);

    void invalidateTags(Collection<String> tags);
}
