package com.socialfeed.adapter.in.worker;

import com.socialfeed.application.port.in.GetNewFeedUseCase;
import com.socialfeed.application.port.in.GetTrendingFeedUseCase;
import com.socialfeed.application.port.out.FeedCachePort;
import com.socialfeed.application.service.FeedCacheKeys;
import com.socialfeed.infrastructure.config.AppProperties;
import com.socialfeed.infrastructure.context.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Hourly rebuild of the trending and new discovery feeds: drops every cached page, then recomputes
 * the first pages so readers hit a warm cache.
 */
@Component
public class TrendingRecomputeWorker {

    private static final Logger log = LoggerFactory.getLogger(TrendingRecomputeWorker.class);

    private final FeedCachePort feedCache;
    private final GetTrendingFeedUseCase trendingFeed;
    private final GetNewFeedUseCase newFeed;
    private final AppProperties appProperties;

    public TrendingRecomputeWorker(
            FeedCachePort feedCache,
            GetTrendingFeedUseCase trendingFeed,
            GetNewFeedUseCase newFeed,
            AppProperties appProperties) {
        this.feedCache = feedCache;
        this.trendingFeed = trendingFeed;
        this.newFeed = newFeed;
        this.appProperties = appProperties;
    }

    @Scheduled(cron = "${app.trending.cron:0 0 * * * *}")
    public void recompute() {
        long started = System.currentTimeMillis();
        RequestContext.set(null, "trending-" + UUID.randomUUID());
        try {
            feedCache.invalidateTags(List.of(FeedCacheKeys.TRENDING_TAG, FeedCacheKeys.NEW_FEED_TAG));

            int pageSize = appProperties.getFeed().getDefaultPageSize();
            int pages = appProperties.getTrending().getPrewarmPages();
            for (int page = 0; page < pages; page++) {
                trendingFeed.getTrendingFeed(pageSize, page * pageSize);
                newFeed.getNewFeed(pageSize, page * pageSize);
            }
            log.info("Trending recompute finished in {}ms, {} pages prewarmed", System.currentTimeMillis() - started, pages);
        } catch (RuntimeException e) {
            log.error("Trending recompute failed, next attempt on schedule: {}", e.getMessage(), e);
        } finally {
            RequestContext.clear();
        }
    }
}
