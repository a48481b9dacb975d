package com.socialfeed.application.service;

import com.socialfeed.application.event.EventBus;
import com.socialfeed.application.port.in.GetNewFeedUseCase;
import com.socialfeed.application.port.in.GetPersonalizedFeedUseCase;
import com.socialfeed.application.port.in.GetRankedFeedUseCase;
import com.socialfeed.application.port.in.GetTrendingFeedUseCase;
import com.socialfeed.application.port.out.ContentRepository;
import com.socialfeed.application.port.out.FeedCachePort;
import com.socialfeed.application.port.out.FollowRepository;
import com.socialfeed.application.port.out.IdGenerator;
import com.socialfeed.application.port.out.MetricsPort;
import com.socialfeed.application.port.out.TagAffinityRepository;
import com.socialfeed.domain.event.ColdStartFeedGenerated;
import com.socialfeed.domain.model.ContentItem;
import com.socialfeed.domain.model.FeedPage;
import com.socialfeed.domain.model.RankedContent;
import com.socialfeed.domain.model.TagAffinity;
import com.socialfeed.domain.model.UserId;
import com.socialfeed.domain.ranking.RankingEngine;
import com.socialfeed.domain.ranking.RankingWeights;
import com.socialfeed.domain.ranking.TrendingOptions;
import com.socialfeed.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntFunction;
import java.util.function.Supplier;

@Service
public class FeedService implements GetPersonalizedFeedUseCase, GetRankedFeedUseCase,
        GetTrendingFeedUseCase, GetNewFeedUseCase {

    private static final Logger log = LoggerFactory.getLogger(FeedService.class);

    private final ContentRepository contentRepository;
    private final FollowRepository followRepository;
    private final TagAffinityRepository tagAffinityRepository;
    private final FeedCachePort feedCache;
    private final EventBus eventBus;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final AppProperties appProperties;
    private final RankingEngine rankingEngine = new RankingEngine();

    public FeedService(
            ContentRepository contentRepository,
            FollowRepository followRepository,
            TagAffinityRepository tagAffinityRepository,
            FeedCachePort feedCache,
            EventBus eventBus,
            IdGenerator idGenerator,
            MetricsPort metrics,
            AppProperties appProperties) {
        this.contentRepository = contentRepository;
        this.followRepository = followRepository;
        this.tagAffinityRepository = tagAffinityRepository;
        this.feedCache = feedCache;
        this.eventBus = eventBus;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.appProperties = appProperties;
    }

    @Override
    public FeedPage<RankedContent> getPersonalizedFeed(UserId viewerId, int limit, int skip) {
        int pageSize = clampLimit(limit);
        int offset = Math.max(0, skip);

        return cached(offset, pageSize, page -> FeedCacheKeys.personalizedKey(viewerId, page, pageSize),
                FeedCacheKeys.userFeedTags(viewerId), appProperties.getCache().coreFeedTtl(), () -> {
            Set<UserId> following = new HashSet<>(followRepository.findFollowingIds(viewerId));
            Set<String> favoriteTags = favoriteTags(viewerId);
            List<ContentItem> snapshot = contentRepository.findCreatedSince(null, appProperties.getFeed().getMaxCandidates());

            if (following.isEmpty() && favoriteTags.isEmpty()) {
                log.debug("No personalization signal for {}, serving ranked feed", viewerId);
                FeedPage<RankedContent> ranked = rank(snapshot, favoriteTags, pageSize, offset);
                if (offset < pageSize) {
                    eventBus.publish(ColdStartFeedGenerated.from(idGenerator.generate(), viewerId, ranked.items().size()));
                }
                return ranked;
            }

            return metrics.recordFeedRanking("personalized", () ->
                rankingEngine.personalized(snapshot, following, favoriteTags,
                    appProperties.getFeed().isPersonalizedBackfill(), pageSize, offset));
        });
    }

    @Override
    public FeedPage<RankedContent> getRankedFeed(UserId viewerId, int limit, int skip) {
        int pageSize = clampLimit(limit);
        Instant since = Instant.now().minus(rankedWindow());
        List<ContentItem> snapshot = contentRepository.findCreatedSince(since, appProperties.getFeed().getMaxCandidates());
        return rank(snapshot, favoriteTags(viewerId), pageSize, Math.max(0, skip));
    }

    @Override
    public FeedPage<RankedContent> getTrendingFeed(int limit, int skip) {
        int pageSize = clampLimit(limit);
        int offset = Math.max(0, skip);

        return cached(offset, pageSize, page -> FeedCacheKeys.trendingKey(page, pageSize),
                List.of(FeedCacheKeys.TRENDING_TAG), appProperties.getCache().trendingTtl(), () -> {
            TrendingOptions options = trendingOptions();
            Instant now = Instant.now();
            List<ContentItem> snapshot = contentRepository.findCreatedSince(
                now.minus(Duration.ofDays(options.timeWindowDays())), appProperties.getFeed().getMaxCandidates());
            return metrics.recordFeedRanking("trending", () ->
                rankingEngine.trending(snapshot, options, pageSize, offset, now));
        });
    }

    @Override
    public FeedPage<RankedContent> getNewFeed(int limit, int skip) {
        int pageSize = clampLimit(limit);
        int offset = Math.max(0, skip);

        return cached(offset, pageSize, page -> FeedCacheKeys.newFeedKey(page, pageSize),
                List.of(FeedCacheKeys.NEW_FEED_TAG), appProperties.getCache().newFeedTtl(), () -> {
            List<ContentItem> snapshot = contentRepository.findCreatedSince(null, appProperties.getFeed().getMaxCandidates());
            return metrics.recordFeedRanking("new", () -> rankingEngine.latest(snapshot, pageSize, offset));
        });
    }

    private FeedPage<RankedContent> rank(List<ContentItem> snapshot, Set<String> favoriteTags, int limit, int skip) {
        Instant now = Instant.now();
        return metrics.recordFeedRanking("ranked", () ->
            rankingEngine.ranked(snapshot, favoriteTags, RankingWeights.COLD_START, rankedWindow(), limit, skip, now));
    }

    /**
     * Cache entries are keyed by page number, so only offsets on a page boundary are read from or written to
     * the cache. Any other offset is computed directly.
     */
    private FeedPage<RankedContent> cached(
            int offset,
            int pageSize,
            IntFunction<String> keyForPage,
            List<String> tags,
            Duration ttl,
            Supplier<FeedPage<RankedContent>> compute) {
        if (offset % pageSize != 0) {
            log.debug("Offset {} is not aligned to page size {}, bypassing feed cache", offset, pageSize);
            return compute.get();
        }
        String key = keyForPage.apply(offset / pageSize + 1);
        Optional<FeedPage<RankedContent>> hit = feedCache.get(key);
        if (hit.isPresent()) {
            log.debug("Feed cache hit: {}", key);
            return hit.get();
        }
        FeedPage<RankedContent> page = compute.get();
        feedCache.put(key, page, tags, ttl);
        return page;
    }

    private Set<String> favoriteTags(UserId viewerId) {
        Set<String> tags = new LinkedHashSet<>();
        for (TagAffinity affinity : tagAffinityRepository.findTopTags(viewerId, appProperties.getFeed().getFavoriteTagLimit())) {
            tags.add(affinity.tag());
        }
        return tags;
    }

    private TrendingOptions trendingOptions() {
        AppProperties.Trending trending = appProperties.getTrending();
        return new TrendingOptions(
            trending.getWindowDays(),
            trending.getMinLikes(),
            trending.getRecencyWeight(),
            trending.getPopularityWeight(),
            trending.getCommentsWeight());
    }

    private Duration rankedWindow() {
        return Duration.ofDays(appProperties.getFeed().getRankedWindowDays());
    }

    private int clampLimit(int limit) {
        if (limit <= 0) {
            return appProperties.getFeed().getDefaultPageSize();
        }
        return Math.min(limit, appProperties.getFeed().getMaxPageSize());
    }
}
