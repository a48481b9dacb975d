package com.socialfeed.domain.ranking;

import com.socialfeed.domain.model.ContentItem;
import com.socialfeed.domain.model.FeedPage;
import com.socialfeed.domain.model.RankedContent;
import com.socialfeed.domain.model.UserId;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Scores and orders a content snapshot for the personalized, ranked (cold-start), trending and latest feeds.
 * <p>
 * Every operation is a pure function of its arguments: the same snapshot, viewer signals and {@code now}
 * always yield the same page. Ties are broken by creation time (newest first) and then by id.
 */
public class RankingEngine {

    private static final double MILLIS_PER_DAY = 86_400_000d;

    private static final Comparator<RankedContent> BY_SCORE = Comparator
        .comparingDouble(RankedContent::score).reversed()
        .thenComparing(r -> r.content().createdAt(), Comparator.reverseOrder())
        .thenComparing(r -> r.content().id());

    private static final Comparator<RankedContent> BY_PERSONALIZED_THEN_NEWEST = Comparator
        .comparing(RankedContent::personalized).reversed()
        .thenComparing(r -> r.content().createdAt(), Comparator.reverseOrder())
        .thenComparing(r -> r.content().id());

    /**
     * Content by followed authors or carrying a favorite tag comes first, newest first.
     * With {@code backfill} the remaining content follows; without it only personalized items are kept.
     * A viewer with no follows and no favorite tags gets an empty page and must be served the ranked feed.
     */
    public FeedPage<RankedContent> personalized(
            List<ContentItem> snapshot,
            Set<UserId> followingIds,
            Set<String> favoriteTags,
            boolean backfill,
            int limit,
            int skip) {
        if (followingIds.isEmpty() && favoriteTags.isEmpty()) {
            return FeedPage.empty(skip, limit);
        }

        List<RankedContent> candidates = snapshot.stream()
            .map(item -> {
                boolean personalized = followingIds.contains(item.authorId()) || item.hasAnyTag(favoriteTags);
                return new RankedContent(item, personalized ? 1.0 : 0.0, personalized);
            })
            .filter(r -> backfill || r.personalized())
            .sorted(BY_PERSONALIZED_THEN_NEWEST)
            .toList();

        return paginate(candidates, limit, skip);
    }

    /**
     * {@code rankScore = w_r * recency + w_p * ln(likes + 1) + w_t * tagOverlap} over content inside the window.
     */
    public FeedPage<RankedContent> ranked(
            List<ContentItem> snapshot,
            Set<String> favoriteTags,
            RankingWeights weights,
            Duration window,
            int limit,
            int skip,
            Instant now) {
        Instant since = now.minus(window);

        List<RankedContent> candidates = snapshot.stream()
            .filter(item -> !item.createdAt().isBefore(since))
            .map(item -> new RankedContent(
                item,
                weights.recency() * recencyScore(item.createdAt(), now)
                    + weights.popularity() * popularityScore(item.counters().likes())
                    + weights.tagMatch() * item.tagOverlap(favoriteTags),
                item.hasAnyTag(favoriteTags)))
            .sorted(BY_SCORE)
            .toList();

        return paginate(candidates, limit, skip);
    }

    /**
     * {@code trendScore = w_r * recency + w_p * ln(likes + 1) + w_c * ln(comments + 1)} over content inside the
     * window that has at least {@code minLikes} likes.
     */
    public FeedPage<RankedContent> trending(
            List<ContentItem> snapshot,
            TrendingOptions options,
            int limit,
            int skip,
            Instant now) {
        Instant since = now.minus(Duration.ofDays(options.timeWindowDays()));

        List<RankedContent> candidates = snapshot.stream()
            .filter(item -> !item.createdAt().isBefore(since))
            .filter(item -> item.counters().likes() >= options.minLikes())
            .map(item -> new RankedContent(
                item,
                options.recencyWeight() * recencyScore(item.createdAt(), now)
                    + options.popularityWeight() * popularityScore(item.counters().likes())
                    + options.commentsWeight() * popularityScore(item.counters().comments()),
                false))
            .sorted(BY_SCORE)
            .toList();

        return paginate(candidates, limit, skip);
    }

    /**
     * Newest content first, no scoring.
     */
    public FeedPage<RankedContent> latest(List<ContentItem> snapshot, int limit, int skip) {
        List<RankedContent> candidates = snapshot.stream()
            .map(item -> new RankedContent(item, 0.0, false))
            .sorted(BY_PERSONALIZED_THEN_NEWEST)
            .toList();

        return paginate(candidates, limit, skip);
    }

    /**
     * {@code 1 / (1 + ageInDays)}; content dated in the future counts as brand new.
     */
    public static double recencyScore(Instant createdAt, Instant now) {
        long ageMillis = Math.max(0, Duration.between(createdAt, now).toMillis());
        return 1.0 / (1.0 + ageMillis / MILLIS_PER_DAY);
    }

    /**
     * {@code ln(count + 1)}, so zero engagement scores 0.
     */
    public static double popularityScore(long count) {
        return Math.log(Math.max(0, count) + 1.0);
    }

    private static FeedPage<RankedContent> paginate(List<RankedContent> sorted, int limit, int skip) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (skip < 0) {
            throw new IllegalArgumentException("skip cannot be negative: " + skip);
        }
        int from = Math.min(skip, sorted.size());
        int to = Math.min(from + limit, sorted.size());
        return FeedPage.of(sorted.subList(from, to), sorted.size(), skip, limit);
    }
}
