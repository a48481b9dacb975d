package com.socialfeed.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Cache cache = new Cache();
    private Feed feed = new Feed();
    private Trending trending = new Trending();
    private Notifications notifications = new Notifications();
    private ProfileSync profileSync = new ProfileSync();
    private Realtime realtime = new Realtime();

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Feed getFeed() {
        return feed;
    }

    public void setFeed(Feed feed) {
        this.feed = feed;
    }

    public Trending getTrending() {
        return trending;
    }

    public void setTrending(Trending trending) {
        this.trending = trending;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public void setNotifications(Notifications notifications) {
        this.notifications = notifications;
    }

    public ProfileSync getProfileSync() {
        return profileSync;
    }

    public void setProfileSync(ProfileSync profileSync) {
        this.profileSync = profileSync;
    }

    public Realtime getRealtime() {
        return realtime;
    }

    public void setRealtime(Realtime realtime) {
        this.realtime = realtime;
    }

    public static class Cache {
        private int maxAttempts = 3;
        private long baseDelayMs = 100;
        private long maxDelayMs = 2000;
        private boolean jitter = true;
        private long trendingTtlSeconds = 120;
        private long newFeedTtlSeconds = 3600;
        private long coreFeedTtlSeconds = 300;
        private long notificationTtlSeconds = 2_592_000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }

        public long getTrendingTtlSeconds() {
            return trendingTtlSeconds;
        }

        public void setTrendingTtlSeconds(long trendingTtlSeconds) {
            this.trendingTtlSeconds = trendingTtlSeconds;
        }

        public long getNewFeedTtlSeconds() {
            return newFeedTtlSeconds;
        }

        public void setNewFeedTtlSeconds(long newFeedTtlSeconds) {
            this.newFeedTtlSeconds = newFeedTtlSeconds;
        }

        public long getCoreFeedTtlSeconds() {
            return coreFeedTtlSeconds;
        }

        public void setCoreFeedTtlSeconds(long coreFeedTtlSeconds) {
            this.coreFeedTtlSeconds = coreFeedTtlSeconds;
        }

        public long getNotificationTtlSeconds() {
            return notificationTtlSeconds;
        }

        public void setNotificationTtlSeconds(long notificationTtlSeconds) {
            this.notificationTtlSeconds = notificationTtlSeconds;
        }

        public Duration trendingTtl() {
            return Duration.ofSeconds(trendingTtlSeconds);
        }

        public Duration newFeedTtl() {
            return Duration.ofSeconds(newFeedTtlSeconds);
        }

        public Duration coreFeedTtl() {
            return Duration.ofSeconds(coreFeedTtlSeconds);
        }

        public Duration notificationTtl() {
            return Duration.ofSeconds(notificationTtlSeconds);
        }
    }

    public static class Feed {
        private int defaultPageSize = 20;
        private int maxPageSize = 100;
        private int rankedWindowDays = 90;
        private int maxCandidates = 5000;
        private int favoriteTagLimit = 10;
        private boolean personalizedBackfill = true;

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }

        public int getRankedWindowDays() {
            return rankedWindowDays;
        }

        public void setRankedWindowDays(int rankedWindowDays) {
            this.rankedWindowDays = rankedWindowDays;
        }

        public int getMaxCandidates() {
            return maxCandidates;
        }

        public void setMaxCandidates(int maxCandidates) {
            this.maxCandidates = maxCandidates;
        }

        public int getFavoriteTagLimit() {
            return favoriteTagLimit;
        }

        public void setFavoriteTagLimit(int favoriteTagLimit) {
            this.favoriteTagLimit = favoriteTagLimit;
        }

        public boolean isPersonalizedBackfill() {
            return personalizedBackfill;
        }

        public void setPersonalizedBackfill(boolean personalizedBackfill) {
            this.personalizedBackfill = personalizedBackfill;
        }
    }

    public static class Trending {
        private int windowDays = 14;
        private long minLikes = 1;
        private double recencyWeight = 0.4;
        private double popularityWeight = 0.5;
        private double commentsWeight = 0.1;
        private int prewarmPages = 3;
        private String cron = "0 0 * * * *";

        public int getWindowDays() {
            return windowDays;
        }

        public void setWindowDays(int windowDays) {
            this.windowDays = windowDays;
        }

        public long getMinLikes() {
            return minLikes;
        }

        public void setMinLikes(long minLikes) {
            this.minLikes = minLikes;
        }

        public double getRecencyWeight() {
            return recencyWeight;
        }

        public void setRecencyWeight(double recencyWeight) {
            this.recencyWeight = recencyWeight;
        }

        public double getPopularityWeight() {
            return popularityWeight;
        }

        public void setPopularityWeight(double popularityWeight) {
            this.popularityWeight = popularityWeight;
        }

        public double getCommentsWeight() {
            return commentsWeight;
        }

        public void setCommentsWeight(double commentsWeight) {
            this.commentsWeight = commentsWeight;
        }

        public int getPrewarmPages() {
            return prewarmPages;
        }

        public void setPrewarmPages(int prewarmPages) {
            this.prewarmPages = prewarmPages;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }
    }

    public static class Notifications {
        private int maxPerUser = 200;

        public int getMaxPerUser() {
            return maxPerUser;
        }

        public void setMaxPerUser(int maxPerUser) {
            this.maxPerUser = maxPerUser;
        }
    }

    public static class ProfileSync {
        private long flushIntervalMs = 2000;

        public long getFlushIntervalMs() {
            return flushIntervalMs;
        }

        public void setFlushIntervalMs(long flushIntervalMs) {
            this.flushIntervalMs = flushIntervalMs;
        }
    }

    public static class Realtime {
        private String feedChannel = "feed_updates";
        private String messagingChannel = "messaging_updates";
        private String notificationChannel = "notification_updates";
        private String profileChannel = "profile_snapshot_updates";
        private String endpoint = "/ws";
        private String[] allowedOrigins = {"*"};

        public String getFeedChannel() {
            return feedChannel;
        }

        public void setFeedChannel(String feedChannel) {
            this.feedChannel = feedChannel;
        }

        public String getMessagingChannel() {
            return messagingChannel;
        }

        public void setMessagingChannel(String messagingChannel) {
            this.messagingChannel = messagingChannel;
        }

        public String getNotificationChannel() {
            return notificationChannel;
        }

        public void setNotificationChannel(String notificationChannel) {
            this.notificationChannel = notificationChannel;
        }

        public String getProfileChannel() {
            return profileChannel;
        }

        public void setProfileChannel(String profileChannel) {
            this.profileChannel = profileChannel;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String[] getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(String[] allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }
    }
}
