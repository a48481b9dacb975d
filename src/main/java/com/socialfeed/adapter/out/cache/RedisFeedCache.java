package com.socialfeed.adapter.out.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialfeed.application.port.out.CachePort;
import com.socialfeed.application.port.out.FeedCachePort;
import com.socialfeed.domain.model.FeedPage;
import com.socialfeed.domain.model.RankedContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class RedisFeedCache implements FeedCachePort {

    private static final Logger log = LoggerFactory.getLogger(RedisFeedCache.class);

    private final CachePort cache;
    private final ObjectMapper objectMapper;
    private final JavaType pageType;

    public RedisFeedCache(CachePort cache, ObjectMapper objectMapper) {
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.pageType = objectMapper.getTypeFactory()
            .constructParametricType(FeedPage.class, RankedContent.class);
    }

    @Override
    public Optional<FeedPage<RankedContent>> get(String key) {
        Optional<String> cached = cache.get(key);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(cached.get(), pageType));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable feed cache entry {}: {}", key, e.getOriginalMessage());
            cache.delete(List.of(key));
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, FeedPage<RankedContent> page, Collection<String> tags, Duration ttl) {
        try {
            cache.setWithTags(key, objectMapper.writeValueAsString(page), tags, ttl);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize feed page for {}: {}", key, e.getOriginalMessage());
        }
    }

    @Override
    public void invalidateTags(Collection<String> tags) {
        cache.invalidateByTags(tags);
    }
}
