package com.socialfeed.adapter.out.cache;

import com.socialfeed.application.port.out.CachePort;
import com.socialfeed.infrastructure.resilience.ResiliencePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Key/value cache with tag-based group invalidation, every call guarded by {@link ResiliencePolicy}.
 * <p>
 * Each tag is a Redis set {@code tag:<tag>} holding the keys written with it. Reads degrade to a miss
 * and warm writes degrade to a no-op when Redis is unavailable.
 */
@Component
public class ResilientRedisCache implements CachePort {

    private static final Logger log = LoggerFactory.getLogger(ResilientRedisCache.class);
    static final String TAG_KEY_PREFIX = "tag:";

    private final StringRedisTemplate redisTemplate;
    private final ValueOperations<String, String> valueOps;
    private final ResiliencePolicy resilience;

    public ResilientRedisCache(StringRedisTemplate redisTemplate, ResiliencePolicy resilience) {
        this.redisTemplate = redisTemplate;
        this.valueOps = redisTemplate.opsForValue();
        this.resilience = resilience;
    }

    @Override
    public Optional<String> get(String key) {
        return resilience.attempt("cache.get", () -> Optional.ofNullable(valueOps.get(key)), Optional.empty());
    }

    @Override
    public void setWithTags(String key, String value, Collection<String> tags, Duration ttl) {
        resilience.runQuietly("cache.setWithTags", () -> {
            writeValue(key, value, ttl);
            for (String tag : tags) {
                String tagKey = tagKey(tag);
                redisTemplate.opsForSet().add(tagKey, key);
                if (ttl != null) {
                    redisTemplate.expire(tagKey, ttl);
                }
            }
        });
        log.debug("Cached {} with tags {}", key, tags);
    }

    /**
     * Deletes every key written under any of the tags, plus the tag sets themselves, in a single DEL.
     * Returns the number of keys removed, 0 when the cache was unreachable.
     */
    @Override
    public long invalidateByTags(Collection<String> tags) {
        if (tags.isEmpty()) {
            return 0;
        }
        long deleted = resilience.attempt("cache.invalidateByTags", () -> {
            Set<String> keys = new LinkedHashSet<>();
            for (String tag : tags) {
                String tagKey = tagKey(tag);
                Set<String> members = redisTemplate.opsForSet().members(tagKey);
                if (members != null) {
                    keys.addAll(members);
                }
                keys.add(tagKey);
            }
            Long removed = redisTemplate.delete(keys);
            return removed != null ? removed : 0L;
        }, 0L);
        log.debug("Invalidated {} keys for tags {}", deleted, tags);
        return deleted;
    }

    @Override
    public void delete(Collection<String> keys) {
        if (keys.isEmpty()) {
            return;
        }
        resilience.runQuietly("cache.delete", () -> redisTemplate.delete(keys));
    }

    private void writeValue(String key, String value, Duration ttl) {
        if (ttl == null) {
            valueOps.set(key, value);
        } else {
            valueOps.set(key, value, ttl);
        }
    }

    static String tagKey(String tag) {
        return TAG_KEY_PREFIX + tag;
    }
}
