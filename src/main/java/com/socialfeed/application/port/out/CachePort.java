package com.socialfeed.application.port.out;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * String key/value cache with tag-based group invalidation.
 * <p>
 * Reads return empty and warm writes are skipped when the cache tier is unavailable;
 * callers always fall back to durable storage.
 */
public interface CachePort {

    Optional<String> get(String key);

    /**
     * @param ttl null keeps the entry until evicted
     */
    void setWithTags(String key, String value, Collection<String> tags, Duration ttl);

    void delete(Collection<String> keys);

    /**
     * Deletes every entry written under any of the tags. Returns the number of keys removed.
     */
    long invalidateByTags(Collection<String> tags);
}
