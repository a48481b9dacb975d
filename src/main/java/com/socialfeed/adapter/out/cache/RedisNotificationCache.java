package com.socialfeed.adapter.out.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialfeed.application.port.out.NotificationCachePort;
import com.socialfeed.domain.model.NotificationRecord;
import com.socialfeed.domain.model.UserId;
import com.socialfeed.infrastructure.config.AppProperties;
import com.socialfeed.infrastructure.resilience.ResiliencePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Per-user notification list in Redis.
 * <ul>
 *   <li>{@code notifications:user:<id>}: list of notification ids, newest at the head, capped.</li>
 *   <li>{@code notification:<id>}: hash with {@code data} (JSON), {@code isRead} ("1"/"0") and {@code timestamp}.</li>
 * </ul>
 * Both expire after the notification TTL.
 */
@Repository
public class RedisNotificationCache implements NotificationCachePort {

    private static final Logger log = LoggerFactory.getLogger(RedisNotificationCache.class);

    private static final String LIST_KEY_PREFIX = "notifications:user:";
    private static final String HASH_KEY_PREFIX = "notification:";
    private static final String FIELD_DATA = "data";
    private static final String FIELD_IS_READ = "isRead";
    private static final String FIELD_TIMESTAMP = "timestamp";

    private final StringRedisTemplate redisTemplate;
    private final ListOperations<String, String> listOps;
    private final HashOperations<String, String, String> hashOps;
    private final ObjectMapper objectMapper;
    private final ResiliencePolicy resilience;
    private final AppProperties appProperties;

    public RedisNotificationCache(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            ResiliencePolicy resilience,
            AppProperties appProperties) {
        this.redisTemplate = redisTemplate;
        this.listOps = redisTemplate.opsForList();
        this.hashOps = redisTemplate.opsForHash();
        this.objectMapper = objectMapper;
        this.resilience = resilience;
        this.appProperties = appProperties;
    }

    @Override
    public void push(NotificationRecord notification) {
        String listKey = listKey(notification.receiverId());
        String id = notification.id().toString();
        int maxSize = maxSize();

        resilience.runQuietly("notifications.push", () -> {
            writeHash(notification);
            // A retried push must leave the id in the list exactly once
            listOps.remove(listKey, 0, id);
            listOps.leftPush(listKey, id);

            List<String> evicted = listOps.range(listKey, maxSize, -1);
            listOps.trim(listKey, 0, maxSize - 1);
            if (evicted != null && !evicted.isEmpty()) {
                redisTemplate.delete(evicted.stream().map(RedisNotificationCache::hashKey).toList());
            }
            redisTemplate.expire(listKey, ttl());
        });
        log.debug("Cached notification {} for {}", notification.id(), notification.receiverId());
    }

    @Override
    public List<NotificationRecord> getLatest(UserId userId, int limit) {
        return resilience.attempt("notifications.getLatest", () -> {
            List<String> ids = listOps.range(listKey(userId), 0, limit - 1);
            if (ids == null || ids.isEmpty()) {
                return List.<NotificationRecord>of();
            }
            List<NotificationRecord> records = new ArrayList<>(ids.size());
            for (String id : ids) {
                Map<String, String> fields = hashOps.entries(hashKey(id));
                NotificationRecord record = fromHash(id, fields);
                if (record != null) {
                    records.add(record);
                }
            }
            return records;
        }, List.of());
    }

    @Override
    public void backfill(UserId userId, List<NotificationRecord> newestFirst) {
        if (newestFirst.isEmpty()) {
            return;
        }
        String listKey = listKey(userId);
        List<NotificationRecord> capped = newestFirst.size() > maxSize()
            ? newestFirst.subList(0, maxSize())
            : newestFirst;

        resilience.runQuietly("notifications.backfill", () -> {
            redisTemplate.delete(listKey);
            for (NotificationRecord notification : capped) {
                writeHash(notification);
            }
            listOps.rightPushAll(listKey, capped.stream().map(n -> n.id().toString()).toList());
            redisTemplate.expire(listKey, ttl());
        });
        log.debug("Backfilled {} notifications for {}", capped.size(), userId);
    }

    @Override
    public void markRead(UserId userId, UUID notificationId) {
        resilience.runQuietly("notifications.markRead", () -> setReadFlag(notificationId.toString()));
    }

    @Override
    public void markAllRead(UserId userId) {
        resilience.runQuietly("notifications.markAllRead", () -> {
            List<String> ids = listOps.range(listKey(userId), 0, -1);
            if (ids == null) {
                return;
            }
            ids.forEach(this::setReadFlag);
        });
    }

    private void setReadFlag(String notificationId) {
        String key = hashKey(notificationId);
        if (Boolean.TRUE.equals(redisTemplate.hasKey(key))) {
            hashOps.put(key, FIELD_IS_READ, "1");
        }
    }

    private void writeHash(NotificationRecord notification) {
        String key = hashKey(notification.id().toString());
        hashOps.putAll(key, Map.of(
            FIELD_DATA, toJson(notification),
            FIELD_IS_READ, notification.read() ? "1" : "0",
            FIELD_TIMESTAMP, String.valueOf(notification.timestamp().toEpochMilli())
        ));
        redisTemplate.expire(key, ttl());
    }

    private NotificationRecord fromHash(String id, Map<String, String> fields) {
        String data = fields.get(FIELD_DATA);
        if (data == null) {
            log.debug("Notification hash {} expired or missing", id);
            return null;
        }
        try {
            NotificationRecord record = objectMapper.readValue(data, NotificationRecord.class);
            return "1".equals(fields.get(FIELD_IS_READ)) && !record.read() ? record.markRead() : record;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cached notification {}: {}", id, e.getOriginalMessage());
            return null;
        }
    }

    private String toJson(NotificationRecord notification) {
        try {
            return objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize notification " + notification.id(), e);
        }
    }

    private int maxSize() {
        return appProperties.getNotifications().getMaxPerUser();
    }

    private Duration ttl() {
        return appProperties.getCache().notificationTtl();
    }

    private static String listKey(UserId userId) {
        return LIST_KEY_PREFIX + userId;
    }

    private static String hashKey(String notificationId) {
        return HASH_KEY_PREFIX + notificationId;
    }
}
