package com.socialfeed.adapter.out.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialfeed.application.port.out.MetricsPort;
import com.socialfeed.domain.model.NotificationAction;
import com.socialfeed.domain.model.NotificationRecord;
import com.socialfeed.domain.model.UserId;
import com.socialfeed.infrastructure.config.AppProperties;
import com.socialfeed.infrastructure.resilience.ErrorClassifier;
import com.socialfeed.infrastructure.resilience.ResiliencePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Capping and eviction of the per-user notification list, against an in-memory stand-in for the Redis list.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RedisNotificationCache list cap")
class RedisNotificationCacheCapTest {

    private static final int CAP = 3;

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ListOperations<String, String> listOps;

    @Mock
    private HashOperations<String, String, String> hashOps;

    @Mock
    private MetricsPort metrics;

    private final UserId receiver = UserId.random();
    private final LinkedList<String> list = new LinkedList<>();
    private final AtomicInteger trimFailures = new AtomicInteger();

    private String listKey;
    private RedisNotificationCache cache;

    @BeforeEach
    void setUp() {
        listKey = "notifications:user:" + receiver;
        AppProperties properties = new AppProperties();
        properties.getNotifications().setMaxPerUser(CAP);
        properties.getCache().setMaxAttempts(3);
        properties.getCache().setJitter(false);

        when(redisTemplate.opsForList()).thenReturn(listOps);
        when(redisTemplate.<String, String>opsForHash()).thenReturn(hashOps);
        backListInMemory();

        ResiliencePolicy resilience = new ResiliencePolicy(properties, new ErrorClassifier(), metrics, delay -> { });
        cache = new RedisNotificationCache(redisTemplate, new ObjectMapper().findAndRegisterModules(), resilience, properties);
    }

    private void backListInMemory() {
        lenient().when(listOps.remove(eq(listKey), eq(0L), any())).thenAnswer(invocation -> {
            Object value = invocation.getArgument(2);
            long removed = list.stream().filter(value::equals).count();
            list.removeIf(value::equals);
            return removed;
        });
        lenient().when(listOps.leftPush(eq(listKey), anyString())).thenAnswer(invocation -> {
            list.addFirst(invocation.getArgument(1));
            return (long) list.size();
        });
        lenient().when(listOps.range(eq(listKey), anyLong(), eq(-1L))).thenAnswer(invocation -> {
            Long start = invocation.getArgument(1);
            return start >= list.size() ? List.of() : new ArrayList<>(list.subList(start.intValue(), list.size()));
        });
        lenient().doAnswer(invocation -> {
            if (trimFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new RedisConnectionFailureException("connection reset");
            }
            Long end = invocation.getArgument(2);
            while (list.size() > end + 1) {
                list.removeLast();
            }
            return null;
        }).when(listOps).trim(eq(listKey), eq(0L), anyLong());
    }

    private NotificationRecord notification() {
        return new NotificationRecord(UUID.randomUUID(), receiver, NotificationAction.LIKE, UserId.random(),
            "bob", null, UUID.randomUUID().toString(), "content", null, false, Instant.now());
    }

    private List<String> push(int count) {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            NotificationRecord record = notification();
            cache.push(record);
            ids.add(record.id().toString());
        }
        return ids;
    }

    @Nested
    @DisplayName("push")
    class PushTests {

        @Test
        @DisplayName("Should keep the list newest first without evicting under the cap")
        void shouldNotEvictUnderCap() {
            // When
            List<String> ids = push(CAP);

            // Then
            assertEquals(List.of(ids.get(2), ids.get(1), ids.get(0)), list);
            verify(redisTemplate, never()).delete(anyCollection());
        }

        @Test
        @DisplayName("Should trim to the cap and delete the hashes of evicted notifications")
        void shouldEvictBeyondCap() {
            // Given
            List<String> ids = push(CAP);

            // When
            List<String> newer = push(2);

            // Then
            assertEquals(List.of(newer.get(1), newer.get(0), ids.get(2)), list);
            verify(redisTemplate).delete(List.of("notification:" + ids.get(0)));
            verify(redisTemplate).delete(List.of("notification:" + ids.get(1)));
        }

        @Test
        @DisplayName("Should not duplicate an id when the push is retried after a transient failure")
        void shouldNotDuplicateOnRetry() {
            // Given
            List<String> ids = push(CAP);
            trimFailures.set(1);

            // When
            List<String> retried = push(1);

            // Then
            assertEquals(List.of(retried.get(0), ids.get(2), ids.get(1)), list);
            verify(listOps, times(2)).leftPush(listKey, retried.get(0));
            verify(redisTemplate).delete(List.of("notification:" + ids.get(0)));
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("Should give up quietly when Redis stays unavailable")
        void shouldSwallowPersistentFailure() {
            // Given
            trimFailures.set(10);

            // When
            assertDoesNotThrow(() -> push(1));

            // Then
            assertEquals(1, list.size());
            verify(metrics).incrementCacheFallbacks("notifications.push");
        }
    }
}
