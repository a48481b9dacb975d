package com.socialfeed.adapter.in.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialfeed.application.port.out.ContentRepository;
import com.socialfeed.application.port.out.FeedCachePort;
import com.socialfeed.application.port.out.MetricsPort;
import com.socialfeed.application.service.FeedCacheKeys;
import com.socialfeed.domain.model.AuthorSnapshot;
import com.socialfeed.domain.model.UserId;
import com.socialfeed.infrastructure.context.RequestContext;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Propagates avatar and username changes onto the author snapshot stored with existing content.
 * <p>
 * Changes arriving on the profile channel are coalesced per user, so a burst of edits costs a single
 * bulk update at the next flush. A user whose update fails stays queued for the following flush. The map is
 * shared between the listener and scheduler threads and is only mutated through {@code compute} and
 * {@code remove(key, value)}.
 */
@Component
public class ProfileSyncWorker implements MessageListener {

    private static final Logger log = LoggerFactory.getLogger(ProfileSyncWorker.class);

    private final ContentRepository contentRepository;
    private final FeedCachePort feedCache;
    private final ObjectMapper objectMapper;
    private final MetricsPort metrics;
    private final Map<UserId, PendingProfileUpdate> pending = new ConcurrentHashMap<>();

    public ProfileSyncWorker(
            ContentRepository contentRepository,
            FeedCachePort feedCache,
            ObjectMapper objectMapper,
            MetricsPort metrics) {
        this.contentRepository = contentRepository;
        this.feedCache = feedCache;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            accept(objectMapper.readTree(message.getBody()));
        } catch (IOException e) {
            log.warn("Ignoring unreadable profile snapshot message: {}", e.getMessage());
        }
    }

    void accept(JsonNode message) {
        String type = message.path("type").asText("");
        var userId = UserId.parse(message.path("userPublicId").asText(null));
        if (userId.isFailure()) {
            log.warn("Ignoring profile snapshot message without a valid user: {}", userId.errorOrNull().message());
            return;
        }

        PendingProfileUpdate update;
        if ("avatar_changed".equals(type) && message.hasNonNull("avatarUrl")) {
            update = new PendingProfileUpdate(null, message.get("avatarUrl").asText(), Instant.now());
        } else if ("username_changed".equals(type) && message.hasNonNull("username")) {
            update = new PendingProfileUpdate(message.get("username").asText(), null, Instant.now());
        } else {
            log.debug("Ignoring profile snapshot message of type '{}'", type);
            return;
        }

        pending.compute(userId.getOrThrow(), (user, existing) -> existing == null ? update : existing.merge(update));
        log.debug("Queued {} for {}", type, userId.getOrThrow());
    }

    @Scheduled(fixedDelayString = "${app.profile-sync.flush-interval-ms:2000}")
    public void flush() {
        if (pending.isEmpty()) {
            return;
        }
        RequestContext.set(null, "profile-sync-" + UUID.randomUUID());
        try {
            metrics.recordProfileSyncFlush(this::drain);
        } finally {
            RequestContext.clear();
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Flushing {} pending profile updates before shutdown", pending.size());
        flush();
    }

    int pendingCount() {
        return pending.size();
    }

    private void drain() {
        int flushed = 0;
        long rows = 0;
        for (Map.Entry<UserId, PendingProfileUpdate> entry : List.copyOf(pending.entrySet())) {
            // a change merged in since the copy stays queued for the next flush
            if (!pending.remove(entry.getKey(), entry.getValue())) {
                continue;
            }
            PendingProfileUpdate update = entry.getValue();
            try {
                int updated = contentRepository.updateAuthorSnapshot(
                    entry.getKey(), new AuthorSnapshot(update.username(), update.avatarUrl()));
                rows += updated;
                flushed++;
                log.debug("Updated author snapshot on {} items for {}", updated, entry.getKey());
            } catch (RuntimeException e) {
                log.error("Failed to update author snapshot for {}, requeued: {}", entry.getKey(), e.getMessage(), e);
                // changes queued since the drain started win over the failed ones
                pending.compute(entry.getKey(), (user, newer) -> newer == null ? update : update.merge(newer));
            }
        }

        if (rows > 0) {
            feedCache.invalidateTags(List.of(FeedCacheKeys.TRENDING_TAG, FeedCacheKeys.NEW_FEED_TAG));
        }
        log.info("Profile sync flushed {} users, {} content rows", flushed, rows);
    }

    record PendingProfileUpdate(String username, String avatarUrl, Instant lastSeen) {

        PendingProfileUpdate merge(PendingProfileUpdate newer) {
            return new PendingProfileUpdate(
                newer.username != null ? newer.username : username,
                newer.avatarUrl != null ? newer.avatarUrl : avatarUrl,
                newer.lastSeen
            );
        }
    }
}
