package com.socialfeed.application.service;

import com.socialfeed.application.event.EventBus;
import com.socialfeed.application.port.in.CreateNotificationUseCase;
import com.socialfeed.application.port.in.GetNotificationsUseCase;
import com.socialfeed.application.port.in.MarkNotificationsReadUseCase;
import com.socialfeed.application.port.out.IdGenerator;
import com.socialfeed.application.port.out.MetricsPort;
import com.socialfeed.application.port.out.NotificationCachePort;
import com.socialfeed.application.port.out.NotificationRepository;
import com.socialfeed.application.port.out.UserRepository;
import com.socialfeed.domain.error.NotificationError;
import com.socialfeed.domain.event.NotificationCreated;
import com.socialfeed.domain.event.NotificationsRead;
import com.socialfeed.domain.model.AuthorSnapshot;
import com.socialfeed.domain.model.NotificationRecord;
import com.socialfeed.domain.model.Result;
import com.socialfeed.domain.model.UserId;
import com.socialfeed.domain.model.UserProfile;
import com.socialfeed.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * PostgreSQL holds every notification; Redis holds a capped, newest-first copy per user that
 * serves the first page. Cache writes happen after commit through the event bus.
 */
@Service
public class NotificationService implements CreateNotificationUseCase, GetNotificationsUseCase,
        MarkNotificationsReadUseCase {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationRepository notificationRepository;
    private final NotificationCachePort notificationCache;
    private final NotificationBackfiller backfiller;
    private final UserRepository userRepository;
    private final EventBus eventBus;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final AppProperties appProperties;

    public NotificationService(
            NotificationRepository notificationRepository,
            NotificationCachePort notificationCache,
            NotificationBackfiller backfiller,
            UserRepository userRepository,
            EventBus eventBus,
            IdGenerator idGenerator,
            MetricsPort metrics,
            AppProperties appProperties) {
        this.notificationRepository = notificationRepository;
        this.notificationCache = notificationCache;
        this.backfiller = backfiller;
        this.userRepository = userRepository;
        this.eventBus = eventBus;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.appProperties = appProperties;
    }

    @Override
    @Transactional
    public NotificationRecord createNotification(NewNotification request) {
        AuthorSnapshot actor = userRepository.findById(request.actorId())
            .map(UserProfile::snapshot)
            .orElse(AuthorSnapshot.EMPTY);

        NotificationRecord notification = NotificationRecord.create(
            idGenerator.generate(),
            request.receiverId(),
            request.actionType(),
            request.actorId(),
            actor,
            request.targetId(),
            request.targetType(),
            request.preview()
        );
        notificationRepository.save(notification);
        eventBus.queueTransactional(NotificationCreated.from(idGenerator.generate(), notification));

        metrics.incrementNotificationsCreated();
        log.debug("Notification {} created: {} -> {} ({})", notification.id(), request.actorId(),
            request.receiverId(), request.actionType());
        return notification;
    }

    @Override
    public List<NotificationRecord> getNotifications(UserId userId, int limit, Instant before) {
        int pageSize = Math.max(1, Math.min(limit, appProperties.getNotifications().getMaxPerUser()));
        if (before != null) {
            return notificationRepository.findByReceiver(userId, before, pageSize);
        }

        List<NotificationRecord> cached = notificationCache.getLatest(userId, pageSize);
        if (cached.size() >= pageSize) {
            log.debug("Served {} notifications for {} from cache", cached.size(), userId);
            return cached;
        }

        List<NotificationRecord> stored = notificationRepository.findByReceiver(userId, null, pageSize);
        if (stored.size() > cached.size()) {
            log.debug("Notification cache short for {} ({} < {}), backfilling", userId, cached.size(), stored.size());
            backfiller.backfill(userId, notificationRepository.findByReceiver(
                userId, null, appProperties.getNotifications().getMaxPerUser()));
        }
        return stored;
    }

    @Override
    public long getUnreadCount(UserId userId) {
        return notificationRepository.countUnread(userId);
    }

    @Override
    @Transactional
    public Result<Void, NotificationError> markAsRead(UserId userId, UUID notificationId) {
        if (!notificationRepository.markAsRead(userId, notificationId)) {
            return Result.failure(new NotificationError.NotFound(userId, notificationId));
        }
        eventBus.queueTransactional(NotificationsRead.one(idGenerator.generate(), userId, notificationId));
        return Result.success(null);
    }

    @Override
    @Transactional
    public int markAllAsRead(UserId userId) {
        int updated = notificationRepository.markAllAsRead(userId);
        eventBus.queueTransactional(NotificationsRead.all(idGenerator.generate(), userId));
        log.debug("Marked {} notifications read for {}", updated, userId);
        return updated;
    }
}
