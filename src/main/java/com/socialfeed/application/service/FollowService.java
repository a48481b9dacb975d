package com.socialfeed.application.service;

import com.socialfeed.application.event.EventBus;
import com.socialfeed.application.port.in.CreateNotificationUseCase;
import com.socialfeed.application.port.in.CreateNotificationUseCase.NewNotification;
import com.socialfeed.application.port.in.FollowUserUseCase;
import com.socialfeed.application.port.in.UnfollowUserUseCase;
import com.socialfeed.application.port.out.FollowRepository;
import com.socialfeed.application.port.out.IdGenerator;
import com.socialfeed.application.port.out.MetricsPort;
import com.socialfeed.application.port.out.UserRepository;
import com.socialfeed.domain.error.FollowError;
import com.socialfeed.domain.event.UserFollowed;
import com.socialfeed.domain.event.UserUnfollowed;
import com.socialfeed.domain.model.FollowEdge;
import com.socialfeed.domain.model.NotificationAction;
import com.socialfeed.domain.model.Result;
import com.socialfeed.domain.model.UserId;
import com.socialfeed.domain.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class FollowService implements FollowUserUseCase, UnfollowUserUseCase {

    private static final Logger log = LoggerFactory.getLogger(FollowService.class);

    private final FollowRepository followRepository;
    private final UserRepository userRepository;
    private final CreateNotificationUseCase notifications;
    private final EventBus eventBus;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;

    public FollowService(
            FollowRepository followRepository,
            UserRepository userRepository,
            CreateNotificationUseCase notifications,
            EventBus eventBus,
            IdGenerator idGenerator,
            MetricsPort metrics) {
        this.followRepository = followRepository;
        this.userRepository = userRepository;
        this.notifications = notifications;
        this.eventBus = eventBus;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
    }

    @Override
    @Transactional
    public Result<Void, FollowError> followUser(UserId followerId, UserId followeeId) {
        log.debug("Processing follow request: follower={}, followee={}", followerId, followeeId);

        var followResult = FollowEdge.create(followerId, followeeId);
        if (followResult.isFailure()) {
            log.warn("Follow validation failed: {}", followResult.errorOrNull().message());
            return Result.failure(new FollowError.ValidationFailed(followResult.errorOrNull()));
        }

        if (followRepository.exists(followerId, followeeId)) {
            log.debug("Already following: follower={}, followee={}", followerId, followeeId);
            return Result.failure(new FollowError.AlreadyFollowing(followerId, followeeId));
        }

        // Either side may not have a profile row yet
        userRepository.upsert(UserProfile.create(followerId));
        userRepository.upsert(UserProfile.create(followeeId));
        if (!followRepository.save(followResult.getOrThrow())) {
            // A concurrent request inserted the same edge after our existence check
            log.debug("Follow already recorded concurrently: follower={}, followee={}", followerId, followeeId);
            return Result.failure(new FollowError.AlreadyFollowing(followerId, followeeId));
        }

        eventBus.queueTransactional(UserFollowed.from(idGenerator.generate(), followerId, followeeId));
        notifications.createNotification(new NewNotification(
            followeeId, NotificationAction.FOLLOW, followerId, followerId.toString(), "user", null));

        metrics.incrementFollows();
        log.info("Follow completed: {} -> {}", followerId, followeeId);

        return Result.success(null);
    }

    @Override
    @Transactional
    public Result<Void, FollowError> unfollow(UserId followerId, UserId followeeId) {
        log.debug("Processing unfollow request: follower={}, followee={}", followerId, followeeId);

        if (!followRepository.exists(followerId, followeeId)) {
            log.debug("Not following: follower={}, followee={}", followerId, followeeId);
            return Result.failure(new FollowError.NotFollowing(followerId, followeeId));
        }

        if (!followRepository.delete(followerId, followeeId)) {
            log.debug("Follow already removed concurrently: follower={}, followee={}", followerId, followeeId);
            return Result.failure(new FollowError.NotFollowing(followerId, followeeId));
        }
        eventBus.queueTransactional(UserUnfollowed.from(idGenerator.generate(), followerId, followeeId));

        metrics.incrementUnfollows();
        log.info("Unfollow completed: {} -> {}", followerId, followeeId);

        return Result.success(null);
    }
}
