package com.socialfeed.application.service;

import com.socialfeed.application.event.EventBus;
import com.socialfeed.application.port.in.CommentOnContentUseCase;
import com.socialfeed.application.port.in.CreateContentUseCase;
import com.socialfeed.application.port.in.CreateNotificationUseCase;
import com.socialfeed.application.port.in.CreateNotificationUseCase.NewNotification;
import com.socialfeed.application.port.in.LikeContentUseCase;
import com.socialfeed.application.port.out.ContentRepository;
import com.socialfeed.application.port.out.IdGenerator;
import com.socialfeed.application.port.out.LikeRepository;
import com.socialfeed.application.port.out.MetricsPort;
import com.socialfeed.application.port.out.TagAffinityRepository;
import com.socialfeed.application.port.out.UserRepository;
import com.socialfeed.domain.error.ContentError;
import com.socialfeed.domain.event.ContentCreated;
import com.socialfeed.domain.event.ContentInteracted;
import com.socialfeed.domain.event.ContentLikeChanged;
import com.socialfeed.domain.model.AuthorSnapshot;
import com.socialfeed.domain.model.ContentItem;
import com.socialfeed.domain.model.NotificationAction;
import com.socialfeed.domain.model.Result;
import com.socialfeed.domain.model.UserId;
import com.socialfeed.domain.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class ContentService implements CreateContentUseCase, LikeContentUseCase, CommentOnContentUseCase {

    private static final Logger log = LoggerFactory.getLogger(ContentService.class);

    static final double LIKE_AFFINITY = 2.0;
    static final String CONTENT_TARGET = "post";

    private final ContentRepository contentRepository;
    private final LikeRepository likeRepository;
    private final TagAffinityRepository tagAffinityRepository;
    private final UserRepository userRepository;
    private final CreateNotificationUseCase notifications;
    private final EventBus eventBus;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;

    public ContentService(
            ContentRepository contentRepository,
            LikeRepository likeRepository,
            TagAffinityRepository tagAffinityRepository,
            UserRepository userRepository,
            CreateNotificationUseCase notifications,
            EventBus eventBus,
            IdGenerator idGenerator,
            MetricsPort metrics) {
        this.contentRepository = contentRepository;
        this.likeRepository = likeRepository;
        this.tagAffinityRepository = tagAffinityRepository;
        this.userRepository = userRepository;
        this.notifications = notifications;
        this.eventBus = eventBus;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
    }

    @Override
    @Transactional
    public Result<ContentItem, ContentError> createContent(UserId authorId, String body, List<String> tags) {
        log.debug("Processing create content request for author: {}", authorId);

        AuthorSnapshot author = userRepository.findById(authorId)
            .map(UserProfile::snapshot)
            .orElse(AuthorSnapshot.EMPTY);

        var contentResult = ContentItem.create(idGenerator.generate(), authorId, body, tags, author);
        if (contentResult.isFailure()) {
            log.warn("Content validation failed: {}", contentResult.errorOrNull().message());
            return Result.failure(new ContentError.ValidationFailed(contentResult.errorOrNull()));
        }

        ContentItem content = contentResult.getOrThrow();
        userRepository.upsert(UserProfile.create(authorId));
        contentRepository.save(content);
        eventBus.queueTransactional(ContentCreated.from(idGenerator.generate(), content));

        metrics.incrementContentCreated();
        log.info("Content created: id={}, author={}, tags={}", content.id(), authorId, content.tags());

        return Result.success(content);
    }

    @Override
    @Transactional
    public Result<Long, ContentError> likeContent(UserId userId, UUID contentId) {
        Optional<ContentItem> found = contentRepository.findById(contentId);
        if (found.isEmpty()) {
            return Result.failure(new ContentError.NotFound(contentId));
        }
        ContentItem content = found.get();

        if (!likeRepository.add(userId, contentId)) {
            log.debug("Duplicate like ignored: user={}, content={}", userId, contentId);
            return Result.failure(new ContentError.AlreadyLiked(userId, contentId));
        }

        long newLikes = contentRepository.incrementLikes(contentId, 1)
            .orElseThrow(() -> new IllegalStateException("Content vanished while liking: " + contentId));
        tagAffinityRepository.increment(userId, content.tags(), LIKE_AFFINITY);

        eventBus.queueTransactional(ContentLikeChanged.from(idGenerator.generate(), content, userId, newLikes, true));
        eventBus.queueTransactional(ContentInteracted.from(idGenerator.generate(), content, userId, "like"));

        if (!userId.equals(content.authorId())) {
            notifications.createNotification(new NewNotification(
                content.authorId(), NotificationAction.LIKE, userId, contentId.toString(), CONTENT_TARGET,
                content.body()));
        }

        metrics.incrementLikes();
        log.info("Content liked: user={}, content={}, likes={}", userId, contentId, newLikes);
        return Result.success(newLikes);
    }

    @Override
    @Transactional
    public Result<Long, ContentError> unlikeContent(UserId userId, UUID contentId) {
        Optional<ContentItem> found = contentRepository.findById(contentId);
        if (found.isEmpty()) {
            return Result.failure(new ContentError.NotFound(contentId));
        }
        ContentItem content = found.get();

        if (!likeRepository.remove(userId, contentId)) {
            return Result.failure(new ContentError.NotLiked(userId, contentId));
        }

        long newLikes = contentRepository.incrementLikes(contentId, -1)
            .orElseThrow(() -> new IllegalStateException("Content vanished while unliking: " + contentId));
        tagAffinityRepository.increment(userId, content.tags(), -LIKE_AFFINITY);

        eventBus.queueTransactional(ContentLikeChanged.from(idGenerator.generate(), content, userId, newLikes, false));
        eventBus.queueTransactional(ContentInteracted.from(idGenerator.generate(), content, userId, "unlike"));

        log.info("Content unliked: user={}, content={}, likes={}", userId, contentId, newLikes);
        return Result.success(newLikes);
    }

    @Override
    @Transactional
    public Result<Long, ContentError> addComment(UserId userId, UUID contentId, String text) {
        Optional<ContentItem> found = contentRepository.findById(contentId);
        if (found.isEmpty()) {
            return Result.failure(new ContentError.NotFound(contentId));
        }
        ContentItem content = found.get();

        long comments = contentRepository.incrementComments(contentId, 1)
            .orElseThrow(() -> new IllegalStateException("Content vanished while commenting: " + contentId));
        eventBus.queueTransactional(ContentInteracted.from(idGenerator.generate(), content, userId, "comment"));

        if (!userId.equals(content.authorId())) {
            notifications.createNotification(new NewNotification(
                content.authorId(), NotificationAction.COMMENT, userId, contentId.toString(), CONTENT_TARGET, text));
        }

        log.debug("Comment counted: user={}, content={}, comments={}", userId, contentId, comments);
        return Result.success(comments);
    }
}
