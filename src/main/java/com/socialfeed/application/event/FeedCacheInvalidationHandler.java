package com.socialfeed.application.event;

import com.socialfeed.application.port.out.FeedCachePort;
import com.socialfeed.application.service.FeedCacheKeys;
import com.socialfeed.domain.event.ContentCreated;
import com.socialfeed.domain.event.ContentInteracted;
import com.socialfeed.domain.event.ContentLikeChanged;
import com.socialfeed.domain.event.DomainEvent;
import com.socialfeed.domain.event.UserFollowed;
import com.socialfeed.domain.event.UserUnfollowed;
import com.socialfeed.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Drops the cached feed pages a committed write made stale.
 */
@Component
@Order(10)
public class FeedCacheInvalidationHandler implements DomainEventHandler<DomainEvent> {

    private static final Logger log = LoggerFactory.getLogger(FeedCacheInvalidationHandler.class);

    private final FeedCachePort feedCache;
    private final AudienceResolver audienceResolver;

    public FeedCacheInvalidationHandler(FeedCachePort feedCache, AudienceResolver audienceResolver) {
        this.feedCache = feedCache;
        this.audienceResolver = audienceResolver;
    }

    @Override
    public Class<DomainEvent> eventType() {
        return DomainEvent.class;
    }

    @Override
    public void handle(DomainEvent event) {
        List<String> tags = new ArrayList<>();

        if (event instanceof ContentCreated created) {
            Set<UserId> audience = audienceResolver.audienceOf(created);
            tags.addAll(FeedCacheKeys.userFeedTags(created.authorId()));
            audience.forEach(user -> tags.addAll(FeedCacheKeys.userFeedTags(user)));
            tags.add(FeedCacheKeys.NEW_FEED_TAG);
        } else if (event instanceof UserFollowed followed) {
            tags.addAll(FeedCacheKeys.userFeedTags(followed.followerId()));
        } else if (event instanceof UserUnfollowed unfollowed) {
            tags.addAll(FeedCacheKeys.userFeedTags(unfollowed.followerId()));
        } else if (event instanceof ContentLikeChanged liked) {
            tags.addAll(FeedCacheKeys.userFeedTags(liked.actorId()));
            tags.add(FeedCacheKeys.TRENDING_TAG);
        } else if (event instanceof ContentInteracted interacted && "comment".equals(interacted.actionType())) {
            tags.add(FeedCacheKeys.TRENDING_TAG);
        }

        if (tags.isEmpty()) {
            return;
        }
        feedCache.invalidateTags(tags);
        log.debug("Invalidated {} feed tags after {}", tags.size(), event.eventType());
    }
}
