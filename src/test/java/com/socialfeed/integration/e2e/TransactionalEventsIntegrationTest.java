package com.socialfeed.integration.e2e;

import com.socialfeed.application.event.DomainEventHandler;
import com.socialfeed.application.event.EventBus;
import com.socialfeed.application.port.in.CreateContentUseCase;
import com.socialfeed.application.port.in.GetNewFeedUseCase;
import com.socialfeed.application.port.in.GetNotificationsUseCase;
import com.socialfeed.application.port.in.LikeContentUseCase;
import com.socialfeed.domain.event.ContentCreated;
import com.socialfeed.domain.model.ContentItem;
import com.socialfeed.domain.model.NotificationAction;
import com.socialfeed.domain.model.NotificationRecord;
import com.socialfeed.domain.model.UserId;
import com.socialfeed.integration.base.FullStackTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Writes commit first, then their events reach caches and notifications.
 */
@SpringBootTest
@EnabledIf("isDockerAvailable")
@DisplayName("Transactional events E2E Tests")
class TransactionalEventsIntegrationTest extends FullStackTestBase {

    @Autowired
    private CreateContentUseCase createContent;

    @Autowired
    private LikeContentUseCase likeContent;

    @Autowired
    private GetNewFeedUseCase newFeed;

    @Autowired
    private GetNotificationsUseCase notifications;

    @Autowired
    private EventBus eventBus;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Test
    @DisplayName("New content invalidates the cached new feed")
    void shouldInvalidateNewFeedAfterCreate() {
        // Given
        UserId alice = UserId.random();
        assertEquals(0, newFeed.getNewFeed(20, 0).items().size());
        assertTrue(Boolean.TRUE.equals(stringRedisTemplate.hasKey("new_feed:1:20")));

        // When
        ContentItem created = createContent.createContent(alice, "hello world", List.of("java")).getOrThrow();

        // Then
        var page = newFeed.getNewFeed(20, 0);
        assertEquals(1, page.items().size());
        assertEquals(created.id(), page.items().get(0).content().id());
    }

    @Test
    @DisplayName("Liking someone's content notifies the author once")
    void shouldNotifyAuthorOnLike() {
        // Given
        UserId alice = UserId.random();
        UserId bob = UserId.random();
        ContentItem created = createContent.createContent(alice, "like me", List.of("java")).getOrThrow();

        // When
        assertEquals(1L, likeContent.likeContent(bob, created.id()).getOrThrow());
        assertTrue(likeContent.likeContent(bob, created.id()).isFailure());

        // Then
        List<NotificationRecord> received = notifications.getNotifications(alice, 10, null);
        assertEquals(1, received.size());
        assertEquals(NotificationAction.LIKE, received.get(0).actionType());
        assertEquals(bob, received.get(0).actorId());
        assertEquals(1, notifications.getUnreadCount(alice));
    }

    @Test
    @DisplayName("Events queued in a rolled back transaction are discarded")
    void shouldDiscardEventsOnRollback() {
        // Given
        List<ContentCreated> seen = new ArrayList<>();
        DomainEventHandler<ContentCreated> recorder = new DomainEventHandler<>() {
            @Override
            public Class<ContentCreated> eventType() {
                return ContentCreated.class;
            }

            @Override
            public void handle(ContentCreated event) {
                seen.add(event);
            }
        };
        ContentItem item = ContentItem.create(UUID.randomUUID(), UserId.random(), "draft", List.of(), null).getOrThrow();

        // When
        transactionTemplate.executeWithoutResult(status -> {
            eventBus.queueTransactional(ContentCreated.from(UUID.randomUUID(), item), recorder);
            status.setRollbackOnly();
        });
        transactionTemplate.executeWithoutResult(status ->
            eventBus.queueTransactional(ContentCreated.from(UUID.randomUUID(), item), recorder));

        // Then
        assertEquals(1, seen.size());
    }
}
