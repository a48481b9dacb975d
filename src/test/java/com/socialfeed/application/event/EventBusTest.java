package com.socialfeed.application.event;

import com.socialfeed.application.port.out.MetricsPort;
import com.socialfeed.domain.event.DomainEvent;
import com.socialfeed.domain.event.UserFollowed;
import com.socialfeed.domain.event.UserUnfollowed;
import com.socialfeed.domain.model.UserId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EventBus")
class EventBusTest {

    @Mock
    private MetricsPort metrics;

    private final List<String> calls = new ArrayList<>();
    private final TransactionTemplate transaction = new TransactionTemplate(new InMemoryTransactionManager());

    private RecordingHandler<UserFollowed> first;
    private RecordingHandler<UserFollowed> second;
    private RecordingHandler<DomainEvent> everything;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        first = new RecordingHandler<>("first", UserFollowed.class);
        second = new RecordingHandler<>("second", UserFollowed.class);
        everything = new RecordingHandler<>("all", DomainEvent.class);
        List<DomainEventHandler<?>> handlers = List.of(first, second, everything);
        eventBus = new EventBus(handlers, metrics);
    }

    private static UserFollowed followed() {
        return UserFollowed.from(UUID.randomUUID(), UserId.random(), UserId.random());
    }

    private static UserUnfollowed unfollowed() {
        return UserUnfollowed.from(UUID.randomUUID(), UserId.random(), UserId.random());
    }

    @Nested
    @DisplayName("publish")
    class PublishTests {

        @Test
        @DisplayName("Should run matching handlers in registration order")
        void shouldRunMatchingHandlersInOrder() {
            // When
            eventBus.publish(followed());
            eventBus.publish(unfollowed());

            // Then
            assertEquals(List.of("first:USER_FOLLOWED", "second:USER_FOLLOWED", "all:USER_FOLLOWED",
                "all:USER_UNFOLLOWED"), calls);
        }

        @Test
        @DisplayName("Should isolate a failing handler from the others")
        void shouldIsolateFailures() {
            // Given
            first.failWith(new IllegalStateException("boom"));

            // When
            eventBus.publish(followed());

            // Then
            assertEquals(List.of("second:USER_FOLLOWED", "all:USER_FOLLOWED"), calls);
            verify(metrics).incrementEventHandlerFailures("USER_FOLLOWED");
        }

        @Test
        @DisplayName("Should include handlers registered later")
        void shouldIncludeRegisteredHandlers() {
            // Given
            eventBus.register(new RecordingHandler<>("late", UserUnfollowed.class));

            // When
            eventBus.publish(unfollowed());

            // Then
            assertEquals(List.of("all:USER_UNFOLLOWED", "late:USER_UNFOLLOWED"), calls);
        }
    }

    @Nested
    @DisplayName("queueTransactional")
    class QueueTransactionalTests {

        @Test
        @DisplayName("Should hold events until commit and flush them in enqueue order")
        void shouldFlushAfterCommit() {
            // When
            transaction.executeWithoutResult(status -> {
                eventBus.queueTransactional(unfollowed());
                eventBus.queueTransactional(followed());
                assertTrue(calls.isEmpty(), "nothing may run before commit");
            });

            // Then
            assertEquals(List.of("all:USER_UNFOLLOWED", "first:USER_FOLLOWED", "second:USER_FOLLOWED",
                "all:USER_FOLLOWED"), calls);
        }

        @Test
        @DisplayName("Should drop events when the transaction rolls back")
        void shouldDropOnRollback() {
            // When
            transaction.executeWithoutResult(status -> {
                eventBus.queueTransactional(followed());
                status.setRollbackOnly();
            });

            // Then
            assertTrue(calls.isEmpty());
        }

        @Test
        @DisplayName("Should drop events when the transaction throws")
        void shouldDropOnException() {
            // When
            assertThrows(IllegalStateException.class, () -> transaction.executeWithoutResult(status -> {
                eventBus.queueTransactional(followed());
                throw new IllegalStateException("write failed");
            }));

            // Then
            assertTrue(calls.isEmpty());
        }

        @Test
        @DisplayName("Should dispatch immediately outside a transaction")
        void shouldDispatchImmediatelyWithoutTransaction() {
            // When
            eventBus.queueTransactional(unfollowed());

            // Then
            assertEquals(List.of("all:USER_UNFOLLOWED"), calls);
        }

        @Test
        @DisplayName("Should deliver to a single handler when one is given")
        void shouldDeliverToSingleHandler() {
            // When
            transaction.executeWithoutResult(status -> eventBus.queueTransactional(followed(), second));

            // Then
            assertEquals(List.of("second:USER_FOLLOWED"), calls);
        }

        @Test
        @DisplayName("Should deliver to a single handler declared for a broader event type")
        void shouldDeliverToSupertypeHandler() {
            // When
            transaction.executeWithoutResult(status -> eventBus.queueTransactional(followed(), everything));

            // Then
            assertEquals(List.of("all:USER_FOLLOWED"), calls);
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("Should dispatch events queued by a handler during the flush")
        void shouldDispatchEventsQueuedWhileFlushing() {
            // Given
            first.onHandle(event -> eventBus.queueTransactional(unfollowed()));

            // When
            transaction.executeWithoutResult(status -> eventBus.queueTransactional(followed()));

            // Then
            assertEquals(List.of("first:USER_FOLLOWED", "all:USER_UNFOLLOWED", "second:USER_FOLLOWED",
                "all:USER_FOLLOWED"), calls);
        }

        @Test
        @DisplayName("Should keep separate queues for separate transactions")
        void shouldKeepQueuesPerTransaction() {
            // When
            transaction.executeWithoutResult(status -> {
                eventBus.queueTransactional(followed());
                status.setRollbackOnly();
            });
            transaction.executeWithoutResult(status -> eventBus.queueTransactional(unfollowed()));

            // Then
            assertEquals(List.of("all:USER_UNFOLLOWED"), calls);
        }
    }

    private final class RecordingHandler<E extends DomainEvent> implements DomainEventHandler<E> {

        private final String name;
        private final Class<E> type;
        private RuntimeException failure;
        private Consumer<E> sideEffect = event -> { };

        RecordingHandler(String name, Class<E> type) {
            this.name = name;
            this.type = type;
        }

        void failWith(RuntimeException failure) {
            this.failure = failure;
        }

        void onHandle(Consumer<E> sideEffect) {
            this.sideEffect = sideEffect;
        }

        @Override
        public Class<E> eventType() {
            return type;
        }

        @Override
        public void handle(E event) {
            if (failure != null) {
                throw failure;
            }
            calls.add(name + ":" + event.eventType());
            sideEffect.accept(event);
        }
    }

    /**
     * Transaction manager without a resource: just enough for synchronization callbacks to fire.
     */
    private static final class InMemoryTransactionManager extends AbstractPlatformTransactionManager {

        @Override
        protected Object doGetTransaction() {
            return new Object();
        }

        @Override
        protected void doBegin(Object transaction, TransactionDefinition definition) {
        }

        @Override
        protected void doCommit(DefaultTransactionStatus status) {
        }

        @Override
        protected void doRollback(DefaultTransactionStatus status) {
        }
    }
}
