package com.socialfeed.application.service;

import com.socialfeed.application.event.EventBus;
import com.socialfeed.application.port.in.CreateNotificationUseCase;
import com.socialfeed.application.port.in.CreateNotificationUseCase.NewNotification;
import com.socialfeed.application.port.out.FollowRepository;
import com.socialfeed.application.port.out.IdGenerator;
import com.socialfeed.application.port.out.MetricsPort;
import com.socialfeed.application.port.out.UserRepository;
import com.socialfeed.domain.error.FollowError;
import com.socialfeed.domain.event.UserFollowed;
import com.socialfeed.domain.event.UserUnfollowed;
import com.socialfeed.domain.model.NotificationAction;
import com.socialfeed.domain.model.UserId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FollowService.
 * Tests service logic with mocked dependencies.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("FollowService")
class FollowServiceTest {

    @Mock
    private FollowRepository followRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private CreateNotificationUseCase notifications;

    @Mock
    private EventBus eventBus;

    @Mock
    private IdGenerator idGenerator;

    @Mock
    private MetricsPort metrics;

    private FollowService followService;

    @BeforeEach
    void setUp() {
        followService = new FollowService(
                followRepository, userRepository, notifications, eventBus, idGenerator, metrics
        );
    }

    @Nested
    @DisplayName("followUser")
    class FollowUserTests {

        @Test
        @DisplayName("Should create follow relationship")
        void shouldCreateFollowRelationship() {
            // Given
            UserId follower = UserId.random();
            UserId followee = UserId.random();

            when(followRepository.exists(follower, followee)).thenReturn(false);
            when(followRepository.save(any())).thenReturn(true);
            when(idGenerator.generate()).thenReturn(UUID.randomUUID());

            // When
            var result = followService.followUser(follower, followee);

            // Then
            assertTrue(result.isSuccess());
            verify(followRepository).save(any());
            verify(userRepository, times(2)).upsert(any());
            verify(eventBus).queueTransactional(any(UserFollowed.class));
            verify(metrics).incrementFollows();
        }

        @Test
        @DisplayName("Should notify the followee")
        void shouldNotifyFollowee() {
            // Given
            UserId follower = UserId.random();
            UserId followee = UserId.random();
            when(followRepository.save(any())).thenReturn(true);
            when(idGenerator.generate()).thenReturn(UUID.randomUUID());
            ArgumentCaptor<NewNotification> captor = ArgumentCaptor.forClass(NewNotification.class);

            // When
            followService.followUser(follower, followee);

            // Then
            verify(notifications).createNotification(captor.capture());
            NewNotification notification = captor.getValue();
            assertEquals(followee, notification.receiverId());
            assertEquals(follower, notification.actorId());
            assertEquals(NotificationAction.FOLLOW, notification.actionType());
            assertEquals("user", notification.targetType());
        }

        @Test
        @DisplayName("Should fail when following self")
        void shouldFailWhenFollowingSelf() {
            // Given
            UserId user = UserId.random();

            // When
            var result = followService.followUser(user, user);

            // Then
            assertTrue(result.isFailure());
            assertInstanceOf(FollowError.ValidationFailed.class, result.errorOrNull());
            verifyNoInteractions(followRepository, eventBus, notifications);
        }

        @Test
        @DisplayName("Should fail when already following")
        void shouldFailWhenAlreadyFollowing() {
            // Given
            UserId follower = UserId.random();
            UserId followee = UserId.random();

            when(followRepository.exists(follower, followee)).thenReturn(true);

            // When
            var result = followService.followUser(follower, followee);

            // Then
            assertTrue(result.isFailure());
            assertInstanceOf(FollowError.AlreadyFollowing.class, result.errorOrNull());
            verify(followRepository, never()).save(any());
            verifyNoInteractions(eventBus, notifications);
        }

        @Test
        @DisplayName("Should fail without side effects when a concurrent follow inserted the edge first")
        void shouldFailWhenEdgeInsertedConcurrently() {
            // Given
            UserId follower = UserId.random();
            UserId followee = UserId.random();

            when(followRepository.exists(follower, followee)).thenReturn(false);
            when(followRepository.save(any())).thenReturn(false);

            // When
            var result = followService.followUser(follower, followee);

            // Then
            assertTrue(result.isFailure());
            assertInstanceOf(FollowError.AlreadyFollowing.class, result.errorOrNull());
            verifyNoInteractions(eventBus, notifications, idGenerator);
            verify(metrics, never()).incrementFollows();
        }
    }

    @Nested
    @DisplayName("unfollow")
    class UnfollowTests {

        @Test
        @DisplayName("Should delete follow relationship")
        void shouldDeleteFollowRelationship() {
            // Given
            UserId follower = UserId.random();
            UserId followee = UserId.random();

            when(followRepository.exists(follower, followee)).thenReturn(true);
            when(followRepository.delete(follower, followee)).thenReturn(true);
            when(idGenerator.generate()).thenReturn(UUID.randomUUID());

            // When
            var result = followService.unfollow(follower, followee);

            // Then
            assertTrue(result.isSuccess());
            verify(followRepository).delete(follower, followee);
            verify(eventBus).queueTransactional(any(UserUnfollowed.class));
            verify(metrics).incrementUnfollows();
        }

        @Test
        @DisplayName("Should fail when not following")
        void shouldFailWhenNotFollowing() {
            // Given
            UserId follower = UserId.random();
            UserId followee = UserId.random();

            when(followRepository.exists(follower, followee)).thenReturn(false);

            // When
            var result = followService.unfollow(follower, followee);

            // Then
            assertTrue(result.isFailure());
            assertInstanceOf(FollowError.NotFollowing.class, result.errorOrNull());
            verify(followRepository, never()).delete(any(), any());
            verifyNoInteractions(eventBus);
        }

        @Test
        @DisplayName("Should not publish twice when a concurrent unfollow removed the edge first")
        void shouldFailWhenEdgeRemovedConcurrently() {
            // Given
            UserId follower = UserId.random();
            UserId followee = UserId.random();

            when(followRepository.exists(follower, followee)).thenReturn(true);
            when(followRepository.delete(follower, followee)).thenReturn(false);

            // When
            var result = followService.unfollow(follower, followee);

            // Then
            assertTrue(result.isFailure());
            assertInstanceOf(FollowError.NotFollowing.class, result.errorOrNull());
            verifyNoInteractions(eventBus);
            verify(metrics, never()).incrementUnfollows();
        }
    }
}
