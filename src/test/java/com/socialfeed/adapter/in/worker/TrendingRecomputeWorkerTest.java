package com.socialfeed.adapter.in.worker;

import com.socialfeed.application.port.in.GetNewFeedUseCase;
import com.socialfeed.application.port.in.GetTrendingFeedUseCase;
import com.socialfeed.application.port.out.FeedCachePort;
import com.socialfeed.infrastructure.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TrendingRecomputeWorker")
class TrendingRecomputeWorkerTest {

    @Mock
    private FeedCachePort feedCache;

    @Mock
    private GetTrendingFeedUseCase trendingFeed;

    @Mock
    private GetNewFeedUseCase newFeed;

    private TrendingRecomputeWorker worker;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.getFeed().setDefaultPageSize(20);
        properties.getTrending().setPrewarmPages(3);
        worker = new TrendingRecomputeWorker(feedCache, trendingFeed, newFeed, properties);
    }

    @Test
    @DisplayName("Should invalidate discovery feeds before prewarming the first pages")
    void shouldInvalidateThenPrewarm() {
        // When
        worker.recompute();

        // Then
        InOrder order = inOrder(feedCache, trendingFeed);
        order.verify(feedCache).invalidateTags(List.of("trending_feed", "new_feed"));
        order.verify(trendingFeed).getTrendingFeed(20, 0);
        verify(trendingFeed).getTrendingFeed(20, 20);
        verify(trendingFeed).getTrendingFeed(20, 40);
        verify(newFeed).getNewFeed(20, 0);
        verify(newFeed).getNewFeed(20, 20);
        verify(newFeed).getNewFeed(20, 40);
    }

    @Test
    @DisplayName("Should contain failures until the next scheduled run")
    void shouldContainFailures() {
        // Given
        when(trendingFeed.getTrendingFeed(anyInt(), anyInt())).thenThrow(new IllegalStateException("db down"));

        // When
        worker.recompute();

        // Then
        verify(trendingFeed, times(1)).getTrendingFeed(anyInt(), anyInt());
        verifyNoInteractions(newFeed);
    }
}
