package com.socialfeed.adapter.in.realtime;

import com.socialfeed.adapter.in.worker.ProfileSyncWorker;
import com.socialfeed.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Subscribes this node to the cross-process channels: realtime traffic goes to the dispatcher,
 * profile snapshots to the profile-sync worker.
 */
@Configuration
public class RedisRealtimeSubscriber {

    private static final Logger log = LoggerFactory.getLogger(RedisRealtimeSubscriber.class);

    @Bean
    public RedisMessageListenerContainer realtimeListenerContainer(
            RedisConnectionFactory connectionFactory,
            RealtimeDispatcher dispatcher,
            ProfileSyncWorker profileSyncWorker,
            AppProperties appProperties) {
        AppProperties.Realtime realtime = appProperties.getRealtime();
        List<ChannelTopic> realtimeTopics = List.of(
            new ChannelTopic(realtime.getFeedChannel()),
            new ChannelTopic(realtime.getMessagingChannel()),
            new ChannelTopic(realtime.getNotificationChannel())
        );

        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(dispatchingListener(dispatcher), realtimeTopics);
        container.addMessageListener(profileSyncWorker, new ChannelTopic(realtime.getProfileChannel()));
        container.setErrorHandler(e -> log.error("Redis listener error: {}", e.getMessage(), e));

        log.info("Subscribing to realtime channels {} and profile channel {}", realtimeTopics, realtime.getProfileChannel());
        return container;
    }

    static MessageListener dispatchingListener(RealtimeDispatcher dispatcher) {
        return (Message message, byte[] pattern) -> dispatcher.dispatch(
            new String(message.getChannel(), StandardCharsets.UTF_8),
            new String(message.getBody(), StandardCharsets.UTF_8));
    }
}
