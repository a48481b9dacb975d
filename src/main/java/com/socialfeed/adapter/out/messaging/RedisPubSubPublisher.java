package com.socialfeed.adapter.out.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialfeed.application.port.out.PubSubPort;
import com.socialfeed.infrastructure.resilience.ResiliencePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class RedisPubSubPublisher implements PubSubPort {

    private static final Logger log = LoggerFactory.getLogger(RedisPubSubPublisher.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final ResiliencePolicy resilience;

    public RedisPubSubPublisher(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, ResiliencePolicy resilience) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.resilience = resilience;
    }

    @Override
    public long publish(String channel, Object message) {
        String payload;
        try {
            payload = message instanceof String text ? text : objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize message for channel {}: {}", channel, e.getOriginalMessage());
            return 0;
        }

        return resilience.attempt("pubsub.publish", () -> {
            Long receivers = redisTemplate.convertAndSend(channel, payload);
            return receivers != null ? receivers : 0L;
        }, 0L);
    }
}
