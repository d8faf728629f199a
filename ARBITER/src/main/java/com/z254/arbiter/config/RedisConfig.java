package com.z254.arbiter.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.z254.arbiter.store.DriftHistoryStore;
import com.z254.arbiter.store.FeedbackStore;
import com.z254.arbiter.store.PredictionLog;
import com.z254.arbiter.store.redis.RedisDriftHistoryStore;
import com.z254.arbiter.store.redis.RedisFeedbackStore;
import com.z254.arbiter.store.redis.RedisPredictionLog;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Clock;

/**
 * Redis configuration for the prediction log, feedback store and drift
 * history. Values are JSON strings written through a string template.
 */
@Configuration
@ConditionalOnProperty(name = "arbiter.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    private final ArbiterProperties properties;
    private final ObjectMapper storeMapper;

    public RedisConfig(ArbiterProperties properties) {
        this.properties = properties;
        this.storeMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public ReactiveRedisTemplate<String, String> arbiterRedisTemplate(
            ReactiveRedisConnectionFactory connectionFactory) {
        StringRedisSerializer serializer = new StringRedisSerializer();
        RedisSerializationContext<String, String> context = RedisSerializationContext
                .<String, String>newSerializationContext(serializer)
                .value(serializer)
                .build();
        return new ReactiveRedisTemplate<>(connectionFactory, context);
    }

    @Bean
    public PredictionLog predictionLog(
            @Qualifier("arbiterRedisTemplate") ReactiveRedisTemplate<String, String> arbiterRedisTemplate,
            Clock clock) {
        ArbiterProperties.Store store = properties.getStore();
        return new RedisPredictionLog(arbiterRedisTemplate, storeMapper, store.getKeyPrefix(),
                store.getPredictionTtl(), clock);
    }

    @Bean
    public FeedbackStore feedbackStore(
            @Qualifier("arbiterRedisTemplate") ReactiveRedisTemplate<String, String> arbiterRedisTemplate) {
        ArbiterProperties.Store store = properties.getStore();
        return new RedisFeedbackStore(arbiterRedisTemplate, storeMapper, store.getKeyPrefix(), store.getFeedbackTtl());
    }

    @Bean
    public DriftHistoryStore driftHistoryStore(
            @Qualifier("arbiterRedisTemplate") ReactiveRedisTemplate<String, String> arbiterRedisTemplate) {
        ArbiterProperties.Store store = properties.getStore();
        return new RedisDriftHistoryStore(arbiterRedisTemplate, storeMapper, store.getKeyPrefix(),
                store.getDriftHistoryLimit());
    }
}
