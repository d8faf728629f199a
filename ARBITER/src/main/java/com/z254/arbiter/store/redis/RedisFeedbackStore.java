package com.z254.arbiter.store.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.arbiter.domain.model.FeedbackRecord;
import com.z254.arbiter.store.FeedbackStore;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Feedback records as JSON under {@code <prefix>feedback:<requestId>} with TTL.
 */
public class RedisFeedbackStore implements FeedbackStore {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration ttl;

    public RedisFeedbackStore(ReactiveRedisTemplate<String, String> redisTemplate,
                              ObjectMapper objectMapper,
                              String keyPrefix,
                              Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
        this.ttl = ttl;
    }

    @Override
    public Mono<Void> save(FeedbackRecord record) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(record))
                .flatMap(json -> redisTemplate.opsForValue().set(key(record.getRequestId()), json, ttl))
                .then();
    }

    @Override
    public Mono<FeedbackRecord> find(String requestId) {
        return redisTemplate.opsForValue().get(key(requestId))
                .flatMap(json -> Mono.fromCallable(() -> objectMapper.readValue(json, FeedbackRecord.class)));
    }

    private String key(String requestId) {
        return keyPrefix + "feedback:" + requestId;
    }
}
