package com.z254.arbiter.store.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.arbiter.domain.model.DriftDetectionResult;
import com.z254.arbiter.store.DriftHistoryStore;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Capped Redis lists of drift results, newest at the head: one per model
 * version plus one across all versions.
 */
public class RedisDriftHistoryStore implements DriftHistoryStore {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final int capacity;

    public RedisDriftHistoryStore(ReactiveRedisTemplate<String, String> redisTemplate,
                                  ObjectMapper objectMapper,
                                  String keyPrefix,
                                  int capacity) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public Mono<Void> append(DriftDetectionResult result) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(result))
                .flatMap(json -> result.getModelVersion() == null
                        ? push(key(null), json)
                        : push(key(result.getModelVersion()), json).then(push(key(null), json)));
    }

    @Override
    public Flux<DriftDetectionResult> history(String modelVersion, int limit) {
        if (limit <= 0) {
            return Flux.empty();
        }
        return redisTemplate.opsForList().range(key(modelVersion), 0, limit - 1)
                .concatMap(json -> Mono.fromCallable(() -> objectMapper.readValue(json, DriftDetectionResult.class)));
    }

    private Mono<Void> push(String key, String json) {
        return redisTemplate.opsForList().leftPush(key, json)
                .then(redisTemplate.opsForList().trim(key, 0, capacity - 1))
                .then();
    }

    private String key(String modelVersion) {
        return modelVersion == null
                ? keyPrefix + "drift:history"
                : keyPrefix + "drift:history:" + modelVersion;
    }
}
