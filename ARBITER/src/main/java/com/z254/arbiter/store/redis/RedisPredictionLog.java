package com.z254.arbiter.store.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.arbiter.domain.model.PredictionRecord;
import com.z254.arbiter.store.PredictionLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Redis-backed {@link PredictionLog}.
 * <p>
 * Each record is a JSON string under {@code <prefix>prediction:<requestId>}
 * with the configured TTL, written only if absent so a logged entry is never
 * replaced. A sorted set {@code <prefix>prediction:index}
 * scores request ids by timestamp for windowed reads; index members older
 * than the TTL are pruned on append.
 */
@Slf4j
public class RedisPredictionLog implements PredictionLog {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration ttl;
    private final Clock clock;

    public RedisPredictionLog(ReactiveRedisTemplate<String, String> redisTemplate,
                              ObjectMapper objectMapper,
                              String keyPrefix,
                              Duration ttl,
                              Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public Mono<Void> append(PredictionRecord record) {
        String requestId = record.getRequestId();
        Instant timestamp = record.getTimestamp() != null ? record.getTimestamp() : clock.instant();
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(record))
                .flatMap(json -> redisTemplate.opsForValue().setIfAbsent(recordKey(requestId), json, ttl))
                .flatMap(created -> {
                    if (!Boolean.TRUE.equals(created)) {
                        log.debug("Prediction {} already logged, keeping the first entry", requestId);
                        return Mono.<Void>empty();
                    }
                    return redisTemplate.opsForZSet().add(indexKey(), requestId, timestamp.toEpochMilli())
                            .then(pruneIndex())
                            .doOnSuccess(v -> log.debug("Logged prediction {}", requestId));
                })
                .then();
    }

    @Override
    public Mono<PredictionRecord> find(String requestId) {
        return redisTemplate.opsForValue().get(recordKey(requestId))
                .flatMap(this::parse);
    }

    @Override
    public Flux<PredictionRecord> findBetween(Instant from, Instant to) {
        Range<Double> window = Range.rightOpen((double) from.toEpochMilli(), (double) to.toEpochMilli());
        return redisTemplate.opsForZSet().rangeByScore(indexKey(), window)
                .map(this::recordKey)
                .collectList()
                .flatMapMany(keys -> keys.isEmpty()
                        ? Flux.empty()
                        : redisTemplate.opsForValue().multiGet(keys).flatMapIterable(RedisPredictionLog::present))
                .concatMap(this::parse);
    }

    private Mono<Void> pruneIndex() {
        double cutoff = clock.instant().minus(ttl).toEpochMilli();
        return redisTemplate.opsForZSet()
                .removeRangeByScore(indexKey(), Range.closed(Double.NEGATIVE_INFINITY, cutoff))
                .then();
    }

    private Mono<PredictionRecord> parse(String json) {
        return Mono.fromCallable(() -> objectMapper.readValue(json, PredictionRecord.class));
    }

    private static List<String> present(List<String> values) {
        return values.stream().filter(Objects::nonNull).toList();
    }

    String recordKey(String requestId) {
        return keyPrefix + "prediction:" + requestId;
    }

    String indexKey() {
        return keyPrefix + "prediction:index";
    }
}
