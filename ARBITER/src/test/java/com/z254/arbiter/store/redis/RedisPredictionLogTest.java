package com.z254.arbiter.store.redis;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.z254.arbiter.domain.model.Decision;
import com.z254.arbiter.domain.model.FeatureVector;
import com.z254.arbiter.domain.model.PredictionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.data.redis.core.ReactiveZSetOperations;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link RedisPredictionLog}.
 */
@ExtendWith(MockitoExtension.class)
class RedisPredictionLogTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private ReactiveRedisTemplate<String, String> redisTemplate;

    @Mock
    private ReactiveValueOperations<String, String> valueOps;

    @Mock
    private ReactiveZSetOperations<String, String> zSetOps;

    private ObjectMapper objectMapper;
    private RedisPredictionLog predictionLog;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        predictionLog = new RedisPredictionLog(redisTemplate, objectMapper, "arbiter:",
                Duration.ofHours(24), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static PredictionRecord record(String requestId) {
        return PredictionRecord.builder()
                .requestId(requestId)
                .decision(Decision.ESCALATE)
                .confidence(0.55)
                .modelVersion("rf-1")
                .features(FeatureVector.builder().intentConfidence(0.3).contentToxicityScore(0.9).build())
                .timestamp(NOW.minusSeconds(60))
                .build();
    }

    @Test
    @DisplayName("should write the record with TTL and index it by timestamp")
    void append() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(redisTemplate.opsForZSet()).thenReturn(zSetOps);
        when(valueOps.setIfAbsent(eq("arbiter:prediction:req-1"), anyString(), eq(Duration.ofHours(24))))
                .thenReturn(Mono.just(true));
        when(zSetOps.add(eq("arbiter:prediction:index"), eq("req-1"), anyDouble())).thenReturn(Mono.just(true));
        when(zSetOps.removeRangeByScore(eq("arbiter:prediction:index"), any())).thenReturn(Mono.just(0L));

        StepVerifier.create(predictionLog.append(record("req-1"))).verifyComplete();

        verify(zSetOps).add("arbiter:prediction:index", "req-1", (double) NOW.minusSeconds(60).toEpochMilli());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Range<Double>> range = ArgumentCaptor.forClass(Range.class);
        verify(zSetOps).removeRangeByScore(eq("arbiter:prediction:index"), range.capture());
        assertThat(range.getValue().getUpperBound().getValue())
                .contains((double) NOW.minus(Duration.ofHours(24)).toEpochMilli());
    }

    @Test
    @DisplayName("should leave an existing record and the index untouched on a repeated request id")
    void appendKeepsFirst() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(eq("arbiter:prediction:req-1"), anyString(), eq(Duration.ofHours(24))))
                .thenReturn(Mono.just(false));

        StepVerifier.create(predictionLog.append(record("req-1"))).verifyComplete();

        verify(valueOps, never()).set(anyString(), anyString(), any(Duration.class));
        verifyNoInteractions(zSetOps);
    }

    @Test
    @DisplayName("should parse a stored record")
    void find() throws Exception {
        PredictionRecord stored = record("req-1");
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("arbiter:prediction:req-1")).thenReturn(Mono.just(objectMapper.writeValueAsString(stored)));

        StepVerifier.create(predictionLog.find("req-1"))
                .assertNext(found -> {
                    assertThat(found.getDecision()).isEqualTo(Decision.ESCALATE);
                    assertThat(found.getTimestamp()).isEqualTo(stored.getTimestamp());
                    assertThat(found.getFeatures().getContentToxicityScore()).isEqualTo(0.9);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should complete empty for an unknown or expired id")
    void findMissing() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("arbiter:prediction:gone")).thenReturn(Mono.empty());

        StepVerifier.create(predictionLog.find("gone")).verifyComplete();
    }

    @Test
    @DisplayName("should skip index members whose record has expired")
    void findBetweenSkipsExpired() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(redisTemplate.opsForZSet()).thenReturn(zSetOps);
        when(zSetOps.rangeByScore(eq("arbiter:prediction:index"), any())).thenReturn(Flux.just("req-1", "req-2"));
        List<String> values = Arrays.asList(objectMapper.writeValueAsString(record("req-1")), null);
        when(valueOps.multiGet(anyList())).thenReturn(Mono.just(values));

        StepVerifier.create(predictionLog.findBetween(NOW.minusSeconds(3600), NOW)
                        .map(PredictionRecord::getRequestId))
                .expectNext("req-1")
                .verifyComplete();
    }
}
