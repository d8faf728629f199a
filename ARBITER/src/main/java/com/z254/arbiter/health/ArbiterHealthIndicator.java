package com.z254.arbiter.health;

import com.z254.arbiter.config.ArbiterProperties;
import com.z254.arbiter.domain.model.ModelType;
import com.z254.arbiter.registry.ModelBootstrapper;
import com.z254.arbiter.registry.ModelRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.data.redis.connection.ReactiveRedisConnection;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Health indicator for ARBITER service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Active model version per type and degraded types</li>
 *     <li>Store mode, with a Redis ping in redis mode</li>
 *     <li>Drift configuration</li>
 * </ul>
 * The service is DOWN only when no model type has an active version; a
 * degraded type still serves conservative fallback decisions.
 */
@Slf4j
@Component
public class ArbiterHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration PING_TIMEOUT = Duration.ofSeconds(2);

    private final ModelRegistry registry;
    private final ModelBootstrapper bootstrapper;
    private final ArbiterProperties properties;
    private final ObjectProvider<ReactiveRedisConnectionFactory> redisConnectionFactory;

    public ArbiterHealthIndicator(ModelRegistry registry,
                                  ModelBootstrapper bootstrapper,
                                  ArbiterProperties properties,
                                  ObjectProvider<ReactiveRedisConnectionFactory> redisConnectionFactory) {
        this.registry = registry;
        this.bootstrapper = bootstrapper;
        this.properties = properties;
        this.redisConnectionFactory = redisConnectionFactory;
    }

    @Override
    public Mono<Health> health() {
        return storeStatus().map(this::checkHealth);
    }

    private Health checkHealth(String storeStatus) {
        Map<String, Object> details = new HashMap<>();
        Map<ModelType, String> active = registry.activeVersions();
        Set<ModelType> degraded = bootstrapper.degradedTypes();

        details.put("activeVersions", active);
        details.put("degradedTypes", degraded);
        details.put("activeAbTests", registry.getActiveAbTests().size());
        details.put("storeType", properties.getStore().getType().name());
        details.put("store", storeStatus);
        details.put("driftMode", properties.getDrift().getMode().name());
        details.put("inferenceTimeout", properties.getPrediction().getInferenceTimeout().toString());

        if (active.isEmpty()) {
            return Health.down()
                    .withDetail("error", "No active model version for any type")
                    .withDetails(details)
                    .build();
        }
        return Health.up()
                .withDetails(details)
                .build();
    }

    private Mono<String> storeStatus() {
        if (properties.getStore().getType() != ArbiterProperties.StoreType.REDIS) {
            return Mono.just("IN_MEMORY");
        }
        ReactiveRedisConnectionFactory factory = redisConnectionFactory.getIfAvailable();
        if (factory == null) {
            return Mono.just("NOT_CONFIGURED");
        }
        return Mono.usingWhen(
                        Mono.fromSupplier(factory::getReactiveConnection),
                        ReactiveRedisConnection::ping,
                        ReactiveRedisConnection::closeLater)
                .map(pong -> "UP")
                .timeout(PING_TIMEOUT)
                .onErrorResume(error -> {
                    log.warn("Redis ping failed: {}", error.getMessage());
                    return Mono.just("UNREACHABLE: " + error.getMessage());
                });
    }
}
