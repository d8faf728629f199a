package com.z254.arbiter.store.kafka;

import com.z254.arbiter.domain.model.DriftDetectionResult;
import com.z254.arbiter.store.DriftAlertPublisher;
import org.springframework.kafka.core.KafkaTemplate;
import reactor.core.publisher.Mono;

/**
 * Publishes detected drift to the alerts topic, keyed by model version.
 */
public class KafkaDriftAlertPublisher implements DriftAlertPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;

    public KafkaDriftAlertPublisher(KafkaTemplate<String, Object> kafkaTemplate, String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
    }

    @Override
    public Mono<Void> publish(DriftDetectionResult result) {
        return Mono.fromFuture(() -> kafkaTemplate.send(topic, result.getModelVersion(), result)).then();
    }
}
