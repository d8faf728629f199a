package com.z254.arbiter.store.kafka;

import com.z254.arbiter.domain.model.CorrectionRecord;
import com.z254.arbiter.store.CorrectionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import reactor.core.publisher.Mono;

/**
 * Publishes correction records to the corrections topic, keyed by request id.
 */
@Slf4j
public class KafkaCorrectionStore implements CorrectionStore {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;

    public KafkaCorrectionStore(KafkaTemplate<String, Object> kafkaTemplate, String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
    }

    @Override
    public Mono<Void> append(CorrectionRecord record) {
        return Mono.fromFuture(() -> kafkaTemplate.send(topic, record.getRequestId(), record))
                .doOnNext(result -> log.debug("Published correction {} to partition {} offset {}",
                        record.getCorrectionId(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset()))
                .then();
    }
}
