package com.z254.arbiter.config;

import com.z254.arbiter.store.CorrectionStore;
import com.z254.arbiter.store.DriftAlertPublisher;
import com.z254.arbiter.store.kafka.KafkaCorrectionStore;
import com.z254.arbiter.store.kafka.KafkaDriftAlertPublisher;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producers for correction records and drift alerts.
 * <p>
 * Provides:
 * <ul>
 *     <li>JSON producer factory with idempotent configuration</li>
 *     <li>Topic definitions for corrections and drift alerts</li>
 * </ul>
 */
@Configuration
@ConditionalOnProperty(name = "arbiter.store.type", havingValue = "redis", matchIfMissing = true)
public class KafkaConfig {

    private final KafkaProperties kafkaProperties;
    private final ArbiterProperties arbiterProperties;

    public KafkaConfig(KafkaProperties kafkaProperties, ArbiterProperties arbiterProperties) {
        this.kafkaProperties = kafkaProperties;
        this.arbiterProperties = arbiterProperties;
    }

    // ==================== Producer Configuration ====================

    @Bean
    public ProducerFactory<String, Object> producerFactory() {
        Map<String, Object> props = new HashMap<>(kafkaProperties.buildProducerProperties(null));

        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);

        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 30000);
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, 10000);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, 5000);

        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, Object> kafkaTemplate() {
        KafkaTemplate<String, Object> template = new KafkaTemplate<>(producerFactory());
        template.setObservationEnabled(true);
        return template;
    }

    // ==================== Stores ====================

    @Bean
    public CorrectionStore correctionStore(KafkaTemplate<String, Object> kafkaTemplate) {
        return new KafkaCorrectionStore(kafkaTemplate, arbiterProperties.getKafka().getTopics().getCorrections());
    }

    @Bean
    public DriftAlertPublisher driftAlertPublisher(KafkaTemplate<String, Object> kafkaTemplate) {
        return new KafkaDriftAlertPublisher(kafkaTemplate, arbiterProperties.getKafka().getTopics().getDriftAlerts());
    }

    // ==================== Topic Definitions ====================

    @Bean
    public NewTopic correctionsTopic() {
        return TopicBuilder.name(arbiterProperties.getKafka().getTopics().getCorrections())
                .partitions(3)
                .replicas(1)
                .config("retention.ms", "-1")
                .build();
    }

    @Bean
    public NewTopic driftAlertsTopic() {
        return TopicBuilder.name(arbiterProperties.getKafka().getTopics().getDriftAlerts())
                .partitions(1)
                .replicas(1)
                .config("retention.ms", "2592000000") // 30 days
                .build();
    }
}
