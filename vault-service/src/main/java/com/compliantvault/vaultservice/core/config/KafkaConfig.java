package com.compliantvault.vaultservice.core.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    // Outbox payloads are already JSON
    @Bean
    public ProducerFactory<String, String> stringProducerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, String> stringKafkaTemplate() {
        return new KafkaTemplate<>(stringProducerFactory());
    }

    @Bean
    @ConditionalOnProperty(value = "app.kafka.topics.enabled", havingValue = "true", matchIfMissing = true)
    public NewTopic vaultRequestsTopic() {
        return TopicBuilder.name("vault.requests")
                .partitions(3) // Keyed by requestId
                .replicas(1)
                .build();
    }

    @Bean
    @ConditionalOnProperty(value = "app.kafka.topics.enabled", havingValue = "true", matchIfMissing = true)
    public NewTopic vaultSettlementsTopic() {
        return TopicBuilder.name("vault.settlements")
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    @ConditionalOnProperty(value = "app.kafka.topics.enabled", havingValue = "true", matchIfMissing = true)
    public NewTopic vaultAnomaliesTopic() {
        return TopicBuilder.name("vault.anomalies")
                .partitions(1)
                .replicas(1)
                .build();
    }
}
