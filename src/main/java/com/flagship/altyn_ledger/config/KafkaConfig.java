package com.flagship.altyn_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    /**
     * Ledger events are keyed by aggregate id; three partitions keep per-aggregate
     * order while letting consumers scale out.
     */
    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
