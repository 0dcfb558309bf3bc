package com.sibol.contract_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the ledger topic. Events are keyed by contract id, so partitions only bound how
 * many contracts consumers can process in parallel.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger:contract-ledger}")
    private String ledgerTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic ledgerTopic() {
        return TopicBuilder.name(ledgerTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
