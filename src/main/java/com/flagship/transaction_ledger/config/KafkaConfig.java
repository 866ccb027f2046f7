package com.flagship.transaction_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.transactions:transactions}")
    private String transactionsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    /**
     * Ledger events topic, keyed by transaction id.
     */
    @Bean
    public NewTopic transactionsTopic() {
        return TopicBuilder.name(transactionsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
