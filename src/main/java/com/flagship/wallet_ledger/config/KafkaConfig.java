package com.flagship.wallet_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for committed ledger transactions.
 *
 * Only declared when the outbox publisher runs; without a publisher nothing
 * writes to the topic and the admin client has no reason to reach the broker.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.ledger-transactions:ledger-transactions}")
    private String ledgerTransactionsTopic;

    /**
     * Keyed by transaction id, so 3 partitions keep per-transaction ordering
     * while letting consumers scale out.
     */
    @Bean
    public NewTopic ledgerTransactionsTopic() {
        return TopicBuilder.name(ledgerTransactionsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
