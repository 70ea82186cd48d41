package com.flagship.member_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics owned by the member ledger.
 *
 * - finance-events: outgoing domain events (pre-notification mails, reporting)
 * - money-transfers: incoming bank statement lines
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.finance-events:finance-events}")
    private String financeEventsTopic;

    @Value("${kafka.topic.money-transfers:money-transfers}")
    private String moneyTransfersTopic;

    /**
     * Keyed by persona, so three partitions keep per-member ordering.
     */
    @Bean
    public NewTopic financeEventsTopic() {
        return TopicBuilder.name(financeEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic moneyTransfersTopic() {
        return TopicBuilder.name(moneyTransfersTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
