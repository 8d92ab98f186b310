package com.flagship.revenue_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics owned or consumed by the ledger.
 *
 * - ledger events (outbox), keyed by aggregate id for per-transaction ordering
 * - completed payments (inbound from the payment subsystem)
 * - operator alerts and payee notifications (fire-and-forget)
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger-events:ledger.events}")
    private String ledgerEventsTopic;

    @Value("${kafka.topic.payments-completed:payments.completed}")
    private String paymentsCompletedTopic;

    @Value("${kafka.topic.alerts:ledger.alerts}")
    private String alertsTopic;

    @Value("${kafka.topic.payee-notifications:payee.notifications}")
    private String payeeNotificationsTopic;

    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic paymentsCompletedTopic() {
        return TopicBuilder.name(paymentsCompletedTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic alertsTopic() {
        return TopicBuilder.name(alertsTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic payeeNotificationsTopic() {
        return TopicBuilder.name(payeeNotificationsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
